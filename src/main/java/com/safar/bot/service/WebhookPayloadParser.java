package com.safar.bot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safar.bot.conversation.InboundEvent;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns webhook bodies into inbound events. Unsupported message types are skipped.
 */
@Component
public class WebhookPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(WebhookPayloadParser.class);

    private final ObjectMapper objectMapper;

    public WebhookPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * WhatsApp Cloud API: {@code entry[].changes[].value.messages[]}.
     *
     * @throws IllegalArgumentException if the body is not JSON
     */
    public List<InboundEvent> parseMeta(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(StringUtils.defaultIfBlank(body, "{}"));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook body is not JSON", e);
        }
        List<InboundEvent> events = new ArrayList<>();
        for (JsonNode entry : root.path("entry")) {
            for (JsonNode change : entry.path("changes")) {
                for (JsonNode message : change.path("value").path("messages")) {
                    toEvent(message).ifPresent(events::add);
                }
            }
        }
        return events;
    }

    /** Twilio WhatsApp form post. */
    public Optional<InboundEvent> parseTwilio(Map<String, String> params) {
        if (params == null) {
            return Optional.empty();
        }
        String from = StringUtils.removeStart(StringUtils.trimToEmpty(params.get("From")), "whatsapp:");
        from = StringUtils.removeStart(from, "+");
        if (from.isEmpty()) {
            return Optional.empty();
        }
        String payload = params.get("ButtonPayload");
        if (StringUtils.isNotBlank(payload)) {
            return Optional.of(InboundEvent.button(from, payload.trim()));
        }
        String body = params.get("Body");
        if (StringUtils.isBlank(body)) {
            return Optional.empty();
        }
        return Optional.of(InboundEvent.text(from, body.trim()));
    }

    private Optional<InboundEvent> toEvent(JsonNode message) {
        String from = message.path("from").asText("");
        String type = message.path("type").asText("");
        if (from.isEmpty()) {
            return Optional.empty();
        }
        switch (type) {
            case "text": {
                String body = message.path("text").path("body").asText("");
                return body.isBlank() ? Optional.empty() : Optional.of(InboundEvent.text(from, body));
            }
            case "interactive": {
                JsonNode interactive = message.path("interactive");
                JsonNode reply = interactive.has("button_reply")
                        ? interactive.path("button_reply")
                        : interactive.path("list_reply");
                String id = reply.path("id").asText("");
                return id.isEmpty() ? Optional.empty() : Optional.of(InboundEvent.button(from, id));
            }
            case "button": {
                String payload = message.path("button").path("payload").asText("");
                return payload.isEmpty() ? Optional.empty() : Optional.of(InboundEvent.button(from, payload));
            }
            default:
                log.debug("Ignoring WhatsApp message type '{}' from {}", type, from);
                return Optional.empty();
        }
    }
}
