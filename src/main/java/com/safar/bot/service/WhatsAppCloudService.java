package com.safar.bot.service;

import com.safar.bot.conversation.MenuOption;
import com.safar.bot.conversation.OutboundInstruction;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends replies through the WhatsApp Cloud API. Menus of up to three options go out as
 * reply buttons, larger ones as a single-section list.
 */
@Service
@ConditionalOnProperty(name = "messaging.provider", havingValue = "meta", matchIfMissing = true)
public class WhatsAppCloudService implements OutboundTransport {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppCloudService.class);

    private static final String GRAPH_API_BASE = "https://graph.facebook.com";
    static final int MAX_BUTTONS = 3;
    private static final int BUTTON_TITLE_MAX = 20;
    private static final int ROW_TITLE_MAX = 24;
    private static final int ROW_DESCRIPTION_MAX = 72;
    private static final int BODY_MAX = ReplyFactory.MENU_BODY_MAX;

    @Value("${whatsapp.access-token:}")
    private String accessToken;

    @Value("${whatsapp.phone-number-id:}")
    private String phoneNumberId;

    @Value("${whatsapp.api-version:v18.0}")
    private String apiVersion = "v18.0";

    private final RestTemplate restTemplate;

    public WhatsAppCloudService(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    @Override
    public void send(OutboundInstruction instruction) {
        if (instruction == null || StringUtils.isBlank(instruction.getRecipientId())) {
            return;
        }
        if (StringUtils.isAnyBlank(accessToken, phoneNumberId)) {
            log.warn("WhatsApp credentials not set; skipping send to {}", instruction.getRecipientId());
            return;
        }
        String url = GRAPH_API_BASE + "/" + apiVersion + "/" + phoneNumberId + "/messages";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(accessToken);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url,
                    new HttpEntity<>(buildPayload(instruction), headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("WhatsApp API returned {} for {}", response.getStatusCode(), instruction.getRecipientId());
            }
        } catch (Exception e) {
            log.error("WhatsApp send failed for {}", instruction.getRecipientId(), e);
        }
    }

    Map<String, Object> buildPayload(OutboundInstruction instruction) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messaging_product", "whatsapp");
        payload.put("recipient_type", "individual");
        payload.put("to", instruction.getRecipientId());
        switch (instruction.getKind()) {
            case BUTTON_MENU:
                if (instruction.getOptions().isEmpty()) {
                    putText(payload, instruction.getContent(), false);
                } else {
                    payload.put("type", "interactive");
                    payload.put("interactive", instruction.getOptions().size() <= MAX_BUTTONS
                            ? buttons(instruction)
                            : list(instruction));
                }
                break;
            case DOCUMENT_LINK:
                putText(payload, instruction.getContent() + "\n" + instruction.getLink(), true);
                break;
            case TEXT:
            default:
                putText(payload, instruction.getContent(), false);
                break;
        }
        return payload;
    }

    private void putText(Map<String, Object> payload, String body, boolean previewUrl) {
        Map<String, Object> text = new LinkedHashMap<>();
        text.put("preview_url", previewUrl);
        text.put("body", StringUtils.defaultString(body));
        payload.put("type", "text");
        payload.put("text", text);
    }

    private Map<String, Object> buttons(OutboundInstruction instruction) {
        List<Map<String, Object>> buttons = new ArrayList<>();
        for (MenuOption option : instruction.getOptions()) {
            Map<String, Object> reply = new LinkedHashMap<>();
            reply.put("id", option.getId());
            reply.put("title", StringUtils.abbreviate(option.getTitle(), BUTTON_TITLE_MAX));
            Map<String, Object> button = new LinkedHashMap<>();
            button.put("type", "reply");
            button.put("reply", reply);
            buttons.add(button);
        }
        Map<String, Object> interactive = new LinkedHashMap<>();
        interactive.put("type", "button");
        interactive.put("body", Map.of("text", body(instruction)));
        interactive.put("action", Map.of("buttons", buttons));
        return interactive;
    }

    private Map<String, Object> list(OutboundInstruction instruction) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (MenuOption option : instruction.getOptions().subList(0,
                Math.min(ReplyFactory.MAX_OPTIONS, instruction.getOptions().size()))) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", option.getId());
            row.put("title", StringUtils.abbreviate(option.getTitle(), ROW_TITLE_MAX));
            if (StringUtils.isNotBlank(option.getDescription())) {
                row.put("description", StringUtils.abbreviate(option.getDescription(), ROW_DESCRIPTION_MAX));
            }
            rows.add(row);
        }
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("title", "Options");
        section.put("rows", rows);
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("button", "Choose");
        action.put("sections", List.of(section));
        Map<String, Object> interactive = new LinkedHashMap<>();
        interactive.put("type", "list");
        interactive.put("body", Map.of("text", body(instruction)));
        interactive.put("action", action);
        return interactive;
    }

    private static String body(OutboundInstruction instruction) {
        return StringUtils.abbreviate(StringUtils.defaultIfBlank(instruction.getContent(), "Please choose:"), BODY_MAX);
    }
}
