package com.safar.bot.controller;

import com.safar.bot.conversation.InboundEvent;
import com.safar.bot.service.ConversationOrchestrator;
import com.safar.bot.service.WebhookPayloadParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/webhook")
public class WhatsAppWebhookController {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppWebhookController.class);

    private final WebhookPayloadParser parser;
    private final ConversationOrchestrator orchestrator;

    @Value("${whatsapp.verify-token:}")
    private String verifyToken;

    public WhatsAppWebhookController(WebhookPayloadParser parser, ConversationOrchestrator orchestrator) {
        this.parser = parser;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/whatsapp")
    public ResponseEntity<String> verify(@RequestParam(name = "hub.mode", required = false) String mode,
                                         @RequestParam(name = "hub.verify_token", required = false) String token,
                                         @RequestParam(name = "hub.challenge", required = false) String challenge) {
        if ("subscribe".equals(mode) && StringUtils.hasText(verifyToken) && verifyToken.equals(token)) {
            log.info("WhatsApp webhook verified");
            return ResponseEntity.ok(challenge != null ? challenge : "");
        }
        log.warn("WhatsApp webhook verification failed (mode={})", mode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Forbidden");
    }

    /** Always 200 so the platform does not redeliver. */
    @PostMapping(value = "/whatsapp", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> receive(@RequestBody(required = false) String body) {
        log.debug("WhatsApp webhook body: {}", body);
        try {
            List<InboundEvent> events = parser.parseMeta(body);
            for (InboundEvent event : events) {
                orchestrator.handle(event);
            }
            return ResponseEntity.ok(Map.of("status", "ok"));
        } catch (RuntimeException e) {
            log.error("WhatsApp webhook processing failed", e);
            return ResponseEntity.ok(Map.of("status", "error"));
        }
    }

    @PostMapping(value = "/twilio", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> twilio(@RequestParam(required = false) Map<String, String> params) {
        try {
            Optional<InboundEvent> event = parser.parseTwilio(params);
            event.ifPresent(orchestrator::handle);
        } catch (RuntimeException e) {
            log.error("Twilio webhook processing failed", e);
        }
        return ResponseEntity.ok("<Response></Response>");
    }
}
