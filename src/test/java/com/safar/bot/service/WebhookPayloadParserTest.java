package com.safar.bot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safar.bot.conversation.InboundEvent;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WebhookPayloadParserTest {

    private final WebhookPayloadParser parser = new WebhookPayloadParser(new ObjectMapper());

    private static String meta(String message) {
        return "{\"object\":\"whatsapp_business_account\",\"entry\":[{\"changes\":[{\"value\":{"
                + "\"messaging_product\":\"whatsapp\",\"messages\":[" + message + "]}}]}]}";
    }

    @Nested
    class Meta {

        @Test
        void textMessage() {
            List<InboundEvent> events = parser.parseMeta(meta(
                    "{\"from\":\"923009998877\",\"type\":\"text\",\"text\":{\"body\":\"book a seat\"}}"));

            assertEquals(1, events.size());
            assertEquals("923009998877", events.get(0).getSenderId());
            assertEquals(InboundEvent.Kind.TEXT, events.get(0).getKind());
            assertEquals("book a seat", events.get(0).getPayload());
        }

        @Test
        void buttonAndListReplies() {
            List<InboundEvent> events = parser.parseMeta(meta(
                    "{\"from\":\"923009998877\",\"type\":\"interactive\",\"interactive\":{\"type\":\"button_reply\","
                            + "\"button_reply\":{\"id\":\"route_multan\",\"title\":\"Multan\"}}},"
                            + "{\"from\":\"923009998877\",\"type\":\"interactive\",\"interactive\":{\"type\":\"list_reply\","
                            + "\"list_reply\":{\"id\":\"seat_12\",\"title\":\"Seat 12\"}}}"));

            assertEquals(2, events.size());
            assertTrue(events.get(0).isButton());
            assertEquals("route_multan", events.get(0).getPayload());
            assertEquals("seat_12", events.get(1).getPayload());
        }

        @Test
        void templateQuickReply() {
            List<InboundEvent> events = parser.parseMeta(meta(
                    "{\"from\":\"923009998877\",\"type\":\"button\",\"button\":{\"payload\":\"main_menu\",\"text\":\"Menu\"}}"));

            assertEquals(InboundEvent.button("923009998877", "main_menu").getPayload(), events.get(0).getPayload());
            assertTrue(events.get(0).isButton());
        }

        @Test
        void unsupportedTypesAndStatusUpdatesAreSkipped() {
            assertTrue(parser.parseMeta(meta(
                    "{\"from\":\"923009998877\",\"type\":\"image\",\"image\":{\"id\":\"1\"}}")).isEmpty());
            assertTrue(parser.parseMeta("{\"entry\":[{\"changes\":[{\"value\":{\"statuses\":[{\"id\":\"x\"}]}}]}]}")
                    .isEmpty());
            assertTrue(parser.parseMeta("").isEmpty());
        }

        @Test
        void nonJsonIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> parser.parseMeta("From=whatsapp%3A%2B92"));
        }
    }

    @Nested
    class Twilio {

        @Test
        void bodyFromWhatsAppAddress() {
            Optional<InboundEvent> event = parser.parseTwilio(Map.of("From", "whatsapp:+923009998877", "Body", " hi "));

            assertTrue(event.isPresent());
            assertEquals("923009998877", event.get().getSenderId());
            assertEquals("hi", event.get().getPayload());
            assertFalse(event.get().isButton());
        }

        @Test
        void buttonPayloadWins() {
            Optional<InboundEvent> event = parser.parseTwilio(Map.of(
                    "From", "whatsapp:+923009998877", "Body", "Confirm", "ButtonPayload", "confirm_booking"));

            assertTrue(event.get().isButton());
            assertEquals("confirm_booking", event.get().getPayload());
        }

        @Test
        void missingSenderOrBodyIsSkipped() {
            assertTrue(parser.parseTwilio(Map.of("Body", "hi")).isEmpty());
            assertTrue(parser.parseTwilio(Map.of("From", "whatsapp:+923009998877")).isEmpty());
            assertTrue(parser.parseTwilio(null).isEmpty());
        }
    }
}
