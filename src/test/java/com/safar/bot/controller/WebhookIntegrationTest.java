package com.safar.bot.controller;

import com.safar.bot.conversation.OutboundInstruction;
import com.safar.bot.entity.Booking;
import com.safar.bot.repository.BookingRepository;
import com.safar.bot.repository.ChatSessionRepository;
import com.safar.bot.service.OutboundTransport;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class WebhookIntegrationTest {

    private static final String ADMIN = "923001112233";
    private static final String ADMIN_KEY = "test-admin-key";

    @TestConfiguration
    static class FixedClock {

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(Instant.parse("2026-12-01T05:00:00Z"), ZoneId.of("Asia/Karachi"));
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private ChatSessionRepository chatSessionRepository;

    @MockBean
    private OutboundTransport transport;

    private void text(String from, String body) throws Exception {
        deliver("{\"from\":\"" + from + "\",\"type\":\"text\",\"text\":{\"body\":\"" + body + "\"}}");
    }

    private void tap(String from, String id) throws Exception {
        deliver("{\"from\":\"" + from + "\",\"type\":\"interactive\",\"interactive\":{\"type\":\"button_reply\","
                + "\"button_reply\":{\"id\":\"" + id + "\",\"title\":\"x\"}}}");
    }

    private void deliver(String message) throws Exception {
        String body = "{\"object\":\"whatsapp_business_account\",\"entry\":[{\"changes\":[{\"value\":"
                + "{\"messaging_product\":\"whatsapp\",\"messages\":[" + message + "]}}]}]}";
        mockMvc.perform(post("/webhook/whatsapp").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    private List<OutboundInstruction> sent() {
        ArgumentCaptor<OutboundInstruction> captor = ArgumentCaptor.forClass(OutboundInstruction.class);
        verify(transport, atLeastOnce()).send(captor.capture());
        return captor.getAllValues();
    }

    @Test
    void bookingThroughTheWebhookIsPersistedOnce() throws Exception {
        String user = "923005550001";

        text(user, "hi");
        tap(user, "book_seat");
        tap(user, "route_multan");
        tap(user, "date_2026-12-19");
        text(user, "Ali Khan");
        text(user, "2012345");
        text(user, "0300-1234567");
        tap(user, "seat_9");
        tap(user, "confirm_booking");
        tap(user, "confirm_booking");

        List<Booking> bookings = bookingRepository.findTop5ByPhoneOrderByCreatedAtDesc("03001234567");
        assertEquals(1, bookings.size());
        Booking booking = bookings.get(0);
        assertEquals(9, booking.getSeatNumber());
        assertEquals("multan", booking.getRoute());
        assertEquals(Booking.Status.PENDING, booking.getStatus());
        assertEquals("ROOT_MENU", chatSessionRepository.findById(user).orElseThrow().getState());
        assertTrue(sent().stream().anyMatch(o -> o.getKind() == OutboundInstruction.Kind.DOCUMENT_LINK
                && o.getLink().equals("https://bot.test/upload/" + booking.getBookingId())));
    }

    @Test
    void adminFareChangeIsVisibleToFaqAndApi() throws Exception {
        text(ADMIN, "fare multan 3800");

        assertEquals("ADMIN_MENU", chatSessionRepository.findById(ADMIN).orElseThrow().getState());
        mockMvc.perform(get("/admin/settings/fares").header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fares.multan").value(3800));
        mockMvc.perform(get("/admin/audit-log").header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].adminId").value(ADMIN))
                .andExpect(jsonPath("$[0].settingKey").value("fares"));

        String user = "923005550002";
        text(user, "faq");
        text(user, "how much is the ticket");

        List<String> toUser = sent().stream()
                .filter(o -> o.getRecipientId().equals(user))
                .map(OutboundInstruction::getContent)
                .collect(Collectors.toList());
        assertTrue(toUser.get(toUser.size() - 1).contains("Multan: Rs. 3800"), toUser.toString());
    }

    @Test
    void adminSyntaxFromOrdinaryUserChangesNothing() throws Exception {
        text("923005550003", "fare bahawalpur 1");

        mockMvc.perform(get("/admin/settings/fares").header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fares.bahawalpur").value(4200));
        assertEquals("ROOT_MENU", chatSessionRepository.findById("923005550003").orElseThrow().getState());
    }

    @Test
    void adminApiRequiresKey() throws Exception {
        mockMvc.perform(get("/admin/settings/fares"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/admin/settings/fares").header("X-Admin-Key", "wrong"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/admin/settings/weather").header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isNotFound());
    }

    @Test
    void adminApiRejectsInvalidJson() throws Exception {
        mockMvc.perform(put("/admin/settings/luggage").header("X-Admin-Key", ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"maxBags\":"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/admin/settings/luggage").header("X-Admin-Key", ADMIN_KEY)
                        .header("X-Admin-Id", "ops")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxBags\":3,\"bagSize\":\"large\",\"handCarry\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxBags").value(3));
        mockMvc.perform(post("/admin/rebuild-kb").header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries").isNumber());
    }

    @Test
    void bookingsAreListedByPhone() throws Exception {
        bookingRepository.save(Booking.builder().bookingId("SFG-AB12CD34").userId("923005550005")
                .route("bahawalpur").travelDate(LocalDate.of(2026, 12, 21)).passengerName("Sara Ahmed")
                .regNumber("2054321").phone("03009990001").seatNumber(12).fare(4200)
                .status(Booking.Status.PENDING).build());

        mockMvc.perform(get("/api/bookings/0300-9990001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bookings.length()").value(1))
                .andExpect(jsonPath("$.bookings[0].bookingId").value("SFG-AB12CD34"))
                .andExpect(jsonPath("$.bookings[0].travelDate").value("2026-12-21"))
                .andExpect(jsonPath("$.bookings[0].status").value("PENDING"));
        mockMvc.perform(get("/api/bookings/12345"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void routeDatesShowUpcomingDepartures() throws Exception {
        mockMvc.perform(get("/api/dates/Bahawalpur"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.route").value("bahawalpur"))
                .andExpect(jsonPath("$.dates.length()").value(2))
                .andExpect(jsonPath("$.dates[0].date").value("2026-12-19"))
                .andExpect(jsonPath("$.dates[1].date").value("2026-12-21"))
                .andExpect(jsonPath("$.dates[0].fare").value(4200))
                .andExpect(jsonPath("$.dates[0].totalSeats").value(40));
        mockMvc.perform(get("/api/dates/karachi"))
                .andExpect(status().isNotFound());
    }

    @Test
    void seatOverviewNeedsAdminKey() throws Exception {
        mockMvc.perform(get("/admin/seats"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/admin/seats").header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overview.length()").value(4))
                .andExpect(jsonPath("$.overview[0].route").value("multan"));
    }

    @Test
    void webhookVerification() throws Exception {
        mockMvc.perform(get("/webhook/whatsapp").param("hub.mode", "subscribe")
                        .param("hub.verify_token", "verify-me").param("hub.challenge", "12345"))
                .andExpect(status().isOk())
                .andExpect(content().string("12345"));
        mockMvc.perform(get("/webhook/whatsapp").param("hub.mode", "subscribe")
                        .param("hub.verify_token", "nope").param("hub.challenge", "12345"))
                .andExpect(status().isForbidden());
    }

    @Test
    void malformedBodyStillAcknowledged() throws Exception {
        mockMvc.perform(post("/webhook/whatsapp").contentType(MediaType.APPLICATION_JSON).content("not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"));
        verifyNoInteractions(transport);
    }

    @Test
    void twilioFormPostIsHandled() throws Exception {
        mockMvc.perform(post("/webhook/twilio").contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("From", "whatsapp:+923005550004").param("Body", "status"))
                .andExpect(status().isOk())
                .andExpect(content().string("<Response></Response>"));

        assertEquals("STATUS_MENU", chatSessionRepository.findById("923005550004").orElseThrow().getState());
    }
}
