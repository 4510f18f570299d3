package com.safar.bot.controller;

import com.safar.bot.dto.TripAvailability;
import com.safar.bot.entity.Booking;
import com.safar.bot.exception.TransientStorageException;
import com.safar.bot.service.BookingService;
import com.safar.bot.service.PassengerDetailsValidator;
import com.safar.bot.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only lookups for the booking page: a passenger's bookings by phone and the open
 * departures of a route.
 */
@RestController
@RequestMapping("/api")
public class BookingQueryController {

    private static final Logger log = LoggerFactory.getLogger(BookingQueryController.class);

    private final BookingService bookingService;
    private final SettingsService settingsService;
    private final PassengerDetailsValidator validator;
    private final Clock clock;

    public BookingQueryController(BookingService bookingService,
                                  SettingsService settingsService,
                                  PassengerDetailsValidator validator,
                                  Clock clock) {
        this.bookingService = bookingService;
        this.settingsService = settingsService;
        this.validator = validator;
        this.clock = clock;
    }

    @GetMapping(value = "/bookings/{phone}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> bookings(@PathVariable String phone) {
        Optional<String> normalized = validator.phone(phone);
        if (normalized.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "invalid phone number"));
        }
        List<Map<String, Object>> bookings = bookingService.findByPhone(normalized.get()).stream()
                .map(BookingQueryController::toView)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("bookings", bookings));
    }

    @GetMapping(value = "/dates/{route}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> dates(@PathVariable String route) {
        String key = route.trim().toLowerCase(Locale.ROOT);
        if (settingsService.current().getFares().fareFor(key) == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "unknown route"));
        }
        List<Map<String, Object>> dates = bookingService.upcomingDates(key, LocalDate.now(clock)).stream()
                .map(d -> tripView(bookingService.tripAvailability(key, d)))
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("route", key, "dates", dates));
    }

    @ExceptionHandler(TransientStorageException.class)
    public ResponseEntity<Map<String, String>> unavailable(TransientStorageException e) {
        log.warn("Booking API storage failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "storage unavailable"));
    }

    static Map<String, Object> tripView(TripAvailability t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("route", t.getRoute());
        m.put("date", t.getDate().toString());
        m.put("freeSeats", t.getFreeSeats());
        m.put("totalSeats", t.getTotalSeats());
        m.put("fare", t.getFare());
        m.put("soldOut", t.isSoldOut());
        return m;
    }

    private static Map<String, Object> toView(Booking b) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("bookingId", b.getBookingId());
        m.put("route", b.getRoute());
        m.put("travelDate", b.getTravelDate().toString());
        m.put("seatNumber", b.getSeatNumber());
        m.put("fare", b.getFare());
        m.put("status", b.getStatus().name());
        return m;
    }
}
