package com.safar.bot.service;

import com.safar.bot.component.KeyedLocks;
import com.safar.bot.dto.BookingRequest;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.entity.Booking;
import com.safar.bot.exception.SeatUnavailableException;
import com.safar.bot.exception.TransientStorageException;
import com.safar.bot.exception.TripUnavailableException;
import com.safar.bot.repository.BookingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BookingServiceTest {

    private static final LocalDate DEC_19 = LocalDate.of(2026, 12, 19);

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private SettingsService settingsService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final List<Booking> stored = Collections.synchronizedList(new ArrayList<>());

    private BookingService bookingService;

    @BeforeEach
    void setUp() {
        bookingService = serviceAt(EngineFixture.NOW);
        when(settingsService.current()).thenReturn(BusinessSettings.defaults());
        when(bookingRepository.findByRouteAndTravelDateAndStatusNot(anyString(), any(), any()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(b -> b.getRoute().equals(inv.getArgument(0))
                                && b.getTravelDate().equals(inv.getArgument(1))
                                && b.getStatus() != inv.<Booking.Status>getArgument(2))
                        .collect(Collectors.toList()));
        when(bookingRepository.findFirstByUserIdAndRouteAndTravelDateAndSeatNumberAndStatusNot(
                anyString(), anyString(), any(), anyInt(), any()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(b -> b.getUserId().equals(inv.getArgument(0))
                                && b.getRoute().equals(inv.getArgument(1))
                                && b.getTravelDate().equals(inv.getArgument(2))
                                && b.getSeatNumber() == inv.<Integer>getArgument(3)
                                && b.getStatus() != inv.<Booking.Status>getArgument(4))
                        .findFirst());
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> {
            Booking b = inv.getArgument(0);
            stored.add(b);
            return b;
        });
        when(bookingRepository.existsByBookingId(anyString())).thenReturn(false);
    }

    private BookingService serviceAt(Instant now) {
        return new BookingService(bookingRepository, settingsService, new KeyedLocks(4), transactionManager,
                Clock.fixed(now, EngineFixture.ZONE));
    }

    private List<Booking> snapshot() {
        synchronized (stored) {
            return new ArrayList<>(stored);
        }
    }

    private static BookingRequest request(String userId, int seat) {
        return BookingRequest.builder().userId(userId).route("Multan").travelDate(DEC_19)
                .passengerName("Ali Khan").regNumber("2012345").phone("03001234567").seatNumber(seat).build();
    }

    private static Booking existing(String userId, int seat, Booking.Status status) {
        return Booking.builder().bookingId("SFG-EXISTING").userId(userId).route("multan").travelDate(DEC_19)
                .seatNumber(seat).status(status).build();
    }

    @Nested
    class Availability {

        @Test
        void takenSeatsAreExcluded() {
            stored.add(existing("a", 3, Booking.Status.PENDING));
            stored.add(existing("b", 4, Booking.Status.CANCELLED));

            List<Integer> seats = bookingService.availableSeats("multan", DEC_19);

            assertEquals(39, seats.size());
            assertFalse(seats.contains(3));
            assertTrue(seats.contains(4));
        }

        @Test
        void pastDatesAreNotOffered() {
            assertEquals(List.of(LocalDate.of(2026, 12, 20)),
                    bookingService.upcomingDates("multan", LocalDate.of(2026, 12, 20)));
            assertTrue(bookingService.upcomingDates("karachi", DEC_19).isEmpty());
        }

        @Test
        void upcomingTripsCoverEveryRoute() {
            assertEquals(4, bookingService.upcomingTrips(LocalDate.of(2026, 12, 1)).size());
            assertEquals(3500, bookingService.tripAvailability("multan", DEC_19).getFare());
        }

        @Test
        void lookupFailureIsTransient() {
            when(bookingRepository.findByRouteAndTravelDateAndStatusNot(anyString(), any(), any()))
                    .thenThrow(new QueryTimeoutException("slow"));

            assertThrows(TransientStorageException.class, () -> bookingService.availableSeats("multan", DEC_19));
        }
    }

    @Nested
    class Create {

        @Test
        void newBookingGetsPendingStatusFareAndId() {
            Booking b = bookingService.createBooking(request("923009998877", 5));

            assertTrue(b.getBookingId().matches("SFG-[0-9A-F]{8}"), b.getBookingId());
            assertEquals("multan", b.getRoute());
            assertEquals(3500, b.getFare());
            assertEquals(Booking.Status.PENDING, b.getStatus());
            verify(bookingRepository).save(any(Booking.class));
        }

        @Test
        void repeatedConfirmationReturnsExistingBooking() {
            stored.add(existing("923009998877", 5, Booking.Status.PENDING));

            Booking b = bookingService.createBooking(request("923009998877", 5));

            assertEquals("SFG-EXISTING", b.getBookingId());
            verify(bookingRepository, never()).save(any());
        }

        @Test
        void seatHeldBySomeoneElseIsRejected() {
            stored.add(existing("923001231234", 5, Booking.Status.CONFIRMED));

            SeatUnavailableException e = assertThrows(SeatUnavailableException.class,
                    () -> bookingService.createBooking(request("923009998877", 5)));
            assertNotNull(e.getMessage());
            verify(bookingRepository, never()).save(any());
        }

        @Test
        void seatOutsideTheBusIsRejected() {
            assertThrows(SeatUnavailableException.class,
                    () -> bookingService.createBooking(request("923009998877", 41)));
        }

        @Test
        void dateRemovedAfterSelectionIsRejected() {
            BusinessSettings settings = BusinessSettings.defaults();
            settings.getDates().removeDate("multan", "2026-12-19");
            when(settingsService.current()).thenReturn(settings);

            TripUnavailableException e = assertThrows(TripUnavailableException.class,
                    () -> bookingService.createBooking(request("923009998877", 5)));

            assertEquals(DEC_19, e.getDate());
            verify(bookingRepository, never()).save(any());
        }

        @Test
        void departedTripIsRejected() {
            BookingService later = serviceAt(Instant.parse("2026-12-19T20:00:00Z"));

            assertThrows(TripUnavailableException.class, () -> later.createBooking(request("923009998877", 5)));
            verify(bookingRepository, never()).save(any());
        }

        @Test
        void concurrentCommitsForOneSeatProduceOneBooking() throws Exception {
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String user = "92300000000" + i;
                Callable<Boolean> task = () -> {
                    start.await();
                    try {
                        bookingService.createBooking(request(user, 7));
                        return true;
                    } catch (SeatUnavailableException e) {
                        return false;
                    }
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int won = 0;
            for (Future<Boolean> f : results) {
                if (f.get(10, TimeUnit.SECONDS)) {
                    won++;
                }
            }
            pool.shutdown();

            assertEquals(1, won);
            assertEquals(1, stored.size());
        }
    }
}
