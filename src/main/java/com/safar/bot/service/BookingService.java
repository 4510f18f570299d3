package com.safar.bot.service;

import com.safar.bot.component.KeyedLocks;
import com.safar.bot.dto.BookingRequest;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.TripAvailability;
import com.safar.bot.entity.Booking;
import com.safar.bot.exception.SeatUnavailableException;
import com.safar.bot.exception.TransientStorageException;
import com.safar.bot.exception.TripUnavailableException;
import com.safar.bot.repository.BookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Seat availability and booking commits. Commits for the same trip are serialized and the
 * seat is re-checked inside the commit transaction.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private static final String BOOKING_PREFIX = "SFG-";

    private final BookingRepository bookingRepository;
    private final SettingsService settingsService;
    private final KeyedLocks tripLocks;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    @Value("${bot.booking.seats-per-bus:40}")
    private int seatsPerBus = 40;

    @Value("${bot.storage.timeout-seconds:5}")
    private int timeoutSeconds = 5;

    @Value("${bot.session.lock-timeout:10s}")
    private Duration lockTimeout = Duration.ofSeconds(10);

    public BookingService(BookingRepository bookingRepository,
                          SettingsService settingsService,
                          @Qualifier("tripLocks") KeyedLocks tripLocks,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.bookingRepository = bookingRepository;
        this.settingsService = settingsService;
        this.tripLocks = tripLocks;
        this.transactionManager = transactionManager;
        this.clock = clock;
    }

    public int getSeatsPerBus() {
        return seatsPerBus;
    }

    public List<Integer> availableSeats(String route, LocalDate date) {
        Set<Integer> taken = takenSeats(route, date);
        return IntStream.rangeClosed(1, seatsPerBus)
                .filter(seat -> !taken.contains(seat))
                .boxed()
                .collect(Collectors.toList());
    }

    /** Configured dates for {@code route} that are {@code today} or later. */
    public List<LocalDate> upcomingDates(String route, LocalDate today) {
        List<LocalDate> out = new ArrayList<>();
        for (String iso : settingsService.current().getDates().datesFor(route)) {
            try {
                LocalDate d = LocalDate.parse(iso);
                if (!d.isBefore(today)) {
                    out.add(d);
                }
            } catch (DateTimeParseException e) {
                log.warn("Ignoring malformed travel date '{}' for route {}", iso, route);
            }
        }
        out.sort(null);
        return out;
    }

    public TripAvailability tripAvailability(String route, LocalDate date) {
        int free = availableSeats(route, date).size();
        return new TripAvailability(route, date, free, seatsPerBus, settingsService.current().getFares().fareFor(route));
    }

    public List<TripAvailability> upcomingTrips(LocalDate today) {
        List<TripAvailability> trips = new ArrayList<>();
        for (String route : settingsService.current().routes()) {
            for (LocalDate date : upcomingDates(route, today)) {
                trips.add(tripAvailability(route, date));
            }
        }
        return trips;
    }

    /**
     * Commits a booking. An existing live booking for the same user, trip and seat is returned
     * as is, so a repeated confirmation never creates a second row.
     *
     * @throws SeatUnavailableException if someone else holds the seat
     * @throws TripUnavailableException if the date is no longer scheduled or has passed
     */
    public Booking createBooking(BookingRequest request) {
        String route = request.getRoute().toLowerCase(Locale.ROOT);
        ReentrantLock lock = tripLocks.lockFor("trip:" + route + ":" + request.getTravelDate());
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransientStorageException("Timed out waiting for trip lock " + route);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStorageException("Interrupted waiting for trip lock", e);
        }
        try {
            TransactionTemplate template = new TransactionTemplate(transactionManager);
            template.setTimeout(timeoutSeconds);
            return template.execute(status -> commit(request, route));
        } catch (DataAccessException | TransactionException e) {
            log.warn("[{}] booking commit failed: {}", request.getUserId(), e.getMessage());
            throw new TransientStorageException("Booking storage unavailable", e);
        } finally {
            lock.unlock();
        }
    }

    public List<Booking> findByPhone(String phone) {
        try {
            return bookingRepository.findTop5ByPhoneOrderByCreatedAtDesc(phone);
        } catch (DataAccessException e) {
            throw new TransientStorageException("Booking lookup failed", e);
        }
    }

    private Booking commit(BookingRequest request, String route) {
        Optional<Booking> existing = bookingRepository.findFirstByUserIdAndRouteAndTravelDateAndSeatNumberAndStatusNot(
                request.getUserId(), route, request.getTravelDate(), request.getSeatNumber(), Booking.Status.CANCELLED);
        if (existing.isPresent()) {
            log.info("[{}] booking {} already exists, not creating another", request.getUserId(),
                    existing.get().getBookingId());
            return existing.get();
        }
        if (!upcomingDates(route, LocalDate.now(clock)).contains(request.getTravelDate())) {
            throw new TripUnavailableException(route, request.getTravelDate());
        }
        int seat = request.getSeatNumber();
        if (seat < 1 || seat > seatsPerBus || takenSeats(route, request.getTravelDate()).contains(seat)) {
            throw new SeatUnavailableException(route, seat);
        }
        BusinessSettings settings = settingsService.current();
        Booking booking = bookingRepository.save(Booking.builder()
                .bookingId(newBookingId())
                .userId(request.getUserId())
                .route(route)
                .travelDate(request.getTravelDate())
                .passengerName(request.getPassengerName())
                .regNumber(request.getRegNumber())
                .phone(request.getPhone())
                .seatNumber(seat)
                .fare(settings.getFares().fareFor(route))
                .status(Booking.Status.PENDING)
                .build());
        log.info("[{}] booking {} created: {} {} seat {}", request.getUserId(), booking.getBookingId(),
                route, request.getTravelDate(), seat);
        return booking;
    }

    private Set<Integer> takenSeats(String route, LocalDate date) {
        try {
            return bookingRepository.findByRouteAndTravelDateAndStatusNot(
                            route.toLowerCase(Locale.ROOT), date, Booking.Status.CANCELLED).stream()
                    .map(Booking::getSeatNumber)
                    .collect(Collectors.toSet());
        } catch (DataAccessException e) {
            throw new TransientStorageException("Seat lookup failed", e);
        }
    }

    private String newBookingId() {
        String id;
        do {
            id = BOOKING_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        } while (bookingRepository.existsByBookingId(id));
        return id;
    }
}
