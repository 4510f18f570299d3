package com.safar.bot.repository;

import com.safar.bot.entity.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByRouteAndTravelDateAndStatusNot(String route, LocalDate travelDate, Booking.Status status);

    Optional<Booking> findFirstByUserIdAndRouteAndTravelDateAndSeatNumberAndStatusNot(
            String userId, String route, LocalDate travelDate, int seatNumber, Booking.Status status);

    List<Booking> findTop5ByPhoneOrderByCreatedAtDesc(String phone);

    Optional<Booking> findByBookingId(String bookingId);

    boolean existsByBookingId(String bookingId);
}
