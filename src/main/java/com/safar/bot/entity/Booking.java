package com.safar.bot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "booking", indexes = {
    @Index(name = "idx_booking_booking_id", columnList = "booking_id", unique = true),
    @Index(name = "idx_booking_trip", columnList = "route,travel_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {

    public enum Status { PENDING, CONFIRMED, CANCELLED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false, length = 20)
    private String bookingId;

    @Column(name = "user_id", nullable = false, length = 32)
    private String userId;

    @Column(nullable = false, length = 40)
    private String route;

    @Column(name = "travel_date", nullable = false)
    private LocalDate travelDate;

    @Column(name = "passenger_name", nullable = false, length = 60)
    private String passengerName;

    @Column(name = "reg_number", length = 20)
    private String regNumber;

    @Column(length = 20)
    private String phone;

    @Column(name = "seat_number", nullable = false)
    private int seatNumber;

    private Integer fare;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
