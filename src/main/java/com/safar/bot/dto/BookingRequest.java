package com.safar.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

@Getter
@AllArgsConstructor
@Builder
public class BookingRequest {

    private final String userId;
    private final String route;
    private final LocalDate travelDate;
    private final String passengerName;
    private final String regNumber;
    private final String phone;
    private final int seatNumber;
}
