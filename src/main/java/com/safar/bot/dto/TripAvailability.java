package com.safar.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;

@Getter
@AllArgsConstructor
public class TripAvailability {

    private final String route;
    private final LocalDate date;
    private final int freeSeats;
    private final int totalSeats;
    private final Integer fare;

    public boolean isSoldOut() {
        return freeSeats <= 0;
    }
}
