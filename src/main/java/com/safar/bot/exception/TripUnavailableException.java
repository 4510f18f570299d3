package com.safar.bot.exception;

import lombok.Getter;

import java.time.LocalDate;

/** The travel date was removed or has passed since the user picked it. */
@Getter
public class TripUnavailableException extends RuntimeException {

    private final String route;
    private final LocalDate date;

    public TripUnavailableException(String route, LocalDate date) {
        super("No departure for " + route + " on " + date);
        this.route = route;
        this.date = date;
    }
}
