package com.safar.bot.exception;

import lombok.Getter;

@Getter
public class SeatUnavailableException extends RuntimeException {

    private final String route;
    private final int seat;

    public SeatUnavailableException(String route, int seat) {
        super("Seat " + seat + " on " + route + " is no longer available");
        this.route = route;
        this.seat = seat;
    }
}
