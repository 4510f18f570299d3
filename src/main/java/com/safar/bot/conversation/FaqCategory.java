package com.safar.bot.conversation;

import java.util.Arrays;
import java.util.Optional;

public enum FaqCategory {

    DATES("faq_dates", "Travel Dates"),
    FARES("faq_fares", "Fares"),
    ROUTE("faq_route", "Route Details"),
    RETURN("faq_return", "Return Service"),
    LUGGAGE("faq_luggage", "Luggage Policy"),
    LOCATIONS("faq_locations", "Pickup Points"),
    SEATS("faq_seats", "Seat Availability"),
    GENERAL("faq_general", "General Questions");

    private final String buttonId;
    private final String title;

    FaqCategory(String buttonId, String title) {
        this.buttonId = buttonId;
        this.title = title;
    }

    public String getButtonId() {
        return buttonId;
    }

    public String getTitle() {
        return title;
    }

    public static Optional<FaqCategory> fromButtonId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(c -> c.buttonId.equalsIgnoreCase(id.trim())).findFirst();
    }

    /** Matches a menu title typed back by text-only transports. */
    public static Optional<FaqCategory> fromTitle(String title) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(c -> c.title.equalsIgnoreCase(title.trim())).findFirst();
    }

    public static Optional<FaqCategory> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(c -> c.name().equalsIgnoreCase(name.trim())).findFirst();
    }
}
