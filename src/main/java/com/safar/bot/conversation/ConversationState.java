package com.safar.bot.conversation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Closed set of dialogue states. Each state declares the context keys it may carry;
 * anything else is dropped after a transition.
 */
public enum ConversationState {

    ROOT_MENU,
    BOOKING_SELECT_ROUTE,
    BOOKING_SELECT_DATE(ContextKeys.ROUTE),
    BOOKING_ENTER_NAME(ContextKeys.ROUTE, ContextKeys.DATE),
    BOOKING_ENTER_REG(ContextKeys.ROUTE, ContextKeys.DATE, ContextKeys.NAME),
    BOOKING_ENTER_PHONE(ContextKeys.ROUTE, ContextKeys.DATE, ContextKeys.NAME, ContextKeys.REG_NUMBER),
    BOOKING_SELECT_SEAT(ContextKeys.ROUTE, ContextKeys.DATE, ContextKeys.NAME, ContextKeys.REG_NUMBER,
            ContextKeys.PHONE),
    BOOKING_CONFIRM(ContextKeys.ROUTE, ContextKeys.DATE, ContextKeys.NAME, ContextKeys.REG_NUMBER,
            ContextKeys.PHONE, ContextKeys.SEAT),
    STATUS_MENU,
    STATUS_BUS,
    STATUS_LOOKUP_PHONE,
    FAQ_MENU,
    FAQ_CATEGORY_RESULT,
    FAQ_FREEFORM,
    ADMIN_MENU;

    private final Set<String> allowedKeys;

    ConversationState(String... allowedKeys) {
        this.allowedKeys = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(allowedKeys)));
    }

    public Set<String> getAllowedKeys() {
        return allowedKeys;
    }

    /** Transient states are passed through during a transition but never persisted. */
    public boolean isTransient() {
        return this == STATUS_BUS || this == FAQ_CATEGORY_RESULT || this == FAQ_FREEFORM;
    }

    /** State a session rests in after passing through this one. */
    public ConversationState restingState() {
        switch (this) {
            case STATUS_BUS:
                return ROOT_MENU;
            case FAQ_CATEGORY_RESULT:
            case FAQ_FREEFORM:
                return FAQ_MENU;
            default:
                return this;
        }
    }

    public boolean isBooking() {
        return name().startsWith("BOOKING_");
    }
}
