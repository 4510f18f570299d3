package com.safar.bot.conversation;

/**
 * Classified shape of an inbound event. The transition table is keyed on these.
 */
public enum InputCategory {
    MAIN_MENU,
    BOOK,
    STATUS,
    FAQ,
    ADMIN_MENU,
    ADMIN_COMMAND,
    BUS_STATUS,
    MY_BOOKINGS,
    CONFIRM,
    CANCEL,
    FAQ_CATEGORY,
    SELECTION,
    UPLOAD_PAYMENT,
    FREE_TEXT
}
