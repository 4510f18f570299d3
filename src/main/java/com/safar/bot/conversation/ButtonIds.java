package com.safar.bot.conversation;

/**
 * Ids carried by menu options and echoed back as button replies.
 */
public final class ButtonIds {

    public static final String BOOK_SEAT = "book_seat";
    public static final String STATUS = "status";
    public static final String FAQ = "faq";
    public static final String MAIN_MENU = "main_menu";
    public static final String BUS_STATUS = "bus_status";
    public static final String YOUR_BOOKING = "your_booking";
    public static final String CONFIRM_BOOKING = "confirm_booking";
    public static final String CANCEL_BOOKING = "cancel_booking";
    public static final String ADMIN_MENU = "admin_menu";

    public static final String ROUTE_PREFIX = "route_";
    public static final String DATE_PREFIX = "date_";
    public static final String SEAT_PREFIX = "seat_";
    public static final String FAQ_PREFIX = "faq_";
    public static final String UPLOAD_PREFIX = "upload_screenshot_";
    public static final String ADMIN_PREFIX = "admin_";

    private ButtonIds() {
    }
}
