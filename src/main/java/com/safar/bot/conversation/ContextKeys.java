package com.safar.bot.conversation;

public final class ContextKeys {

    public static final String ROUTE = "route";
    public static final String DATE = "date";
    public static final String NAME = "name";
    public static final String REG_NUMBER = "reg_number";
    public static final String PHONE = "phone";
    public static final String SEAT = "seat";

    private ContextKeys() {
    }
}
