package com.safar.bot.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed admin instruction. Arguments are keyed by name, see the constants below.
 */
public final class AdminCommand {

    public enum Kind {
        SHOW_MENU,
        SHOW_SETTING,
        SET_FARE,
        ADD_DATE,
        REMOVE_DATE,
        SET_RETURN,
        SET_LUGGAGE,
        SET_LOCATION,
        CLEAR_LOCATIONS,
        ADD_FAQ,
        REMOVE_FAQ,
        REBUILD_KB,
        AUDIT,
        SEATS_OVERVIEW,
        INVALID
    }

    public static final String ROUTE = "route";
    public static final String AMOUNT = "amount";
    public static final String DATE = "date";
    public static final String DESCRIPTION = "description";
    public static final String FIELD = "field";
    public static final String VALUE = "value";
    public static final String POINT = "point";
    public static final String TEXT = "text";
    public static final String QUESTION = "question";
    public static final String ANSWER = "answer";
    public static final String ID = "id";
    public static final String SETTING = "setting";
    public static final String USAGE = "usage";

    private final Kind kind;
    private final Map<String, String> args;

    private AdminCommand(Kind kind, Map<String, String> args) {
        this.kind = kind;
        this.args = args == null ? Collections.emptyMap() : new LinkedHashMap<>(args);
    }

    public static AdminCommand of(Kind kind) {
        return new AdminCommand(kind, null);
    }

    public static AdminCommand of(Kind kind, Map<String, String> args) {
        return new AdminCommand(kind, args);
    }

    public static AdminCommand showSetting(SettingKey key) {
        Map<String, String> a = new LinkedHashMap<>();
        a.put(SETTING, key.getKey());
        return new AdminCommand(Kind.SHOW_SETTING, a);
    }

    public static AdminCommand invalid(String usage) {
        Map<String, String> a = new LinkedHashMap<>();
        a.put(USAGE, usage);
        return new AdminCommand(Kind.INVALID, a);
    }

    public Kind getKind() {
        return kind;
    }

    public String arg(String name) {
        return args.get(name);
    }

    public Map<String, String> getArgs() {
        return Collections.unmodifiableMap(args);
    }

    public boolean isMutation() {
        switch (kind) {
            case SET_FARE:
            case ADD_DATE:
            case REMOVE_DATE:
            case SET_RETURN:
            case SET_LUGGAGE:
            case SET_LOCATION:
            case CLEAR_LOCATIONS:
            case ADD_FAQ:
            case REMOVE_FAQ:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return kind + args.toString();
    }
}
