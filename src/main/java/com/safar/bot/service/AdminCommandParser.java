package com.safar.bot.service;

import com.safar.bot.conversation.ButtonIds;
import com.safar.bot.dto.AdminCommand;
import com.safar.bot.dto.AdminCommand.Kind;
import com.safar.bot.dto.SettingKey;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses the admin text grammar. Only called for authorized senders.
 * A known verb with bad arguments yields {@link Kind#INVALID} with a usage line;
 * anything else is not recognized.
 */
@Component
public class AdminCommandParser {

    static final String FARE_USAGE = "fare <route> <amount>";
    static final String DATE_USAGE = "date add|remove <route> <yyyy-mm-dd>";
    static final String RETURN_USAGE = "return <yyyy-mm-dd> <description>";
    static final String LUGGAGE_USAGE = "luggage bags <n> | luggage size <size> | luggage <note>";
    static final String LOCATION_USAGE = "location <point> <directions> | location clear";
    static final String FAQ_USAGE = "faq add <question> | <answer>  or  faq remove <id>";

    public Optional<AdminCommand> parse(String text) {
        String trimmed = StringUtils.normalizeSpace(text);
        if (StringUtils.isEmpty(trimmed)) {
            return Optional.empty();
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.equals("admin") || lower.equals("/admin") || lower.equals("dashboard") || lower.equals("admin panel")) {
            return Optional.of(AdminCommand.of(Kind.SHOW_MENU));
        }
        if (lower.equals("rebuild kb") || lower.equals("rebuild")) {
            return Optional.of(AdminCommand.of(Kind.REBUILD_KB));
        }
        if (lower.equals("audit") || lower.equals("audit log")) {
            return Optional.of(AdminCommand.of(Kind.AUDIT));
        }
        if (lower.equals("seats")) {
            return Optional.of(AdminCommand.of(Kind.SEATS_OVERVIEW));
        }

        String[] parts = trimmed.split(" ");
        String verb = parts[0].toLowerCase(Locale.ROOT);
        switch (verb) {
            case "fare":
            case "fares":
                return Optional.of(parseFare(parts));
            case "date":
            case "dates":
                return Optional.of(parseDate(parts));
            case "return":
                return Optional.of(parseReturn(parts));
            case "luggage":
                return Optional.of(parseLuggage(parts));
            case "location":
            case "locations":
                return Optional.of(parseLocation(parts));
            case "faq":
                return parseFaq(trimmed, parts);
            default:
                return Optional.empty();
        }
    }

    /** Maps the admin list-menu ids to commands. */
    public Optional<AdminCommand> parseButton(String buttonId) {
        if (buttonId == null || !buttonId.startsWith(ButtonIds.ADMIN_PREFIX)) {
            return Optional.empty();
        }
        switch (buttonId) {
            case ButtonIds.ADMIN_MENU:
                return Optional.of(AdminCommand.of(Kind.SHOW_MENU));
            case "admin_fares":
                return Optional.of(AdminCommand.showSetting(SettingKey.FARES));
            case "admin_dates":
                return Optional.of(AdminCommand.showSetting(SettingKey.DATES));
            case "admin_return":
                return Optional.of(AdminCommand.showSetting(SettingKey.RETURN_SERVICE));
            case "admin_luggage":
                return Optional.of(AdminCommand.showSetting(SettingKey.LUGGAGE));
            case "admin_locations":
                return Optional.of(AdminCommand.showSetting(SettingKey.LOCATIONS));
            case "admin_seats":
                return Optional.of(AdminCommand.of(Kind.SEATS_OVERVIEW));
            case "admin_rebuild_kb":
                return Optional.of(AdminCommand.of(Kind.REBUILD_KB));
            case "admin_audit_log":
                return Optional.of(AdminCommand.of(Kind.AUDIT));
            default:
                return Optional.empty();
        }
    }

    private AdminCommand parseFare(String[] parts) {
        if (parts.length == 1) {
            return AdminCommand.showSetting(SettingKey.FARES);
        }
        if (parts.length != 3) {
            return AdminCommand.invalid(FARE_USAGE);
        }
        String amount = parts[2].replace(",", "");
        if (!StringUtils.isNumeric(amount) || amount.length() > 7 || Integer.parseInt(amount) <= 0) {
            return AdminCommand.invalid(FARE_USAGE);
        }
        return AdminCommand.of(Kind.SET_FARE, args(AdminCommand.ROUTE, parts[1].toLowerCase(Locale.ROOT),
                AdminCommand.AMOUNT, amount));
    }

    private AdminCommand parseDate(String[] parts) {
        if (parts.length == 1) {
            return AdminCommand.showSetting(SettingKey.DATES);
        }
        String action = parts[1].toLowerCase(Locale.ROOT);
        if (parts.length != 4 || !(action.equals("add") || action.equals("remove")) || !isIsoDate(parts[3])) {
            return AdminCommand.invalid(DATE_USAGE);
        }
        return AdminCommand.of(action.equals("add") ? Kind.ADD_DATE : Kind.REMOVE_DATE,
                args(AdminCommand.ROUTE, parts[2].toLowerCase(Locale.ROOT), AdminCommand.DATE, parts[3]));
    }

    private AdminCommand parseReturn(String[] parts) {
        if (parts.length == 1) {
            return AdminCommand.showSetting(SettingKey.RETURN_SERVICE);
        }
        if (!isIsoDate(parts[1])) {
            return AdminCommand.invalid(RETURN_USAGE);
        }
        return AdminCommand.of(Kind.SET_RETURN, args(AdminCommand.DATE, parts[1],
                AdminCommand.DESCRIPTION, tail(parts, 2)));
    }

    private AdminCommand parseLuggage(String[] parts) {
        if (parts.length == 1) {
            return AdminCommand.showSetting(SettingKey.LUGGAGE);
        }
        String field = parts[1].toLowerCase(Locale.ROOT);
        if (field.equals("bags")) {
            if (parts.length != 3 || !StringUtils.isNumeric(parts[2]) || parts[2].length() > 2) {
                return AdminCommand.invalid(LUGGAGE_USAGE);
            }
            return AdminCommand.of(Kind.SET_LUGGAGE, args(AdminCommand.FIELD, "bags", AdminCommand.VALUE, parts[2]));
        }
        if (field.equals("size")) {
            if (parts.length != 3) {
                return AdminCommand.invalid(LUGGAGE_USAGE);
            }
            return AdminCommand.of(Kind.SET_LUGGAGE, args(AdminCommand.FIELD, "size",
                    AdminCommand.VALUE, parts[2].toLowerCase(Locale.ROOT)));
        }
        return AdminCommand.of(Kind.SET_LUGGAGE, args(AdminCommand.FIELD, "note", AdminCommand.VALUE, tail(parts, 1)));
    }

    private AdminCommand parseLocation(String[] parts) {
        if (parts.length == 1) {
            return AdminCommand.showSetting(SettingKey.LOCATIONS);
        }
        if (parts.length == 2 && parts[1].equalsIgnoreCase("clear")) {
            return AdminCommand.of(Kind.CLEAR_LOCATIONS);
        }
        if (parts.length < 3) {
            return AdminCommand.invalid(LOCATION_USAGE);
        }
        return AdminCommand.of(Kind.SET_LOCATION, args(AdminCommand.POINT, parts[1].toLowerCase(Locale.ROOT),
                AdminCommand.TEXT, tail(parts, 2)));
    }

    private Optional<AdminCommand> parseFaq(String trimmed, String[] parts) {
        if (parts.length == 1) {
            return Optional.empty();
        }
        String action = parts[1].toLowerCase(Locale.ROOT);
        if (action.equals("add")) {
            String body = tail(parts, 2);
            String question = StringUtils.trim(StringUtils.substringBefore(body, "|"));
            String answer = StringUtils.trim(StringUtils.substringAfter(body, "|"));
            if (!body.contains("|") || StringUtils.isAnyBlank(question, answer)) {
                return Optional.of(AdminCommand.invalid(FAQ_USAGE));
            }
            return Optional.of(AdminCommand.of(Kind.ADD_FAQ, args(AdminCommand.QUESTION, question,
                    AdminCommand.ANSWER, answer)));
        }
        if (action.equals("remove")) {
            if (parts.length != 3 || !StringUtils.isNumeric(parts[2])) {
                return Optional.of(AdminCommand.invalid(FAQ_USAGE));
            }
            return Optional.of(AdminCommand.of(Kind.REMOVE_FAQ, args(AdminCommand.ID, parts[2])));
        }
        return Optional.empty();
    }

    private static boolean isIsoDate(String s) {
        try {
            LocalDate.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static String tail(String[] parts, int from) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < parts.length; i++) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(parts[i]);
        }
        return sb.toString();
    }

    private static Map<String, String> args(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put(kv[i], kv[i + 1]);
        }
        return m;
    }
}
