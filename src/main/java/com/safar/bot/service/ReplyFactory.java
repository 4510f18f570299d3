package com.safar.bot.service;

import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ButtonIds;
import com.safar.bot.conversation.FaqCategory;
import com.safar.bot.conversation.MenuOption;
import com.safar.bot.conversation.OutboundInstruction;
import com.safar.bot.dto.TripAvailability;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the menus the flows send. Option ids are what comes back as button replies.
 */
@Component
public class ReplyFactory {

    /** Interactive lists cap out at ten rows. */
    public static final int MAX_OPTIONS = 10;

    /** Interactive bodies are cut off past this length; plain text allows {@link #TEXT_MAX}. */
    public static final int MENU_BODY_MAX = 1024;
    public static final int TEXT_MAX = 4096;

    private final ResponsePhrases phrases;

    public ReplyFactory(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public OutboundInstruction welcome(String userId, boolean admin) {
        return OutboundInstruction.menu(userId, phrases.welcome(), rootOptions(admin));
    }

    public OutboundInstruction rootMenu(String userId, boolean admin) {
        return OutboundInstruction.menu(userId, phrases.rootMenuHint(), rootOptions(admin));
    }

    public OutboundInstruction routeMenu(String userId, String prompt, List<String> routes) {
        List<MenuOption> options = routes.stream()
                .limit(MAX_OPTIONS)
                .map(r -> MenuOption.of(ButtonIds.ROUTE_PREFIX + r, KnowledgeBaseBuilder.displayRoute(r)))
                .collect(Collectors.toList());
        return OutboundInstruction.menu(userId, prompt, options);
    }

    public OutboundInstruction dateMenu(String userId, String prompt, List<TripAvailability> trips) {
        List<MenuOption> options = trips.stream()
                .limit(MAX_OPTIONS)
                .map(t -> MenuOption.of(ButtonIds.DATE_PREFIX + t.getDate(), t.getDate().toString(),
                        t.isSoldOut() ? "Sold out" : t.getFreeSeats() + " seats left"
                                + (t.getFare() != null ? " | Rs. " + t.getFare() : "")))
                .collect(Collectors.toList());
        return OutboundInstruction.menu(userId, prompt, options);
    }

    /** Lists every free seat in the text; the first ten are also offered as options. */
    public OutboundInstruction seatMenu(String userId, String prompt, List<Integer> seats) {
        String all = seats.stream().map(String::valueOf).collect(Collectors.joining(", "));
        List<MenuOption> options = seats.stream()
                .limit(MAX_OPTIONS)
                .map(s -> MenuOption.of(ButtonIds.SEAT_PREFIX + s, "Seat " + s))
                .collect(Collectors.toList());
        return OutboundInstruction.menu(userId, prompt + "\nFree seats: " + all, options);
    }

    public OutboundInstruction confirmMenu(String userId, String summary) {
        return OutboundInstruction.menu(userId, summary, List.of(
                MenuOption.of(ButtonIds.CONFIRM_BOOKING, "Confirm"),
                MenuOption.of(ButtonIds.CANCEL_BOOKING, "Cancel")));
    }

    public OutboundInstruction statusMenu(String userId) {
        return OutboundInstruction.menu(userId, phrases.statusMenu(), List.of(
                MenuOption.of(ButtonIds.BUS_STATUS, "Bus Status"),
                MenuOption.of(ButtonIds.YOUR_BOOKING, "Your Booking"),
                MenuOption.of(ButtonIds.MAIN_MENU, "Main Menu")));
    }

    public OutboundInstruction faqMenu(String userId, String prompt) {
        List<MenuOption> options = new ArrayList<>();
        for (FaqCategory c : FaqCategory.values()) {
            options.add(MenuOption.of(c.getButtonId(), c.getTitle()));
        }
        options.add(MenuOption.of(ButtonIds.MAIN_MENU, "Main Menu"));
        return OutboundInstruction.menu(userId, prompt, options);
    }

    /**
     * An FAQ answer with the follow-up options. Answers too long for a menu body go out as
     * plain text first, followed by a short menu.
     */
    public List<OutboundInstruction> faqAnswer(String userId, String answer) {
        List<MenuOption> options = List.of(
                MenuOption.of(ButtonIds.FAQ, "More Questions"),
                MenuOption.of(ButtonIds.BOOK_SEAT, "Book a Seat"),
                MenuOption.of(ButtonIds.MAIN_MENU, "Main Menu"));
        if (answer.length() <= MENU_BODY_MAX) {
            return List.of(OutboundInstruction.menu(userId, answer, options));
        }
        List<OutboundInstruction> out = new ArrayList<>();
        for (String chunk : chunks(answer, TEXT_MAX)) {
            out.add(OutboundInstruction.text(userId, chunk));
        }
        out.add(OutboundInstruction.menu(userId, phrases.faqAnythingElse(), options));
        return out;
    }

    public OutboundInstruction adminMenu(String userId) {
        return OutboundInstruction.menu(userId, phrases.adminMenu(), List.of(
                MenuOption.of("admin_fares", "Fares"),
                MenuOption.of("admin_dates", "Travel Dates"),
                MenuOption.of("admin_return", "Return Service"),
                MenuOption.of("admin_luggage", "Luggage Policy"),
                MenuOption.of("admin_locations", "Pickup Points"),
                MenuOption.of("admin_seats", "Seat Overview"),
                MenuOption.of("admin_rebuild_kb", "Rebuild FAQ"),
                MenuOption.of("admin_audit_log", "Audit Log"),
                MenuOption.of(ButtonIds.MAIN_MENU, "Exit Admin")));
    }

    public OutboundInstruction uploadLink(String userId, String bookingId, String appUrl) {
        String base = appUrl == null ? "" : appUrl.trim().replaceAll("/$", "");
        return OutboundInstruction.link(userId, phrases.uploadPrompt(bookingId), base + "/upload/" + bookingId);
    }

    public OutboundInstruction text(String userId, String content) {
        return OutboundInstruction.text(userId, content);
    }

    /** Splits on the last line break that fits, or hard at the limit when a line is longer. */
    static List<String> chunks(String text, int max) {
        List<String> parts = new ArrayList<>();
        String rest = text;
        while (rest.length() > max) {
            int cut = rest.lastIndexOf('\n', max);
            if (cut <= 0) {
                parts.add(rest.substring(0, max));
                rest = rest.substring(max);
            } else {
                parts.add(rest.substring(0, cut));
                rest = rest.substring(cut + 1);
            }
        }
        if (!rest.isEmpty()) {
            parts.add(rest);
        }
        return parts;
    }

    private List<MenuOption> rootOptions(boolean admin) {
        List<MenuOption> options = new ArrayList<>();
        options.add(MenuOption.of(ButtonIds.BOOK_SEAT, "Book a Seat"));
        options.add(MenuOption.of(ButtonIds.STATUS, "Check Status"));
        options.add(MenuOption.of(ButtonIds.FAQ, "FAQs"));
        if (admin) {
            options.add(MenuOption.of(ButtonIds.ADMIN_MENU, "Admin Panel"));
        }
        return options;
    }
}
