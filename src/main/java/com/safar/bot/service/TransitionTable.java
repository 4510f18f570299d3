package com.safar.bot.service;

import com.safar.bot.conversation.ConversationState;
import com.safar.bot.conversation.InputCategory;
import com.safar.bot.conversation.TransitionHandler;
import com.safar.bot.conversation.TransitionResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.safar.bot.conversation.ConversationState.*;
import static com.safar.bot.conversation.InputCategory.*;

/**
 * (state, input category) to handler. Every pair has an entry; a gap fails at startup.
 */
@Component
public class TransitionTable {

    private final Map<ConversationState, EnumMap<InputCategory, TransitionHandler>> table =
            new EnumMap<>(ConversationState.class);

    public TransitionTable(BookingFlowService booking,
                           StatusFlowService status,
                           FaqService faq,
                           AdminCommandExecutor admin,
                           ReplyFactory replies) {
        TransitionHandler welcome = turn -> TransitionResult.reset(ROOT_MENU,
                List.of(replies.welcome(turn.getUserId(), turn.isAdmin())));
        TransitionHandler rootMenu = status::backToRoot;
        TransitionHandler upload = booking::uploadLink;
        TransitionHandler cancelBooking = booking::cancel;
        TransitionHandler startBooking = booking::start;
        TransitionHandler showStatus = status::showMenu;
        TransitionHandler showFaq = faq::showMenu;

        row(ROOT_MENU)
                .on(startBooking, BOOK)
                .on(showStatus, STATUS)
                .on(showFaq, FAQ)
                .on(admin::showMenu, InputCategory.ADMIN_MENU)
                .on(admin::execute, ADMIN_COMMAND)
                .on(status::busStatus, BUS_STATUS)
                .on(status::askPhone, MY_BOOKINGS)
                .on(faq::categoryAnswer, FAQ_CATEGORY)
                .otherwise(rootMenu);
        copyRow(ROOT_MENU, STATUS_BUS);

        // Common to every booking state. on() never overwrites, so these go first.
        for (ConversationState s : ConversationState.values()) {
            if (s.isBooking()) {
                row(s).on(cancelBooking, CANCEL)
                        .on(startBooking, BOOK)
                        .on(showStatus, STATUS)
                        .on(showFaq, FAQ);
            }
        }
        row(BOOKING_SELECT_ROUTE)
                .on(booking::selectRoute, SELECTION, FREE_TEXT)
                .otherwise(booking::repromptRoute);
        row(BOOKING_SELECT_DATE)
                .on(booking::selectDate, SELECTION, FREE_TEXT)
                .otherwise(booking::repromptDate);
        row(BOOKING_ENTER_NAME).otherwise(booking::enterName);
        row(BOOKING_ENTER_REG).otherwise(booking::enterRegNumber);
        row(BOOKING_ENTER_PHONE).otherwise(booking::enterPhone);
        row(BOOKING_SELECT_SEAT).otherwise(booking::selectSeat);
        row(BOOKING_CONFIRM)
                .on(booking::confirm, CONFIRM)
                .otherwise(booking::repromptConfirm);

        row(STATUS_MENU)
                .on(status::busStatus, BUS_STATUS)
                .on(status::askPhone, MY_BOOKINGS)
                .on(startBooking, BOOK)
                .on(showFaq, FAQ)
                .on(rootMenu, CANCEL)
                .otherwise(showStatus);
        row(STATUS_LOOKUP_PHONE)
                .on(rootMenu, CANCEL)
                .on(startBooking, BOOK)
                .on(showStatus, STATUS)
                .on(showFaq, FAQ)
                .on(status::busStatus, BUS_STATUS)
                .otherwise(status::lookup);

        row(FAQ_MENU)
                .on(faq::categoryAnswer, FAQ_CATEGORY)
                .on(showFaq, FAQ)
                .on(startBooking, BOOK)
                .on(showStatus, STATUS)
                .on(status::busStatus, BUS_STATUS)
                .on(status::askPhone, MY_BOOKINGS)
                .on(rootMenu, CANCEL)
                .otherwise(faq::freeForm);
        copyRow(FAQ_MENU, FAQ_CATEGORY_RESULT);
        copyRow(FAQ_MENU, FAQ_FREEFORM);

        row(ConversationState.ADMIN_MENU)
                .on(admin::execute, ADMIN_COMMAND)
                .on(admin::showMenu, InputCategory.ADMIN_MENU)
                .on(startBooking, BOOK)
                .on(showStatus, STATUS)
                .on(showFaq, FAQ)
                .on(rootMenu, CANCEL)
                .otherwise(admin::showMenu);

        for (ConversationState s : ConversationState.values()) {
            row(s).force(welcome, MAIN_MENU).force(upload, UPLOAD_PAYMENT);
        }
        verifyComplete();
    }

    public TransitionHandler lookup(ConversationState state, InputCategory category) {
        return table.get(state).get(category);
    }

    /** Pairs without a handler; empty once constructed. */
    List<String> missing() {
        List<String> gaps = new ArrayList<>();
        for (ConversationState s : ConversationState.values()) {
            EnumMap<InputCategory, TransitionHandler> r = table.get(s);
            for (InputCategory c : InputCategory.values()) {
                if (r == null || r.get(c) == null) {
                    gaps.add(s + "/" + c);
                }
            }
        }
        return gaps;
    }

    private void verifyComplete() {
        List<String> gaps = missing();
        if (!gaps.isEmpty()) {
            throw new IllegalStateException("Transition table incomplete: " + gaps);
        }
    }

    private Row row(ConversationState state) {
        return new Row(table.computeIfAbsent(state, s -> new EnumMap<>(InputCategory.class)));
    }

    private void copyRow(ConversationState from, ConversationState to) {
        table.put(to, new EnumMap<>(table.get(from)));
    }

    private static final class Row {

        private final EnumMap<InputCategory, TransitionHandler> handlers;

        private Row(EnumMap<InputCategory, TransitionHandler> handlers) {
            this.handlers = handlers;
        }

        /** Sets the handler for categories that have none yet. */
        Row on(TransitionHandler handler, InputCategory... categories) {
            for (InputCategory c : categories) {
                handlers.putIfAbsent(c, handler);
            }
            return this;
        }

        Row force(TransitionHandler handler, InputCategory... categories) {
            for (InputCategory c : categories) {
                handlers.put(c, handler);
            }
            return this;
        }

        /** Fills every remaining category. */
        Row otherwise(TransitionHandler handler) {
            for (InputCategory c : InputCategory.values()) {
                handlers.putIfAbsent(c, handler);
            }
            return this;
        }
    }
}
