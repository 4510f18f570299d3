package com.safar.bot.service;

import com.safar.bot.conversation.ButtonIds;
import com.safar.bot.conversation.ClassifiedInput;
import com.safar.bot.conversation.FaqCategory;
import com.safar.bot.conversation.InboundEvent;
import com.safar.bot.conversation.InputCategory;
import com.safar.bot.dto.AdminCommand;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps an inbound event to an input category. Independent of the current state; the
 * transition table decides what a category means where. Admin syntax is only recognized
 * for authorized senders and is plain free text for everyone else.
 */
@Service
public class InputClassifier {

    private static final Logger log = LoggerFactory.getLogger(InputClassifier.class);

    private static final Map<InputCategory, Set<String>> KEYWORDS = Map.of(
            InputCategory.MAIN_MENU, Set.of("hi", "hello", "hey", "salam", "start", "menu", "home", "main menu"),
            InputCategory.BOOK, Set.of("book", "book a seat", "book seat", "booking"),
            InputCategory.STATUS, Set.of("status", "check status"),
            InputCategory.FAQ, Set.of("faq", "faqs", "help", "more questions"),
            InputCategory.BUS_STATUS, Set.of("bus status"),
            InputCategory.MY_BOOKINGS, Set.of("my booking", "my bookings", "your booking"),
            InputCategory.CONFIRM, Set.of("confirm", "yes", "confirm booking"),
            InputCategory.CANCEL, Set.of("cancel", "no", "stop", "cancel booking"));

    private static final Map<String, InputCategory> FIXED_BUTTONS = Map.of(
            ButtonIds.BOOK_SEAT, InputCategory.BOOK,
            ButtonIds.STATUS, InputCategory.STATUS,
            ButtonIds.FAQ, InputCategory.FAQ,
            ButtonIds.MAIN_MENU, InputCategory.MAIN_MENU,
            ButtonIds.BUS_STATUS, InputCategory.BUS_STATUS,
            ButtonIds.YOUR_BOOKING, InputCategory.MY_BOOKINGS,
            ButtonIds.CONFIRM_BOOKING, InputCategory.CONFIRM,
            ButtonIds.CANCEL_BOOKING, InputCategory.CANCEL);

    private final AdminCommandParser adminCommandParser;

    public InputClassifier(AdminCommandParser adminCommandParser) {
        this.adminCommandParser = adminCommandParser;
    }

    public ClassifiedInput classify(InboundEvent event, boolean admin) {
        String payload = StringUtils.trimToEmpty(event.getPayload());
        ClassifiedInput result = event.isButton()
                ? classifyButton(payload, admin)
                : classifyText(payload, admin);
        log.debug("[{}] classified {} '{}' as {}", event.getSenderId(), event.getKind(), payload, result);
        return result;
    }

    private ClassifiedInput classifyButton(String id, boolean admin) {
        Optional<ClassifiedInput> byId = fromButtonId(id, admin);
        return byId.orElseGet(() -> ClassifiedInput.freeText(id));
    }

    private ClassifiedInput classifyText(String text, boolean admin) {
        String lower = StringUtils.normalizeSpace(text).toLowerCase(Locale.ROOT);
        // Typed button ids behave like taps, e.g. text-only transports echoing option ids.
        Optional<ClassifiedInput> byId = fromButtonId(lower, admin);
        if (byId.isPresent()) {
            return byId.get();
        }
        // Menu titles typed back, e.g. from the Twilio numbered list.
        Optional<FaqCategory> byTitle = FaqCategory.fromTitle(lower);
        if (byTitle.isPresent()) {
            return ClassifiedInput.faqCategory(byTitle.get(), text);
        }
        for (Map.Entry<InputCategory, Set<String>> e : KEYWORDS.entrySet()) {
            if (e.getValue().contains(lower)) {
                return ClassifiedInput.of(e.getKey(), text);
            }
        }
        if (admin) {
            Optional<AdminCommand> command = adminCommandParser.parse(text);
            if (command.isPresent()) {
                return ClassifiedInput.admin(command.get(), text);
            }
        }
        return ClassifiedInput.freeText(text);
    }

    private Optional<ClassifiedInput> fromButtonId(String id, boolean admin) {
        if (id.isEmpty()) {
            return Optional.empty();
        }
        InputCategory fixed = FIXED_BUTTONS.get(id);
        if (fixed != null) {
            return Optional.of(ClassifiedInput.of(fixed, id));
        }
        if (id.startsWith(ButtonIds.UPLOAD_PREFIX) && id.length() > ButtonIds.UPLOAD_PREFIX.length()) {
            return Optional.of(ClassifiedInput.upload(
                    id.substring(ButtonIds.UPLOAD_PREFIX.length()).toUpperCase(Locale.ROOT), id));
        }
        if (id.startsWith(ButtonIds.ROUTE_PREFIX) || id.startsWith(ButtonIds.DATE_PREFIX)
                || id.startsWith(ButtonIds.SEAT_PREFIX)) {
            String value = StringUtils.substringAfter(id, "_");
            return value.isEmpty() ? Optional.empty() : Optional.of(ClassifiedInput.selection(value, id));
        }
        Optional<FaqCategory> faq = FaqCategory.fromButtonId(id);
        if (faq.isPresent()) {
            return Optional.of(ClassifiedInput.faqCategory(faq.get(), id));
        }
        if (admin && id.startsWith(ButtonIds.ADMIN_PREFIX)) {
            return adminCommandParser.parseButton(id).map(c -> ClassifiedInput.admin(c, id));
        }
        return Optional.empty();
    }
}
