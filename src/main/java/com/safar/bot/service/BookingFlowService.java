package com.safar.bot.service;

import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ContextKeys;
import com.safar.bot.conversation.ConversationState;
import com.safar.bot.conversation.ConversationTurn;
import com.safar.bot.conversation.InputCategory;
import com.safar.bot.conversation.OutboundInstruction;
import com.safar.bot.conversation.TransitionResult;
import com.safar.bot.dto.BookingRequest;
import com.safar.bot.dto.TripAvailability;
import com.safar.bot.entity.Booking;
import com.safar.bot.exception.SeatUnavailableException;
import com.safar.bot.exception.TripUnavailableException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Booking sub-flow: route, date, name, registration number, phone, seat, confirm.
 * Every failed validation re-prompts in the same state with the context untouched.
 * Only {@link #confirm} writes a booking.
 */
@Service
public class BookingFlowService {

    private static final Logger log = LoggerFactory.getLogger(BookingFlowService.class);

    /** Categories whose raw text can be taken as a typed field value. */
    private static final Set<InputCategory> TYPED = EnumSet.of(
            InputCategory.FREE_TEXT, InputCategory.ADMIN_COMMAND, InputCategory.ADMIN_MENU);

    private final BookingService bookingService;
    private final SettingsService settingsService;
    private final PassengerDetailsValidator validator;
    private final ReplyFactory replies;
    private final ResponsePhrases phrases;
    private final Clock clock;

    @Value("${bot.app-url:http://localhost:8080}")
    private String appUrl = "http://localhost:8080";

    public BookingFlowService(BookingService bookingService,
                              SettingsService settingsService,
                              PassengerDetailsValidator validator,
                              ReplyFactory replies,
                              ResponsePhrases phrases,
                              Clock clock) {
        this.bookingService = bookingService;
        this.settingsService = settingsService;
        this.validator = validator;
        this.replies = replies;
        this.phrases = phrases;
        this.clock = clock;
    }

    public TransitionResult start(ConversationTurn turn) {
        List<String> routes = settingsService.current().routes();
        if (routes.isEmpty()) {
            return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                    replies.text(turn.getUserId(), phrases.noRoutes()),
                    replies.rootMenu(turn.getUserId(), turn.isAdmin())));
        }
        return TransitionResult.reset(ConversationState.BOOKING_SELECT_ROUTE,
                List.of(replies.routeMenu(turn.getUserId(), phrases.chooseRoute(), routes)));
    }

    public TransitionResult repromptRoute(ConversationTurn turn) {
        return TransitionResult.stay(turn, List.of(
                replies.routeMenu(turn.getUserId(), phrases.chooseRoute(), settingsService.current().routes())));
    }

    public TransitionResult selectRoute(ConversationTurn turn) {
        List<String> routes = settingsService.current().routes();
        Optional<String> route = resolveRoute(turn, routes);
        if (route.isEmpty()) {
            return TransitionResult.stay(turn, List.of(
                    replies.routeMenu(turn.getUserId(), phrases.unknownRoute(), routes)));
        }
        List<TripAvailability> trips = trips(route.get(), today(turn));
        if (trips.isEmpty()) {
            return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                    replies.text(turn.getUserId(), phrases.noDates(KnowledgeBaseBuilder.displayRoute(route.get()))),
                    replies.rootMenu(turn.getUserId(), turn.isAdmin())));
        }
        Map<String, String> context = new LinkedHashMap<>();
        context.put(ContextKeys.ROUTE, route.get());
        return TransitionResult.moveTo(ConversationState.BOOKING_SELECT_DATE, context, List.of(
                replies.dateMenu(turn.getUserId(),
                        phrases.chooseDate(KnowledgeBaseBuilder.displayRoute(route.get())), trips)));
    }

    public TransitionResult repromptDate(ConversationTurn turn) {
        String route = turn.get(ContextKeys.ROUTE);
        return TransitionResult.stay(turn, List.of(replies.dateMenu(turn.getUserId(),
                phrases.chooseDate(KnowledgeBaseBuilder.displayRoute(route)), trips(route, today(turn)))));
    }

    public TransitionResult selectDate(ConversationTurn turn) {
        String route = turn.get(ContextKeys.ROUTE);
        List<TripAvailability> trips = trips(route, today(turn));
        Optional<LocalDate> date = parseDate(selectedValue(turn));
        Optional<TripAvailability> trip = date.flatMap(d -> trips.stream().filter(t -> t.getDate().equals(d)).findFirst());
        if (trip.isEmpty()) {
            return TransitionResult.stay(turn, List.of(
                    replies.dateMenu(turn.getUserId(), phrases.unknownDate(), trips)));
        }
        if (trip.get().isSoldOut()) {
            return TransitionResult.stay(turn, List.of(
                    replies.dateMenu(turn.getUserId(), phrases.soldOut(), trips)));
        }
        return TransitionResult.moveTo(ConversationState.BOOKING_ENTER_NAME,
                turn.contextWith(ContextKeys.DATE, trip.get().getDate().toString()),
                List.of(replies.text(turn.getUserId(), phrases.askName())));
    }

    public TransitionResult enterName(ConversationTurn turn) {
        Optional<String> name = typed(turn).flatMap(validator::name);
        if (name.isEmpty()) {
            return TransitionResult.stay(turn, List.of(replies.text(turn.getUserId(), phrases.invalidName())));
        }
        return TransitionResult.moveTo(ConversationState.BOOKING_ENTER_REG,
                turn.contextWith(ContextKeys.NAME, name.get()),
                List.of(replies.text(turn.getUserId(), phrases.askRegNumber())));
    }

    public TransitionResult enterRegNumber(ConversationTurn turn) {
        Optional<String> reg = typed(turn).flatMap(validator::regNumber);
        if (reg.isEmpty()) {
            return TransitionResult.stay(turn, List.of(replies.text(turn.getUserId(), phrases.invalidRegNumber())));
        }
        return TransitionResult.moveTo(ConversationState.BOOKING_ENTER_PHONE,
                turn.contextWith(ContextKeys.REG_NUMBER, reg.get()),
                List.of(replies.text(turn.getUserId(), phrases.askPhone())));
    }

    public TransitionResult enterPhone(ConversationTurn turn) {
        Optional<String> phone = typed(turn).flatMap(validator::phone);
        if (phone.isEmpty()) {
            return TransitionResult.stay(turn, List.of(replies.text(turn.getUserId(), phrases.invalidPhone())));
        }
        List<Integer> seats = seatsFor(turn);
        if (seats.isEmpty()) {
            return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                    replies.text(turn.getUserId(), phrases.soldOut()),
                    replies.rootMenu(turn.getUserId(), turn.isAdmin())));
        }
        return TransitionResult.moveTo(ConversationState.BOOKING_SELECT_SEAT,
                turn.contextWith(ContextKeys.PHONE, phone.get()),
                List.of(replies.seatMenu(turn.getUserId(), phrases.chooseSeat(seats.size()), seats)));
    }

    public TransitionResult selectSeat(ConversationTurn turn) {
        List<Integer> seats = seatsFor(turn);
        String value = StringUtils.removeStartIgnoreCase(selectedValue(turn), "seat").trim();
        if (!StringUtils.isNumeric(value) || value.length() > 3 || !seats.contains(Integer.parseInt(value))) {
            if (seats.isEmpty()) {
                return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                        replies.text(turn.getUserId(), phrases.soldOut()),
                        replies.rootMenu(turn.getUserId(), turn.isAdmin())));
            }
            return TransitionResult.stay(turn, List.of(
                    replies.seatMenu(turn.getUserId(), phrases.invalidSeat(), seats)));
        }
        Map<String, String> context = turn.contextWith(ContextKeys.SEAT, String.valueOf(Integer.parseInt(value)));
        return TransitionResult.moveTo(ConversationState.BOOKING_CONFIRM, context,
                List.of(replies.confirmMenu(turn.getUserId(), summary(context))));
    }

    public TransitionResult repromptConfirm(ConversationTurn turn) {
        return TransitionResult.stay(turn, List.of(replies.confirmMenu(turn.getUserId(), summary(turn.getContext()))));
    }

    /** The only place a booking is written. */
    public TransitionResult confirm(ConversationTurn turn) {
        Map<String, String> ctx = turn.getContext();
        int seat = Integer.parseInt(ctx.get(ContextKeys.SEAT));
        BookingRequest request = BookingRequest.builder()
                .userId(turn.getUserId())
                .route(ctx.get(ContextKeys.ROUTE))
                .travelDate(LocalDate.parse(ctx.get(ContextKeys.DATE)))
                .passengerName(ctx.get(ContextKeys.NAME))
                .regNumber(ctx.get(ContextKeys.REG_NUMBER))
                .phone(ctx.get(ContextKeys.PHONE))
                .seatNumber(seat)
                .build();
        Booking booking;
        try {
            booking = bookingService.createBooking(request);
        } catch (SeatUnavailableException e) {
            log.info("[{}] seat {} taken before commit, back to seat selection", turn.getUserId(), seat);
            Map<String, String> context = new LinkedHashMap<>(ctx);
            context.remove(ContextKeys.SEAT);
            List<Integer> seats = seatsFor(turn);
            List<OutboundInstruction> out = new ArrayList<>();
            out.add(replies.text(turn.getUserId(), phrases.seatTaken(seat)));
            if (seats.isEmpty()) {
                out.add(replies.text(turn.getUserId(), phrases.soldOut()));
                out.add(replies.rootMenu(turn.getUserId(), turn.isAdmin()));
                return TransitionResult.reset(ConversationState.ROOT_MENU, out);
            }
            out.add(replies.seatMenu(turn.getUserId(), phrases.chooseSeat(seats.size()), seats));
            return TransitionResult.moveTo(ConversationState.BOOKING_SELECT_SEAT, context, out);
        } catch (TripUnavailableException e) {
            log.info("[{}] {} on {} dropped before commit", turn.getUserId(), e.getRoute(), e.getDate());
            return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                    replies.text(turn.getUserId(), phrases.tripUnavailable(
                            KnowledgeBaseBuilder.displayRoute(e.getRoute()), e.getDate().toString())),
                    replies.rootMenu(turn.getUserId(), turn.isAdmin())));
        }
        String route = KnowledgeBaseBuilder.displayRoute(booking.getRoute());
        return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                replies.text(turn.getUserId(), phrases.bookingCreated(booking.getBookingId(), route,
                        booking.getTravelDate().toString(), booking.getSeatNumber())),
                replies.text(turn.getUserId(), phrases.paymentInfo(booking.getFare())),
                replies.uploadLink(turn.getUserId(), booking.getBookingId(), appUrl)));
    }

    public TransitionResult cancel(ConversationTurn turn) {
        return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                replies.text(turn.getUserId(), phrases.bookingCancelled()),
                replies.rootMenu(turn.getUserId(), turn.isAdmin())));
    }

    /** Answers an upload button from an earlier confirmation; the state does not change. */
    public TransitionResult uploadLink(ConversationTurn turn) {
        return TransitionResult.stay(turn, List.of(
                replies.uploadLink(turn.getUserId(), turn.getInput().getValue(), appUrl)));
    }

    private Optional<String> resolveRoute(ConversationTurn turn, List<String> routes) {
        if (turn.getInput().getCategory() == InputCategory.SELECTION) {
            String value = turn.getInput().getValue().toLowerCase(Locale.ROOT);
            return routes.contains(value) ? Optional.of(value) : Optional.empty();
        }
        String text = turn.getText().toLowerCase(Locale.ROOT);
        for (String word : text.split("[^\\p{L}\\p{N}]+")) {
            if (routes.contains(word)) {
                return Optional.of(word);
            }
        }
        return Optional.empty();
    }

    private String selectedValue(ConversationTurn turn) {
        return turn.getInput().getCategory() == InputCategory.SELECTION
                ? turn.getInput().getValue()
                : turn.getText();
    }

    private Optional<String> typed(ConversationTurn turn) {
        return TYPED.contains(turn.getInput().getCategory()) ? Optional.of(turn.getText()) : Optional.empty();
    }

    private List<Integer> seatsFor(ConversationTurn turn) {
        return bookingService.availableSeats(turn.get(ContextKeys.ROUTE), LocalDate.parse(turn.get(ContextKeys.DATE)));
    }

    private List<TripAvailability> trips(String route, LocalDate today) {
        return bookingService.upcomingDates(route, today).stream()
                .map(d -> bookingService.tripAvailability(route, d))
                .collect(Collectors.toList());
    }

    private String summary(Map<String, String> ctx) {
        String route = ctx.get(ContextKeys.ROUTE);
        return phrases.confirmSummary(KnowledgeBaseBuilder.displayRoute(route), ctx.get(ContextKeys.DATE),
                ctx.get(ContextKeys.NAME), ctx.get(ContextKeys.REG_NUMBER), ctx.get(ContextKeys.PHONE),
                ctx.get(ContextKeys.SEAT), settingsService.current().getFares().fareFor(route));
    }

    private LocalDate today(ConversationTurn turn) {
        return LocalDate.ofInstant(turn.getNow(), clock.getZone());
    }

    private static Optional<LocalDate> parseDate(String value) {
        try {
            return Optional.of(LocalDate.parse(StringUtils.trimToEmpty(value)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
