package com.safar.bot.service;

import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ConversationState;
import com.safar.bot.conversation.ConversationTurn;
import com.safar.bot.conversation.TransitionResult;
import com.safar.bot.dto.TripAvailability;
import com.safar.bot.entity.Booking;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
public class StatusFlowService {

    private final BookingService bookingService;
    private final PassengerDetailsValidator validator;
    private final ReplyFactory replies;
    private final ResponsePhrases phrases;
    private final Clock clock;

    public StatusFlowService(BookingService bookingService,
                             PassengerDetailsValidator validator,
                             ReplyFactory replies,
                             ResponsePhrases phrases,
                             Clock clock) {
        this.bookingService = bookingService;
        this.validator = validator;
        this.replies = replies;
        this.phrases = phrases;
        this.clock = clock;
    }

    public TransitionResult showMenu(ConversationTurn turn) {
        return TransitionResult.reset(ConversationState.STATUS_MENU, List.of(replies.statusMenu(turn.getUserId())));
    }

    /** Read-only: passes through STATUS_BUS and rests in the root menu. */
    public TransitionResult busStatus(ConversationTurn turn) {
        LocalDate today = LocalDate.ofInstant(turn.getNow(), clock.getZone());
        return TransitionResult.reset(ConversationState.STATUS_BUS, List.of(
                replies.text(turn.getUserId(), busStatusText(today)),
                replies.rootMenu(turn.getUserId(), turn.isAdmin())));
    }

    public TransitionResult askPhone(ConversationTurn turn) {
        return TransitionResult.reset(ConversationState.STATUS_LOOKUP_PHONE,
                List.of(replies.text(turn.getUserId(), phrases.askLookupPhone())));
    }

    public TransitionResult lookup(ConversationTurn turn) {
        Optional<String> phone = validator.phone(turn.getText());
        if (phone.isEmpty()) {
            return TransitionResult.stay(turn, List.of(replies.text(turn.getUserId(), phrases.invalidPhone())));
        }
        List<Booking> bookings = bookingService.findByPhone(phone.get());
        String reply;
        if (bookings.isEmpty()) {
            reply = phrases.noBookingsFound(phone.get());
        } else {
            StringBuilder sb = new StringBuilder(phrases.bookingsHeader(phone.get()));
            for (Booking b : bookings) {
                sb.append("\n- ").append(b.getBookingId()).append(": ")
                        .append(KnowledgeBaseBuilder.displayRoute(b.getRoute())).append(", ")
                        .append(b.getTravelDate()).append(", seat ").append(b.getSeatNumber())
                        .append(" (").append(b.getStatus().name().toLowerCase()).append(")");
            }
            reply = sb.toString();
        }
        return TransitionResult.reset(ConversationState.ROOT_MENU, List.of(
                replies.text(turn.getUserId(), reply),
                replies.rootMenu(turn.getUserId(), turn.isAdmin())));
    }

    public TransitionResult backToRoot(ConversationTurn turn) {
        return TransitionResult.reset(ConversationState.ROOT_MENU,
                List.of(replies.rootMenu(turn.getUserId(), turn.isAdmin())));
    }

    String busStatusText(LocalDate today) {
        List<TripAvailability> trips = bookingService.upcomingTrips(today);
        if (trips.isEmpty()) {
            return phrases.busStatusEmpty();
        }
        StringBuilder sb = new StringBuilder(phrases.busStatusHeader());
        for (TripAvailability t : trips) {
            sb.append("\n- ").append(KnowledgeBaseBuilder.displayRoute(t.getRoute())).append(" ").append(t.getDate())
                    .append(": ").append(t.isSoldOut() ? "sold out" : t.getFreeSeats() + "/" + t.getTotalSeats() + " seats free");
            if (t.getFare() != null) {
                sb.append(", Rs. ").append(t.getFare());
            }
        }
        return sb.toString();
    }
}
