package com.safar.bot.service;

import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ClassifiedInput;
import com.safar.bot.conversation.ConversationSession;
import com.safar.bot.conversation.ConversationState;
import com.safar.bot.conversation.ConversationTurn;
import com.safar.bot.conversation.InboundEvent;
import com.safar.bot.conversation.OutboundInstruction;
import com.safar.bot.conversation.TransitionResult;
import com.safar.bot.exception.TransientStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Advances one session by one inbound event. No network I/O; reads and writes go through
 * the booking service and the in-memory settings snapshot only.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    private final InputClassifier classifier;
    private final TransitionTable transitionTable;
    private final AdminDirectory adminDirectory;
    private final ResponsePhrases phrases;

    @Value("${bot.session.idle-timeout:30m}")
    private Duration idleTimeout = Duration.ofMinutes(30);

    public ConversationEngine(InputClassifier classifier,
                              TransitionTable transitionTable,
                              AdminDirectory adminDirectory,
                              ResponsePhrases phrases) {
        this.classifier = classifier;
        this.transitionTable = transitionTable;
        this.adminDirectory = adminDirectory;
        this.phrases = phrases;
    }

    /**
     * Mutates {@code session} in place and returns the replies to send.
     */
    public List<OutboundInstruction> process(ConversationSession session, InboundEvent event, Instant now) {
        String userId = session.getUserId();
        boolean admin = adminDirectory.isAdmin(userId);
        normalize(session, admin, now);

        ConversationState from = session.getState();
        ClassifiedInput input = classifier.classify(event, admin);
        ConversationTurn turn = new ConversationTurn(userId, from, session.getContext(), input, admin, now);

        TransitionResult result;
        try {
            result = transitionTable.lookup(from, input.getCategory()).handle(turn);
        } catch (TransientStorageException e) {
            log.warn("[{}] storage unavailable in {} ({}): {}", userId, from, input.getCategory(), e.getMessage());
            return List.of(OutboundInstruction.text(userId, phrases.tryAgain()));
        }

        ConversationState to = result.getNextState().restingState();
        session.setState(to);
        session.replaceContext(result.getContext());
        session.retainAllowedKeys();
        session.setUpdatedAt(now);
        log.info("[{}] {} -> {} ({})", userId, from, to, input.getCategory());
        return result.getInstructions();
    }

    /** Recovery applied before dispatch: idle reset, transient states, admin guard, context shape. */
    private void normalize(ConversationSession session, boolean admin, Instant now) {
        String userId = session.getUserId();
        if (session.getUpdatedAt() != null && Duration.between(session.getUpdatedAt(), now).compareTo(idleTimeout) > 0) {
            if (session.getState() != ConversationState.ROOT_MENU || !session.getContext().isEmpty()) {
                log.info("[{}] session idle since {}, resetting from {}", userId, session.getUpdatedAt(), session.getState());
            }
            session.reset();
        }
        if (session.getState().isTransient()) {
            session.setState(session.getState().restingState());
        }
        if (session.getState() == ConversationState.ADMIN_MENU && !admin) {
            log.warn("[{}] no longer authorized, leaving admin menu", userId);
            session.reset();
        }
        session.retainAllowedKeys();
        if (!session.getContext().keySet().containsAll(session.getState().getAllowedKeys())) {
            log.warn("[{}] {} is missing context {}, resetting", userId, session.getState(), session.getContext().keySet());
            session.reset();
        }
    }
}
