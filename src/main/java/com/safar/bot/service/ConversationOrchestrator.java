package com.safar.bot.service;

import com.safar.bot.component.KeyedLocks;
import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ConversationSession;
import com.safar.bot.conversation.InboundEvent;
import com.safar.bot.conversation.OutboundInstruction;
import com.safar.bot.exception.TransientStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry for an inbound event: load, process and save the sender's session under
 * the per-user lock, then push the replies after the lock is released.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final SessionStore sessionStore;
    private final ConversationEngine engine;
    private final OutboundTransport transport;
    private final KeyedLocks sessionLocks;
    private final ResponsePhrases phrases;
    private final Clock clock;

    @Value("${bot.session.lock-timeout:10s}")
    private Duration lockTimeout = Duration.ofSeconds(10);

    public ConversationOrchestrator(SessionStore sessionStore,
                                    ConversationEngine engine,
                                    OutboundTransport transport,
                                    @Qualifier("sessionLocks") KeyedLocks sessionLocks,
                                    ResponsePhrases phrases,
                                    Clock clock) {
        this.sessionStore = sessionStore;
        this.engine = engine;
        this.transport = transport;
        this.sessionLocks = sessionLocks;
        this.phrases = phrases;
        this.clock = clock;
    }

    public List<OutboundInstruction> handle(InboundEvent event) {
        List<OutboundInstruction> replies = process(event);
        for (OutboundInstruction reply : replies) {
            try {
                transport.send(reply);
            } catch (RuntimeException e) {
                log.error("[{}] failed to send {}", event.getSenderId(), reply, e);
            }
        }
        return replies;
    }

    List<OutboundInstruction> process(InboundEvent event) {
        String userId = event.getSenderId();
        ReentrantLock lock = sessionLocks.lockFor(userId);
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[{}] timed out waiting for session lock", userId);
                return List.of(OutboundInstruction.text(userId, phrases.tryAgain()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] interrupted waiting for session lock", userId);
            return List.of(OutboundInstruction.text(userId, phrases.tryAgain()));
        }
        try {
            ConversationSession session = sessionStore.load(userId);
            List<OutboundInstruction> replies = engine.process(session, event, clock.instant());
            sessionStore.save(session);
            return replies;
        } catch (TransientStorageException e) {
            log.warn("[{}] session storage unavailable: {}", userId, e.getMessage());
            return List.of(OutboundInstruction.text(userId, phrases.tryAgain()));
        } finally {
            lock.unlock();
        }
    }
}
