package com.safar.bot.service;

import com.safar.bot.component.KeyedLocks;
import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ConversationSession;
import com.safar.bot.conversation.ConversationState;
import com.safar.bot.conversation.InboundEvent;
import com.safar.bot.conversation.OutboundInstruction;
import com.safar.bot.exception.TransientStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationOrchestratorTest {

    private static final String USER = EngineFixture.USER;
    private static final ResponsePhrases PHRASES = new ResponsePhrases();

    @Mock
    private SessionStore sessionStore;

    @Mock
    private ConversationEngine engine;

    @Mock
    private OutboundTransport transport;

    private final KeyedLocks sessionLocks = new KeyedLocks(8);

    private ConversationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new ConversationOrchestrator(sessionStore, engine, transport, sessionLocks, PHRASES,
                Clock.fixed(EngineFixture.NOW, EngineFixture.ZONE));
        ReflectionTestUtils.setField(orchestrator, "lockTimeout", Duration.ofMillis(200));
    }

    @Test
    void loadsProcessesSavesThenSends() {
        ConversationSession session = ConversationSession.fresh(USER, EngineFixture.NOW);
        InboundEvent event = InboundEvent.text(USER, "hi");
        OutboundInstruction reply = OutboundInstruction.text(USER, "welcome");
        when(sessionStore.load(USER)).thenReturn(session);
        when(engine.process(session, event, EngineFixture.NOW)).thenReturn(List.of(reply));

        List<OutboundInstruction> out = orchestrator.handle(event);

        assertEquals(List.of(reply), out);
        InOrder order = inOrder(sessionStore, engine, transport);
        order.verify(sessionStore).load(USER);
        order.verify(engine).process(session, event, EngineFixture.NOW);
        order.verify(sessionStore).save(session);
        order.verify(transport).send(reply);
    }

    @Test
    void saveFailureRepliesTryAgain() {
        ConversationSession session = ConversationSession.fresh(USER, EngineFixture.NOW);
        when(sessionStore.load(USER)).thenReturn(session);
        when(engine.process(any(), any(), any())).thenReturn(List.of(OutboundInstruction.text(USER, "booked")));
        when(sessionStore.save(session)).thenThrow(new TransientStorageException("conflict"));

        List<OutboundInstruction> out = orchestrator.handle(InboundEvent.text(USER, "yes"));

        assertEquals(1, out.size());
        assertEquals(PHRASES.tryAgain(), out.get(0).getContent());
        verify(transport).send(out.get(0));
    }

    @Test
    void loadFailureSkipsEngine() {
        when(sessionStore.load(USER)).thenThrow(new TransientStorageException("down"));

        List<OutboundInstruction> out = orchestrator.handle(InboundEvent.text(USER, "hi"));

        assertEquals(PHRASES.tryAgain(), out.get(0).getContent());
        verifyNoInteractions(engine);
        verify(sessionStore, never()).save(any());
    }

    @Test
    void transportFailureDoesNotStopRemainingReplies() {
        ConversationSession session = ConversationSession.fresh(USER, EngineFixture.NOW);
        OutboundInstruction first = OutboundInstruction.text(USER, "one");
        OutboundInstruction second = OutboundInstruction.text(USER, "two");
        when(sessionStore.load(USER)).thenReturn(session);
        when(engine.process(any(), any(), any())).thenReturn(List.of(first, second));
        doThrow(new IllegalStateException("provider down")).when(transport).send(first);

        List<OutboundInstruction> out = orchestrator.handle(InboundEvent.text(USER, "hi"));

        assertEquals(2, out.size());
        verify(transport).send(second);
        verify(sessionStore).save(session);
    }

    @Test
    void busyLockRepliesTryAgainWithoutTouchingSession() throws Exception {
        ReentrantLock lock = sessionLocks.lockFor(USER);
        ExecutorService holder = Executors.newSingleThreadExecutor();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> f = holder.submit(() -> {
            lock.lock();
            try {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                lock.unlock();
            }
        });
        assertTrue(held.await(5, TimeUnit.SECONDS));

        List<OutboundInstruction> out = orchestrator.handle(InboundEvent.text(USER, "hi"));

        release.countDown();
        f.get(5, TimeUnit.SECONDS);
        holder.shutdown();
        assertEquals(PHRASES.tryAgain(), out.get(0).getContent());
        verifyNoInteractions(sessionStore, engine);
    }

    @Test
    void sameUserEventsAreSerialized() throws Exception {
        ConversationSession session = new ConversationSession(USER, ConversationState.ROOT_MENU, null,
                EngineFixture.NOW, 0L);
        when(sessionStore.load(USER)).thenReturn(session);
        ReentrantLock lock = sessionLocks.lockFor(USER);
        when(engine.process(any(), any(), any())).thenAnswer(inv -> {
            assertTrue(lock.isHeldByCurrentThread());
            assertEquals(1, lock.getHoldCount());
            return List.of(OutboundInstruction.text(USER, "ok"));
        });
        ReflectionTestUtils.setField(orchestrator, "lockTimeout", Duration.ofSeconds(5));
        ExecutorService pool = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 20; i++) {
            pool.submit(() -> orchestrator.handle(InboundEvent.text(USER, "hi")));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        verify(engine, times(20)).process(any(), any(), any());
        verify(sessionStore, times(20)).save(session);
        assertFalse(lock.isLocked());
    }
}
