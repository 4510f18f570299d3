package com.safar.bot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safar.bot.conversation.ConversationSession;
import com.safar.bot.conversation.ConversationState;
import com.safar.bot.entity.ChatSession;
import com.safar.bot.exception.StateCorruptionException;
import com.safar.bot.exception.TransientStorageException;
import com.safar.bot.repository.ChatSessionRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed session storage. A missing key loads as a fresh root-menu session; an undecodable
 * row is logged and replaced by a reset session carrying the row version.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private static final TypeReference<LinkedHashMap<String, String>> CONTEXT_TYPE = new TypeReference<>() {
    };

    private final ChatSessionRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SessionStore(ChatSessionRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ConversationSession load(String userId) {
        Optional<ChatSession> row;
        try {
            row = repository.findById(userId);
        } catch (DataAccessException | TransactionException e) {
            throw new TransientStorageException("Session load failed for " + userId, e);
        }
        if (row.isEmpty()) {
            return ConversationSession.fresh(userId, clock.instant());
        }
        try {
            return decode(row.get());
        } catch (StateCorruptionException e) {
            log.error("[{}] corrupt session, resetting to {}", userId, ConversationState.ROOT_MENU, e);
            ConversationSession reset = ConversationSession.fresh(userId, clock.instant());
            reset.setVersion(row.get().getVersion());
            return reset;
        }
    }

    /**
     * Upsert in the repository's own transaction, so a version conflict surfaces from this call
     * rather than from an outer commit.
     */
    public ConversationSession save(ConversationSession session) {
        ChatSession entity = ChatSession.builder()
                .userId(session.getUserId())
                .state(session.getState().name())
                .contextJson(encode(session.getContext()))
                .updatedAt(session.getUpdatedAt() != null ? session.getUpdatedAt() : clock.instant())
                .version(session.getVersion())
                .build();
        try {
            ChatSession saved = repository.save(entity);
            session.setVersion(saved.getVersion());
            return session;
        } catch (DataAccessException | TransactionException e) {
            throw new TransientStorageException("Session save failed for " + session.getUserId(), e);
        }
    }

    ConversationSession decode(ChatSession row) {
        ConversationState state;
        try {
            state = ConversationState.valueOf(StringUtils.trimToEmpty(row.getState()));
        } catch (IllegalArgumentException e) {
            throw new StateCorruptionException("Unknown state '" + row.getState() + "'", e);
        }
        Map<String, String> context;
        try {
            context = StringUtils.isBlank(row.getContextJson())
                    ? new LinkedHashMap<>()
                    : objectMapper.readValue(row.getContextJson(), CONTEXT_TYPE);
        } catch (JsonProcessingException e) {
            throw new StateCorruptionException("Unreadable context", e);
        }
        if (context == null) {
            throw new StateCorruptionException("Null context");
        }
        return new ConversationSession(row.getUserId(), state, context, row.getUpdatedAt(), row.getVersion());
    }

    private String encode(Map<String, String> context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise session context", e);
        }
    }
}
