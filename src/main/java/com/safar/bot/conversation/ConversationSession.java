package com.safar.bot.conversation;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-user dialogue position and collected booking data. Mutated once per inbound event.
 */
public class ConversationSession {

    private final String userId;
    private ConversationState state;
    private final Map<String, String> context = new LinkedHashMap<>();
    private Instant updatedAt;
    private Long version;

    public ConversationSession(String userId, ConversationState state, Map<String, String> context,
                               Instant updatedAt, Long version) {
        this.userId = userId;
        this.state = state;
        if (context != null) {
            this.context.putAll(context);
        }
        this.updatedAt = updatedAt;
        this.version = version;
    }

    public static ConversationSession fresh(String userId, Instant now) {
        return new ConversationSession(userId, ConversationState.ROOT_MENU, null, now, null);
    }

    public String getUserId() {
        return userId;
    }

    public ConversationState getState() {
        return state;
    }

    public void setState(ConversationState state) {
        this.state = state;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public String get(String key) {
        return context.get(key);
    }

    public void replaceContext(Map<String, String> values) {
        context.clear();
        if (values != null) {
            context.putAll(values);
        }
    }

    /** Drops every context key the current state does not allow. */
    public void retainAllowedKeys() {
        context.keySet().retainAll(state.getAllowedKeys());
    }

    public void reset() {
        state = ConversationState.ROOT_MENU;
        context.clear();
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public ConversationSession copy() {
        return new ConversationSession(userId, state, context, updatedAt, version);
    }
}
