package com.safar.bot.conversation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view handed to a transition handler for one event.
 */
public final class ConversationTurn {

    private final String userId;
    private final ConversationState state;
    private final Map<String, String> context;
    private final ClassifiedInput input;
    private final boolean admin;
    private final Instant now;

    public ConversationTurn(String userId, ConversationState state, Map<String, String> context,
                            ClassifiedInput input, boolean admin, Instant now) {
        this.userId = userId;
        this.state = state;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.input = input;
        this.admin = admin;
        this.now = now;
    }

    public String getUserId() {
        return userId;
    }

    public ConversationState getState() {
        return state;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public String get(String key) {
        return context.get(key);
    }

    public ClassifiedInput getInput() {
        return input;
    }

    public String getText() {
        return input.getRawText().trim();
    }

    public boolean isAdmin() {
        return admin;
    }

    public Instant getNow() {
        return now;
    }

    /** Copy of the current context, for handlers that extend it. */
    public Map<String, String> contextWith(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(context);
        copy.put(key, value);
        return copy;
    }
}
