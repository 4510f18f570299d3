package com.safar.bot.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one transition: the next state, the context to keep and the replies to send.
 */
public final class TransitionResult {

    private final ConversationState nextState;
    private final Map<String, String> context;
    private final List<OutboundInstruction> instructions;

    private TransitionResult(ConversationState nextState, Map<String, String> context,
                             List<OutboundInstruction> instructions) {
        this.nextState = nextState;
        this.context = context == null ? Collections.emptyMap() : new LinkedHashMap<>(context);
        this.instructions = instructions == null ? Collections.emptyList() : new ArrayList<>(instructions);
    }

    /** Same state, same context. Used for re-prompts after failed validation. */
    public static TransitionResult stay(ConversationTurn turn, List<OutboundInstruction> instructions) {
        return new TransitionResult(turn.getState(), turn.getContext(), instructions);
    }

    public static TransitionResult moveTo(ConversationState nextState, Map<String, String> context,
                                          List<OutboundInstruction> instructions) {
        return new TransitionResult(nextState, context, instructions);
    }

    /** Moves with an empty context. */
    public static TransitionResult reset(ConversationState nextState, List<OutboundInstruction> instructions) {
        return new TransitionResult(nextState, null, instructions);
    }

    public ConversationState getNextState() {
        return nextState;
    }

    public Map<String, String> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public List<OutboundInstruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }
}
