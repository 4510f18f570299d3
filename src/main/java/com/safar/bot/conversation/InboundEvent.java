package com.safar.bot.conversation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One user message as delivered by the webhook.
 */
@Getter
@AllArgsConstructor
@ToString
public class InboundEvent {

    public enum Kind { TEXT, BUTTON_REPLY }

    private final String senderId;
    private final Kind kind;
    private final String payload;

    public static InboundEvent text(String senderId, String text) {
        return new InboundEvent(senderId, Kind.TEXT, text);
    }

    public static InboundEvent button(String senderId, String buttonId) {
        return new InboundEvent(senderId, Kind.BUTTON_REPLY, buttonId);
    }

    public boolean isButton() {
        return kind == Kind.BUTTON_REPLY;
    }
}
