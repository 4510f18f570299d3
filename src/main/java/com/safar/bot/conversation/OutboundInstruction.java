package com.safar.bot.conversation;

import java.util.Collections;
import java.util.List;

/**
 * Transport-neutral reply. The engine produces these; an OutboundTransport renders them.
 */
public final class OutboundInstruction {

    public enum Kind {
        TEXT,
        BUTTON_MENU,
        DOCUMENT_LINK
    }

    private final String recipientId;
    private final Kind kind;
    private final String content;
    private final List<MenuOption> options;
    private final String link;

    private OutboundInstruction(String recipientId, Kind kind, String content, List<MenuOption> options, String link) {
        this.recipientId = recipientId;
        this.kind = kind;
        this.content = content;
        this.options = options == null ? Collections.emptyList() : List.copyOf(options);
        this.link = link;
    }

    public static OutboundInstruction text(String recipientId, String content) {
        return new OutboundInstruction(recipientId, Kind.TEXT, content, null, null);
    }

    public static OutboundInstruction menu(String recipientId, String content, List<MenuOption> options) {
        return new OutboundInstruction(recipientId, Kind.BUTTON_MENU, content, options, null);
    }

    public static OutboundInstruction link(String recipientId, String content, String link) {
        return new OutboundInstruction(recipientId, Kind.DOCUMENT_LINK, content, null, link);
    }

    public String getRecipientId() {
        return recipientId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getContent() {
        return content;
    }

    public List<MenuOption> getOptions() {
        return options;
    }

    public String getLink() {
        return link;
    }

    @Override
    public String toString() {
        return "OutboundInstruction{" + kind + " to " + recipientId + ", options=" + options.size() + "}";
    }
}
