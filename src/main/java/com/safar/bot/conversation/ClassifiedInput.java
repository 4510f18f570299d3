package com.safar.bot.conversation;

import com.safar.bot.dto.AdminCommand;

/**
 * Result of input classification: the category plus whatever the category carries
 * (selected id suffix, FAQ category, parsed admin command, raw text).
 */
public final class ClassifiedInput {

    private final InputCategory category;
    private final String value;
    private final String rawText;
    private final FaqCategory faqCategory;
    private final AdminCommand adminCommand;

    private ClassifiedInput(InputCategory category, String value, String rawText,
                            FaqCategory faqCategory, AdminCommand adminCommand) {
        this.category = category;
        this.value = value;
        this.rawText = rawText;
        this.faqCategory = faqCategory;
        this.adminCommand = adminCommand;
    }

    public static ClassifiedInput of(InputCategory category, String rawText) {
        return new ClassifiedInput(category, null, rawText, null, null);
    }

    public static ClassifiedInput selection(String value, String rawText) {
        return new ClassifiedInput(InputCategory.SELECTION, value, rawText, null, null);
    }

    public static ClassifiedInput upload(String bookingId, String rawText) {
        return new ClassifiedInput(InputCategory.UPLOAD_PAYMENT, bookingId, rawText, null, null);
    }

    public static ClassifiedInput faqCategory(FaqCategory category, String rawText) {
        return new ClassifiedInput(InputCategory.FAQ_CATEGORY, null, rawText, category, null);
    }

    public static ClassifiedInput admin(AdminCommand command, String rawText) {
        InputCategory category = command.getKind() == AdminCommand.Kind.SHOW_MENU
                ? InputCategory.ADMIN_MENU
                : InputCategory.ADMIN_COMMAND;
        return new ClassifiedInput(category, null, rawText, null, command);
    }

    public static ClassifiedInput freeText(String rawText) {
        return new ClassifiedInput(InputCategory.FREE_TEXT, null, rawText, null, null);
    }

    public InputCategory getCategory() {
        return category;
    }

    /** Suffix of a prefixed button id (route key, date, seat number, booking id). */
    public String getValue() {
        return value;
    }

    public String getRawText() {
        return rawText == null ? "" : rawText;
    }

    public FaqCategory getFaqCategory() {
        return faqCategory;
    }

    public AdminCommand getAdminCommand() {
        return adminCommand;
    }

    @Override
    public String toString() {
        return category + (value != null ? "(" + value + ")" : "");
    }
}
