package com.safar.bot.dto;

public final class MatchResult {

    private static final MatchResult NO_MATCH = new MatchResult(null, 0);

    private final KnowledgeBaseEntry entry;
    private final int score;

    private MatchResult(KnowledgeBaseEntry entry, int score) {
        this.entry = entry;
        this.score = score;
    }

    public static MatchResult of(KnowledgeBaseEntry entry, int score) {
        return new MatchResult(entry, score);
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public boolean isMatch() {
        return entry != null;
    }

    public KnowledgeBaseEntry getEntry() {
        return entry;
    }

    public String getAnswer() {
        return entry == null ? null : entry.getAnswer();
    }

    public int getScore() {
        return score;
    }
}
