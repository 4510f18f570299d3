package com.safar.bot.dto;

import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable list of entries. Order is the tie-break for equal match scores.
 */
public final class KnowledgeBaseIndex {

    private static final KnowledgeBaseIndex EMPTY = new KnowledgeBaseIndex(Collections.emptyList());

    private final List<KnowledgeBaseEntry> entries;

    public KnowledgeBaseIndex(List<KnowledgeBaseEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static KnowledgeBaseIndex empty() {
        return EMPTY;
    }

    public List<KnowledgeBaseEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KnowledgeBaseIndex && entries.equals(((KnowledgeBaseIndex) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
