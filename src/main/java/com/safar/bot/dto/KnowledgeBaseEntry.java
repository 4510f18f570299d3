package com.safar.bot.dto;

import com.safar.bot.conversation.FaqCategory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public final class KnowledgeBaseEntry {

    private final Set<String> keywords;
    private final String answer;
    private final FaqCategory category;

    public KnowledgeBaseEntry(Set<String> keywords, String answer, FaqCategory category) {
        this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        this.answer = answer;
        this.category = category;
    }

    public Set<String> getKeywords() {
        return keywords;
    }

    public String getAnswer() {
        return answer;
    }

    public FaqCategory getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KnowledgeBaseEntry)) return false;
        KnowledgeBaseEntry that = (KnowledgeBaseEntry) o;
        return keywords.equals(that.keywords) && Objects.equals(answer, that.answer) && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(keywords, answer, category);
    }

    @Override
    public String toString() {
        return "KnowledgeBaseEntry{" + category + ", keywords=" + keywords + "}";
    }
}
