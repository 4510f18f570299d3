package com.safar.bot.service;

import com.safar.bot.dto.KnowledgeBaseEntry;
import com.safar.bot.dto.KnowledgeBaseIndex;
import com.safar.bot.dto.MatchResult;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Scores entries by keyword overlap with the query. Highest score wins; on a tie the entry
 * that appears first in the index is kept. A best score of zero is no match.
 */
@Component
public class KeywordMatcher {

    private final QueryNormalizer normalizer;

    public KeywordMatcher(QueryNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public MatchResult match(String query, KnowledgeBaseIndex index) {
        Set<String> tokens = normalizer.tokenSet(query);
        if (tokens.isEmpty() || index == null) {
            return MatchResult.noMatch();
        }
        KnowledgeBaseEntry best = null;
        int bestScore = 0;
        for (KnowledgeBaseEntry entry : index.getEntries()) {
            int score = 0;
            for (String token : tokens) {
                if (entry.getKeywords().contains(token)) {
                    score++;
                }
            }
            if (score > bestScore) {
                best = entry;
                bestScore = score;
            }
        }
        return best == null ? MatchResult.noMatch() : MatchResult.of(best, bestScore);
    }
}
