package com.safar.bot.service;

import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.KnowledgeBaseIndex;
import com.safar.bot.dto.MatchResult;
import com.safar.bot.entity.FaqEntry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the live knowledge-base index. A rebuild builds a new index off to the side and
 * swaps the reference, so lookups see either the old or the new index, never a mix.
 */
@Service
public class KnowledgeBaseService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseService.class);

    private final KnowledgeBaseBuilder builder;
    private final KeywordMatcher matcher;
    private final AtomicReference<KnowledgeBaseIndex> current = new AtomicReference<>(KnowledgeBaseIndex.empty());

    public KnowledgeBaseService(KnowledgeBaseBuilder builder, KeywordMatcher matcher) {
        this.builder = builder;
        this.matcher = matcher;
    }

    public KnowledgeBaseIndex rebuild(BusinessSettings settings, List<FaqEntry> faqRows) {
        KnowledgeBaseIndex index = builder.build(settings, faqRows);
        current.set(index);
        log.info("Knowledge base rebuilt: {} entries", index.size());
        return index;
    }

    public KnowledgeBaseIndex current() {
        return current.get();
    }

    public MatchResult lookup(String query) {
        return matcher.match(query, current.get());
    }

    @PreDestroy
    public void teardown() {
        current.set(KnowledgeBaseIndex.empty());
        log.debug("Knowledge base released");
    }
}
