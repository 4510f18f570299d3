package com.safar.bot.service;

import com.safar.bot.conversation.FaqCategory;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.KnowledgeBaseEntry;
import com.safar.bot.dto.KnowledgeBaseIndex;
import com.safar.bot.dto.MatchResult;
import com.safar.bot.entity.FaqEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordMatcherTest {

    private QueryNormalizer normalizer;
    private KeywordMatcher matcher;

    @BeforeEach
    void setUp() {
        normalizer = new QueryNormalizer();
        matcher = new KeywordMatcher(normalizer);
    }

    @Nested
    class Normalization {

        @Test
        void lowercasesStripsPunctuationAndStopWords() {
            assertEquals(List.of("much", "luggage", "allowance"),
                    normalizer.tokens("How much is the LUGGAGE allowance??"));
        }

        @Test
        void dropsSingleCharacterTokens() {
            assertEquals(List.of("bags"), normalizer.tokens("2 x bags"));
        }

        @Test
        void blankInputGivesNoTokens() {
            assertTrue(normalizer.tokens("  ?! ").isEmpty());
            assertTrue(normalizer.tokens(null).isEmpty());
        }
    }

    @Test
    void luggageQuestionMatchesLuggageEntry() {
        KnowledgeBaseIndex index = new KnowledgeBaseIndex(List.of(
                new KnowledgeBaseEntry(Set.of("fare", "price"), "Rs. 3500", FaqCategory.FARES),
                new KnowledgeBaseEntry(Set.of("luggage", "allowance", "bags"), "2 medium bags...", FaqCategory.LUGGAGE)));

        MatchResult result = matcher.match("how much is the luggage allowance", index);

        assertTrue(result.isMatch());
        assertEquals("2 medium bags...", result.getAnswer());
        assertEquals(2, result.getScore());
    }

    @Test
    void unrelatedQuestionIsNoMatch() {
        KnowledgeBaseIndex index = new KnowledgeBuilderFixture().index();

        MatchResult result = matcher.match("what time is lunch", index);

        assertFalse(result.isMatch());
        assertNull(result.getAnswer());
    }

    @Test
    void tieGoesToFirstInsertedEntry() {
        KnowledgeBaseIndex index = new KnowledgeBaseIndex(List.of(
                new KnowledgeBaseEntry(Set.of("bus", "seat"), "first", null),
                new KnowledgeBaseEntry(Set.of("bus", "seat"), "second", null)));

        assertEquals("first", matcher.match("bus seat", index).getAnswer());
    }

    @Test
    void strictlyHigherScoreReplacesEarlierEntry() {
        KnowledgeBaseIndex index = new KnowledgeBaseIndex(List.of(
                new KnowledgeBaseEntry(Set.of("fare"), "overview", FaqCategory.FARES),
                new KnowledgeBaseEntry(Set.of("fare", "multan"), "multan fare", FaqCategory.FARES)));

        assertEquals("multan fare", matcher.match("fare to multan", index).getAnswer());
    }

    @Test
    void rebuildingFromSameInputsGivesSameOutcomes() {
        KnowledgeBuilderFixture fixture = new KnowledgeBuilderFixture();
        KnowledgeBaseIndex first = fixture.index();
        KnowledgeBaseIndex second = fixture.index();

        assertEquals(first, second);
        for (String q : List.of("fare", "when do buses leave", "pickup point", "pay", "return date", "bags")) {
            assertEquals(first.getEntries().indexOf(matcher.match(q, first).getEntry()),
                    second.getEntries().indexOf(matcher.match(q, second).getEntry()), q);
        }
    }

    @Test
    void emptyIndexNeverMatches() {
        assertFalse(matcher.match("luggage", KnowledgeBaseIndex.empty()).isMatch());
    }

    private class KnowledgeBuilderFixture {

        KnowledgeBaseIndex index() {
            FaqEntry pay = FaqEntry.builder().id(1L).question("How do I pay?").answer("EasyPaisa")
                    .keywords("pay, payment").active(true).build();
            return new KnowledgeBaseBuilder(normalizer).build(BusinessSettings.defaults(), List.of(pay));
        }
    }
}
