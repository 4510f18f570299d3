package com.safar.bot.service;

import com.safar.bot.conversation.FaqCategory;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.FareSettings;
import com.safar.bot.dto.KnowledgeBaseEntry;
import com.safar.bot.dto.KnowledgeBaseIndex;
import com.safar.bot.dto.SettingKey;
import com.safar.bot.entity.FaqEntry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseBuilderTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();
    private final KnowledgeBaseBuilder builder = new KnowledgeBaseBuilder(normalizer);
    private final KeywordMatcher matcher = new KeywordMatcher(normalizer);

    @Test
    void entriesFollowFixedOrder() {
        KnowledgeBaseIndex index = builder.build(BusinessSettings.defaults(), List.of());

        List<KnowledgeBaseEntry> entries = index.getEntries();
        assertEquals(FaqCategory.FARES, entries.get(0).getCategory());
        assertEquals(FaqCategory.FARES, entries.get(1).getCategory());
        assertTrue(entries.get(1).getKeywords().contains("multan"));
        assertTrue(entries.get(2).getKeywords().contains("bahawalpur"));
        assertEquals(FaqCategory.DATES, entries.get(3).getCategory());
        assertEquals(FaqCategory.RETURN, entries.get(4).getCategory());
        assertEquals(FaqCategory.LUGGAGE, entries.get(5).getCategory());
        assertEquals(FaqCategory.LOCATIONS, entries.get(6).getCategory());
        assertEquals(FaqCategory.ROUTE, entries.get(7).getCategory());
        assertEquals(8, index.size());
    }

    @Test
    void fareChangeIsReflectedInFaresAnswer() {
        BusinessSettings defaults = BusinessSettings.defaults();
        Map<String, Integer> fares = new LinkedHashMap<>(defaults.getFares().getFares());
        fares.put("multan", 3800);
        BusinessSettings updated = defaults.with(SettingKey.FARES,
                FareSettings.builder().fares(fares).currency("PKR").build());

        KnowledgeBaseIndex index = builder.build(updated, List.of());

        String answer = matcher.match("what is the fare", index).getAnswer();
        assertTrue(answer.contains("Multan: Rs. 3800"), answer);
        assertFalse(answer.contains("3500"), answer);
        assertEquals("Multan fare is Rs. 3800 per seat.", matcher.match("multan fare", index).getAnswer());
    }

    @Test
    void luggageAnswerDescribesAllowance() {
        String answer = builder.luggageAnswer(BusinessSettings.defaults());

        assertTrue(answer.startsWith("You can bring 2 medium bags plus 1 hand carry bag."), answer);
    }

    @Test
    void faqRowsAppendedByIdAndInactiveRowsSkipped() {
        FaqEntry later = FaqEntry.builder().id(7L).question("Is wifi available?").answer("No").active(true).build();
        FaqEntry earlier = FaqEntry.builder().id(3L).question("Pets?").answer("Not allowed")
                .keywords("pet, pets, animals").category("general").active(true).build();
        FaqEntry removed = FaqEntry.builder().id(5L).question("Old").answer("Gone").active(false).build();

        KnowledgeBaseIndex index = builder.build(BusinessSettings.defaults(), List.of(later, removed, earlier));

        List<KnowledgeBaseEntry> entries = index.getEntries();
        assertEquals(10, entries.size());
        assertEquals("Not allowed", entries.get(8).getAnswer());
        assertEquals(FaqCategory.GENERAL, entries.get(8).getCategory());
        assertEquals("No", entries.get(9).getAnswer());
        assertTrue(entries.get(9).getKeywords().contains("wifi"));
    }
}
