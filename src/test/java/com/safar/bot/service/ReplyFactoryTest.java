package com.safar.bot.service;

import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ButtonIds;
import com.safar.bot.conversation.OutboundInstruction;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReplyFactoryTest {

    private static final String USER = "923009998877";

    private final ReplyFactory replies = new ReplyFactory(new ResponsePhrases());

    private static String lines(int count) {
        StringBuilder sb = new StringBuilder("Frequently asked:");
        for (int i = 1; i <= count; i++) {
            sb.append("\n").append(i).append(". Question about the trip number ").append(i)
                    .append(" - answer with some detail.");
        }
        return sb.toString();
    }

    @Nested
    class FaqAnswer {

        @Test
        void shortAnswerIsTheMenuBody() {
            List<OutboundInstruction> out = replies.faqAnswer(USER, "Fares: Multan Rs. 3500");

            assertEquals(1, out.size());
            assertEquals(OutboundInstruction.Kind.BUTTON_MENU, out.get(0).getKind());
            assertEquals("Fares: Multan Rs. 3500", out.get(0).getContent());
            assertEquals(ButtonIds.FAQ, out.get(0).getOptions().get(0).getId());
        }

        @Test
        void longAnswerIsSentWholeAsTextBeforeTheMenu() {
            String answer = lines(25);
            assertTrue(answer.length() > ReplyFactory.MENU_BODY_MAX);

            List<OutboundInstruction> out = replies.faqAnswer(USER, answer);

            assertEquals(2, out.size());
            assertEquals(OutboundInstruction.Kind.TEXT, out.get(0).getKind());
            assertEquals(answer, out.get(0).getContent());
            OutboundInstruction menu = out.get(1);
            assertEquals(OutboundInstruction.Kind.BUTTON_MENU, menu.getKind());
            assertEquals(new ResponsePhrases().faqAnythingElse(), menu.getContent());
            assertEquals(3, menu.getOptions().size());
        }

        @Test
        void veryLongAnswerIsSplitOnLineBreaks() {
            String answer = lines(120);
            assertTrue(answer.length() > ReplyFactory.TEXT_MAX);

            List<OutboundInstruction> out = replies.faqAnswer(USER, answer);
            List<String> texts = out.subList(0, out.size() - 1).stream()
                    .map(OutboundInstruction::getContent).collect(Collectors.toList());

            assertTrue(texts.size() >= 2);
            texts.forEach(t -> assertTrue(t.length() <= ReplyFactory.TEXT_MAX, "chunk " + t.length()));
            assertEquals(answer, String.join("\n", texts));
        }
    }

    @Test
    void unbrokenTextIsCutAtTheLimit() {
        List<String> parts = ReplyFactory.chunks(StringUtils.repeat('x', 25), 10);

        assertEquals(List.of("xxxxxxxxxx", "xxxxxxxxxx", "xxxxx"), parts);
    }
}
