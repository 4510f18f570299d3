package com.safar.bot.service;

import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ConversationState;
import com.safar.bot.conversation.ConversationTurn;
import com.safar.bot.conversation.FaqCategory;
import com.safar.bot.conversation.TransitionResult;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.MatchResult;
import com.safar.bot.entity.FaqEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * FAQ sub-flow. Category taps get canned answers built from the live settings; free text
 * goes through the keyword matcher. Both come back to the FAQ menu.
 */
@Service
public class FaqService {

    private static final Logger log = LoggerFactory.getLogger(FaqService.class);

    private final KnowledgeBaseService knowledgeBaseService;
    private final KnowledgeBaseBuilder knowledgeBaseBuilder;
    private final SettingsService settingsService;
    private final StatusFlowService statusFlowService;
    private final ReplyFactory replies;
    private final ResponsePhrases phrases;
    private final Clock clock;

    public FaqService(KnowledgeBaseService knowledgeBaseService,
                      KnowledgeBaseBuilder knowledgeBaseBuilder,
                      SettingsService settingsService,
                      StatusFlowService statusFlowService,
                      ReplyFactory replies,
                      ResponsePhrases phrases,
                      Clock clock) {
        this.knowledgeBaseService = knowledgeBaseService;
        this.knowledgeBaseBuilder = knowledgeBaseBuilder;
        this.settingsService = settingsService;
        this.statusFlowService = statusFlowService;
        this.replies = replies;
        this.phrases = phrases;
        this.clock = clock;
    }

    public TransitionResult showMenu(ConversationTurn turn) {
        return TransitionResult.reset(ConversationState.FAQ_MENU,
                List.of(replies.faqMenu(turn.getUserId(), phrases.faqMenu())));
    }

    public TransitionResult categoryAnswer(ConversationTurn turn) {
        FaqCategory category = turn.getInput().getFaqCategory();
        String answer = answerFor(category, LocalDate.ofInstant(turn.getNow(), clock.getZone()));
        return TransitionResult.reset(ConversationState.FAQ_CATEGORY_RESULT,
                replies.faqAnswer(turn.getUserId(), answer));
    }

    public TransitionResult freeForm(ConversationTurn turn) {
        MatchResult match = knowledgeBaseService.lookup(turn.getText());
        if (!match.isMatch()) {
            log.debug("[{}] no FAQ match for '{}'", turn.getUserId(), turn.getText());
            return TransitionResult.reset(ConversationState.FAQ_FREEFORM,
                    List.of(replies.faqMenu(turn.getUserId(), phrases.faqNoMatch())));
        }
        log.debug("[{}] FAQ match score={} category={}", turn.getUserId(), match.getScore(),
                match.getEntry().getCategory());
        return TransitionResult.reset(ConversationState.FAQ_FREEFORM,
                replies.faqAnswer(turn.getUserId(), match.getAnswer()));
    }

    String answerFor(FaqCategory category, LocalDate today) {
        BusinessSettings settings = settingsService.current();
        switch (category) {
            case DATES:
                return knowledgeBaseBuilder.datesAnswer(settings);
            case FARES:
                return knowledgeBaseBuilder.faresAnswer(settings);
            case ROUTE:
                return knowledgeBaseBuilder.routeAnswer(settings);
            case RETURN:
                return knowledgeBaseBuilder.returnAnswer(settings);
            case LUGGAGE:
                return knowledgeBaseBuilder.luggageAnswer(settings);
            case LOCATIONS:
                return knowledgeBaseBuilder.locationsAnswer(settings);
            case SEATS:
                return statusFlowService.busStatusText(today);
            case GENERAL:
            default:
                return generalAnswer(settingsService.faqRows());
        }
    }

    private String generalAnswer(List<FaqEntry> rows) {
        if (rows.isEmpty()) {
            return "Type any question and I'll do my best to answer it.";
        }
        StringBuilder sb = new StringBuilder("Frequently asked:");
        for (FaqEntry row : rows) {
            sb.append("\n\nQ: ").append(row.getQuestion()).append("\nA: ").append(row.getAnswer());
        }
        return sb.toString();
    }
}
