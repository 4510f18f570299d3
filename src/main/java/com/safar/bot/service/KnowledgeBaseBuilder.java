package com.safar.bot.service;

import com.safar.bot.conversation.FaqCategory;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.KnowledgeBaseEntry;
import com.safar.bot.dto.KnowledgeBaseIndex;
import com.safar.bot.dto.LocationSettings;
import com.safar.bot.dto.LuggageSettings;
import com.safar.bot.dto.ReturnServiceSettings;
import com.safar.bot.dto.TravelDateSettings;
import com.safar.bot.entity.FaqEntry;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens business settings and FAQ rows into knowledge-base entries.
 * Pure function of its inputs; entry order is fixed and acts as the match tie-break:
 * fares overview, per-route fares, dates, return service, luggage, locations, routes, FAQ rows by id.
 */
@Component
public class KnowledgeBaseBuilder {

    private final QueryNormalizer normalizer;

    public KnowledgeBaseBuilder(QueryNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public KnowledgeBaseIndex build(BusinessSettings settings, List<FaqEntry> faqRows) {
        List<KnowledgeBaseEntry> entries = new ArrayList<>();

        entries.add(entry(faresAnswer(settings), FaqCategory.FARES,
                "fare", "fares", "price", "prices", "cost", "ticket", "charges", "much", "rate"));
        for (Map.Entry<String, Integer> fare : settings.getFares().getFares().entrySet()) {
            entries.add(entry(displayRoute(fare.getKey()) + " fare is Rs. " + fare.getValue() + " per seat.",
                    FaqCategory.FARES, fare.getKey(), "fare", "price", "cost", "ticket"));
        }
        entries.add(entry(datesAnswer(settings), FaqCategory.DATES,
                "date", "dates", "when", "schedule", "departure", "departures", "leaving", "leave", "day", "travel"));
        entries.add(entry(returnAnswer(settings), FaqCategory.RETURN,
                "return", "back", "returning", "coming"));
        entries.add(entry(luggageAnswer(settings), FaqCategory.LUGGAGE,
                "luggage", "allowance", "bags", "bag", "baggage", "suitcase", "carry", "weight", "bring"));
        entries.add(entry(locationsAnswer(settings), FaqCategory.LOCATIONS,
                "pickup", "location", "locations", "point", "points", "where", "board", "boarding", "stop"));
        entries.add(entry(routeAnswer(settings), FaqCategory.ROUTE,
                "route", "routes", "cities", "city", "destination", "destinations", "go", "going"));

        if (faqRows != null) {
            faqRows.stream()
                    .filter(FaqEntry::isActive)
                    .sorted(Comparator.comparing(FaqEntry::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                    .forEach(row -> entries.add(faqEntry(row)));
        }
        return new KnowledgeBaseIndex(entries);
    }

    public String faresAnswer(BusinessSettings settings) {
        Map<String, Integer> fares = settings.getFares().getFares();
        if (fares.isEmpty()) {
            return "Fares have not been announced yet.";
        }
        StringBuilder sb = new StringBuilder("Our one-way fares are:");
        fares.forEach((route, fare) -> sb.append("\n- ").append(displayRoute(route)).append(": Rs. ").append(fare));
        return sb.toString();
    }

    public String datesAnswer(BusinessSettings settings) {
        TravelDateSettings dates = settings.getDates();
        if (dates.getDates().isEmpty()) {
            return "Travel dates have not been announced yet.";
        }
        StringBuilder sb = new StringBuilder("Upcoming travel dates:");
        dates.getDates().forEach((route, list) -> sb.append("\n- ").append(displayRoute(route)).append(": ")
                .append(list.isEmpty() ? "TBD" : String.join(", ", list)));
        if (StringUtils.isNotBlank(dates.getDescription())) {
            sb.append("\n").append(dates.getDescription());
        }
        return sb.toString();
    }

    public String returnAnswer(BusinessSettings settings) {
        ReturnServiceSettings r = settings.getReturnService();
        if (StringUtils.isBlank(r.getDate())) {
            return "Return service details will be announced soon.";
        }
        String answer = "Return service is on " + r.getDate() + ".";
        if (StringUtils.isNotBlank(r.getDescription())) {
            answer += " " + r.getDescription();
        }
        return answer;
    }

    public String luggageAnswer(BusinessSettings settings) {
        LuggageSettings l = settings.getLuggage();
        StringBuilder sb = new StringBuilder("You can bring ").append(l.getMaxBags());
        if (StringUtils.isNotBlank(l.getBagSize())) {
            sb.append(' ').append(l.getBagSize());
        }
        sb.append(l.getMaxBags() == 1 ? " bag" : " bags");
        if (l.isHandCarry()) {
            sb.append(" plus 1 hand carry bag");
        }
        sb.append('.');
        if (StringUtils.isNotBlank(l.getNote())) {
            sb.append(' ').append(l.getNote());
        }
        return sb.toString();
    }

    public String locationsAnswer(BusinessSettings settings) {
        LocationSettings loc = settings.getLocations();
        if (loc.getPoints().isEmpty()) {
            return StringUtils.isNotBlank(loc.getNote()) ? loc.getNote() : "Pickup points will be announced soon.";
        }
        StringBuilder sb = new StringBuilder("Pickup points:");
        loc.getPoints().forEach((point, text) -> sb.append("\n- ").append(StringUtils.capitalize(point))
                .append(": ").append(text));
        if (StringUtils.isNotBlank(loc.getNote())) {
            sb.append("\n").append(loc.getNote());
        }
        return sb.toString();
    }

    public String routeAnswer(BusinessSettings settings) {
        List<String> routes = settings.routes();
        if (routes.isEmpty()) {
            return "No routes are open right now.";
        }
        List<String> names = new ArrayList<>();
        routes.forEach(r -> names.add(displayRoute(r)));
        return "We run buses from Lahore to " + String.join(" and ", names) + ".";
    }

    public static String displayRoute(String route) {
        return StringUtils.capitalize(route);
    }

    private KnowledgeBaseEntry entry(String answer, FaqCategory category, String... keywords) {
        return new KnowledgeBaseEntry(normalizer.keywords(keywords), answer, category);
    }

    private KnowledgeBaseEntry faqEntry(FaqEntry row) {
        Set<String> keywords = new LinkedHashSet<>();
        if (StringUtils.isNotBlank(row.getKeywords())) {
            for (String k : row.getKeywords().split(",")) {
                keywords.addAll(normalizer.tokens(k));
            }
        }
        if (keywords.isEmpty()) {
            keywords.addAll(normalizer.tokens(row.getQuestion()));
        }
        FaqCategory category = FaqCategory.fromName(row.getCategory()).orElse(FaqCategory.GENERAL);
        return new KnowledgeBaseEntry(keywords, row.getAnswer(), category);
    }
}
