package com.safar.bot.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lowercases, strips punctuation and symbols, splits on whitespace and drops stop-words and
 * one-character tokens. Used for both queries and knowledge-base keywords.
 */
@Component
public class QueryNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "am", "was", "were", "be", "to", "of", "in", "on", "at",
            "for", "and", "or", "it", "me", "my", "i", "you", "your", "do", "does", "did", "can",
            "could", "what", "how", "there", "this", "that", "any", "please", "tell", "about", "with");

    public List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        String cleaned = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return out;
        }
        for (String token : WHITESPACE.split(cleaned)) {
            if (token.length() >= 2 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    public Set<String> tokenSet(String text) {
        return new LinkedHashSet<>(tokens(text));
    }

    /** Normalizes each keyword phrase and unions the resulting tokens, preserving order. */
    public Set<String> keywords(String... phrases) {
        Set<String> out = new LinkedHashSet<>();
        for (String phrase : phrases) {
            out.addAll(tokens(phrase));
        }
        return out;
    }
}
