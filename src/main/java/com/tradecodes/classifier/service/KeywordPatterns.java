package com.tradecodes.classifier.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Keyword matching shared by the rule-driven components. Multi-word phrases match as
 * substrings, single words on word boundaries.
 */
final class KeywordPatterns {

    private static final Map<String, Pattern> WORD_PATTERNS = new ConcurrentHashMap<>();
    private static final Map<String, Pattern> PLURAL_PATTERNS = new ConcurrentHashMap<>();

    private KeywordPatterns() {
    }

    static boolean isPhrase(String keyword) {
        return keyword.trim().contains(" ");
    }

    /**
     * Phrase keywords by substring, single words on word boundaries. Both sides are expected lower-case.
     */
    static boolean matches(String text, String keyword) {
        if (text == null || keyword == null || keyword.isBlank()) {
            return false;
        }
        if (isPhrase(keyword)) {
            return text.contains(keyword);
        }
        return WORD_PATTERNS.computeIfAbsent(keyword,
                k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b")).matcher(text).find();
    }

    /**
     * Like {@link #matches} but single words also accept a trailing plural "s" or "es".
     */
    static boolean matchesWithPlural(String text, String keyword) {
        if (text == null || keyword == null || keyword.isBlank()) {
            return false;
        }
        if (isPhrase(keyword)) {
            return text.contains(keyword);
        }
        return PLURAL_PATTERNS.computeIfAbsent(keyword,
                k -> Pattern.compile("\\b" + Pattern.quote(k) + "(?:s|es)?\\b")).matcher(text).find();
    }
}
