package com.tradecodes.classifier.service;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Meaningful query terms: lower-cased, longer than two characters, not a stop word.
 */
final class QueryTerms {

    private QueryTerms() {
    }

    static List<String> meaningful(String query, Set<String> stopWords) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase().trim().split("\\s+"))
                .map(w -> w.replaceAll("[^a-z0-9-]", ""))
                .filter(w -> w.length() > 2 && !stopWords.contains(w))
                .distinct()
                .toList();
    }

    /**
     * Words of a catalog text field, same normalization as query terms but without stop word removal.
     */
    static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase().split("\\s+"))
                .map(w -> w.replaceAll("[^a-z0-9-]", ""))
                .filter(w -> w.length() > 2)
                .toList();
    }
}
