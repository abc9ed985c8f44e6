package com.tradecodes.classifier.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Edit-distance helpers for the lexical retrieval channel.
 */
public final class FuzzyMatcher {

    private FuzzyMatcher() {
    }

    /**
     * Normalized similarity in [0, 1]: {@code (longer - distance) / longer}.
     */
    public static double similarity(String a, String b) {
        String left = a == null ? "" : a.toLowerCase();
        String right = b == null ? "" : b.toLowerCase();
        String longer = left.length() >= right.length() ? left : right;
        String shorter = longer == left ? right : left;
        if (longer.isEmpty()) {
            return 1.0;
        }
        return (longer.length() - levenshtein(longer, shorter)) / (double) longer.length();
    }

    /**
     * Terms from {@code candidates} at or above the threshold, best first, at most {@code limit}.
     */
    public static List<String> closeMatches(String term, List<String> candidates, double threshold, int limit) {
        List<ScoredTerm> scored = new ArrayList<>();
        for (String candidate : candidates) {
            double sim = similarity(term, candidate);
            if (sim >= threshold) {
                scored.add(new ScoredTerm(candidate, sim));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredTerm::similarity).reversed());
        return scored.stream().limit(Math.max(0, limit)).map(ScoredTerm::term).toList();
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private record ScoredTerm(String term, double similarity) {
    }
}
