package com.tradecodes.classifier.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A tariff code proposed by one of the retrieval channels.
 * <p>
 * {@code score} is the ranking score adjusted by the scorer and reranker, {@code similarity}
 * the calibrated 0..1 closeness used by the decision thresholds. Identity is the code.
 */
public record Candidate(String code,
                        String description,
                        double score,
                        double similarity,
                        MatchType matchType,
                        CandidateSource source,
                        List<String> keywords,
                        List<String> commonProducts,
                        List<String> synonyms) {

    public Candidate {
        description = description == null ? "" : description;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        commonProducts = commonProducts == null ? List.of() : List.copyOf(commonProducts);
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }

    public Candidate withScore(double newScore) {
        return new Candidate(code, description, newScore, similarity, matchType, source, keywords, commonProducts, synonyms);
    }

    public Candidate withSimilarity(double newSimilarity) {
        return new Candidate(code, description, score, newSimilarity, matchType, source, keywords, commonProducts, synonyms);
    }

    public Candidate withScoreAndSimilarity(double newScore, double newSimilarity) {
        return new Candidate(code, description, newScore, newSimilarity, matchType, source, keywords, commonProducts, synonyms);
    }

    public String digits() {
        return code == null ? "" : code.replaceAll("[^0-9]", "");
    }

    public String chapter() {
        String digits = digits();
        return digits.length() >= 2 ? digits.substring(0, 2) : digits;
    }

    public String heading() {
        String digits = digits();
        return digits.length() >= 4 ? digits.substring(0, 4) : digits;
    }

    /**
     * Tariff lines (8 digits or more) are the leaves of the code hierarchy.
     */
    public boolean isLeaf() {
        return digits().length() >= 8;
    }

    /**
     * Lower-cased text of description, keywords, common products and synonyms.
     */
    public String searchableText() {
        List<String> parts = new ArrayList<>();
        parts.add(description);
        parts.addAll(keywords);
        parts.addAll(commonProducts);
        parts.addAll(synonyms);
        return String.join(" ", parts).toLowerCase();
    }
}
