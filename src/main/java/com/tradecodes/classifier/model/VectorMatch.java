package com.tradecodes.classifier.model;

import java.util.List;

/**
 * Row returned by the vector store, ordered by descending similarity.
 */
public record VectorMatch(String code, String description, List<String> keywords, double similarity) {

    public VectorMatch {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
