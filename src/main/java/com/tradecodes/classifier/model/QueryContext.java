package com.tradecodes.classifier.model;

import java.util.List;

/**
 * Split of a query into its primary subject and the context it is used in,
 * e.g. "cases for phones" has subject "cases" and context "phones".
 */
public record QueryContext(String primarySubject, String context, List<String> primaryWords, List<String> contextWords) {

    public QueryContext {
        primaryWords = primaryWords == null ? List.of() : List.copyOf(primaryWords);
        contextWords = contextWords == null ? List.of() : List.copyOf(contextWords);
    }
}
