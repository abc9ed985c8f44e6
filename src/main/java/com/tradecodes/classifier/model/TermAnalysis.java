package com.tradecodes.classifier.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Categorized view of a query: each recognized token carries one {@link TermCategory}.
 *
 * @param originalQuery             query as received
 * @param terms                     terms per category, in order of recognition
 * @param primaryQuery              variety, product and processing terms only
 * @param fullQueryWithoutPackaging everything except packaging and size tokens
 * @param confidence                fraction of tokens that were recognized
 */
public record TermAnalysis(String originalQuery,
                           Map<TermCategory, List<String>> terms,
                           String primaryQuery,
                           String fullQueryWithoutPackaging,
                           double confidence) {

    public TermAnalysis {
        Map<TermCategory, List<String>> copy = new EnumMap<>(TermCategory.class);
        for (TermCategory category : TermCategory.values()) {
            List<String> values = terms == null ? null : terms.get(category);
            copy.put(category, values == null ? List.of() : List.copyOf(values));
        }
        terms = Collections.unmodifiableMap(copy);
    }

    public List<String> termsOf(TermCategory category) {
        return terms.get(category);
    }

    public boolean hasMaterial() {
        return !termsOf(TermCategory.MATERIAL).isEmpty();
    }

    public boolean hasPackaging() {
        return !termsOf(TermCategory.PACKAGING).isEmpty();
    }

    public boolean hasProduct() {
        return !termsOf(TermCategory.PRODUCT).isEmpty();
    }
}
