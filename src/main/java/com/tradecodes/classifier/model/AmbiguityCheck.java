package com.tradecodes.classifier.model;

import java.util.List;

/**
 * Outcome of checking an ambiguous term found in the query.
 * <p>
 * When {@code ambiguous} is false the term was settled, either by an indicator
 * ({@code resolvedChapter} set) or by other chapter keywords in the query.
 */
public record AmbiguityCheck(String term,
                             boolean ambiguous,
                             String resolvedChapter,
                             String disambiguationQuestion,
                             List<ChapterOption> options) {

    public AmbiguityCheck {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static AmbiguityCheck resolved(String term, String chapter) {
        return new AmbiguityCheck(term, false, chapter, null, List.of());
    }

    public static AmbiguityCheck ambiguous(String term, String question, List<ChapterOption> options) {
        return new AmbiguityCheck(term, true, null, question, options);
    }
}
