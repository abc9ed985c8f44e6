package com.tradecodes.classifier.model;

import java.util.List;

/**
 * Terminal classification with a 0..100 confidence.
 */
public record ClassificationResult(String code,
                                   String description,
                                   int confidence,
                                   String reasoning,
                                   List<Alternative> alternatives) {

    public ClassificationResult {
        confidence = Math.max(0, Math.min(100, confidence));
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}
