package com.tradecodes.classifier.model;

import java.util.List;

/**
 * How detailed a query is, and the decision thresholds adjusted for it.
 */
public record SpecificityAnalysis(double score,
                                  SpecificityLevel level,
                                  List<String> signals,
                                  double adjustedConfidenceThreshold,
                                  double adjustedGapThreshold) {

    public SpecificityAnalysis {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
