package com.tradecodes.classifier.model;

import java.util.List;
import java.util.Optional;

/**
 * Ranked chapter predictions for one query.
 *
 * @param predictions        ranked predictions, a single entry when an override is active
 * @param functionalOverride override that fired, or null
 * @param ambiguity          first genuinely ambiguous term, or null
 * @param closeCall          true when the two best predictions are within the ambiguity margin
 */
public record ChapterPredictionResult(List<ChapterPrediction> predictions,
                                      FunctionalOverride functionalOverride,
                                      AmbiguityCheck ambiguity,
                                      boolean closeCall) {

    public ChapterPredictionResult {
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
    }

    public static ChapterPredictionResult empty() {
        return new ChapterPredictionResult(List.of(), null, null, false);
    }

    public boolean hasOverride() {
        return functionalOverride != null;
    }

    public boolean requiresDisambiguation() {
        return functionalOverride == null && ambiguity != null && ambiguity.ambiguous();
    }

    public Optional<ChapterPrediction> top() {
        return predictions.isEmpty() ? Optional.empty() : Optional.of(predictions.get(0));
    }

    public List<String> chapters() {
        return predictions.stream().map(ChapterPrediction::chapter).toList();
    }
}
