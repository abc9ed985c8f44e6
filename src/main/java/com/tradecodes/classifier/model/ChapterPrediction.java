package com.tradecodes.classifier.model;

import java.util.List;

public record ChapterPrediction(String chapter,
                                String name,
                                double confidence,
                                List<String> matchedKeywords,
                                String reason) {

    public ChapterPrediction {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }
}
