package com.tradecodes.classifier.model;

import java.util.List;

/**
 * A clarifying question. Hierarchy questions (chapter, heading, ambiguous term) carry no differential.
 */
public record SmartQuestion(String id,
                            String text,
                            Differential differential,
                            List<QuestionOption> options,
                            QuestionPriority priority,
                            QuestionCategory category,
                            int hierarchyLevel,
                            List<QuestionCategory> dependencies,
                            List<SkipCondition> skipConditions,
                            int impactScore,
                            boolean allowOther) {

    public SmartQuestion {
        options = options == null ? List.of() : List.copyOf(options);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        skipConditions = skipConditions == null ? List.of() : List.copyOf(skipConditions);
    }

    public static SmartQuestion hierarchy(String id, String text, List<QuestionOption> options) {
        return new SmartQuestion(id, text, null, options, QuestionPriority.CRITICAL, QuestionCategory.IDENTITY,
                QuestionCategory.IDENTITY.hierarchyLevel(), List.of(), List.of(), 100, true);
    }
}
