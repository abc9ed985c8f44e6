package com.tradecodes.classifier.model;

import java.util.List;

/**
 * Questions chosen for one round plus what is left for later rounds.
 */
public record OrchestrationResult(List<SmartQuestion> questions,
                                  List<SmartQuestion> nextRoundQuestions,
                                  boolean readyToClassify,
                                  String reason,
                                  int round) {

    public OrchestrationResult {
        questions = questions == null ? List.of() : List.copyOf(questions);
        nextRoundQuestions = nextRoundQuestions == null ? List.of() : List.copyOf(nextRoundQuestions);
    }
}
