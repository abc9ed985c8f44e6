package com.tradecodes.classifier.model;

/**
 * Condition under which a pending question no longer needs to be asked.
 */
public record SkipCondition(Type type, String value, double threshold) {

    public enum Type {
        DESCRIPTION_CONTAINS,
        ANSWER_CONTAINS,
        CONFIDENCE_ABOVE,
        CANDIDATE_COUNT_BELOW
    }

    public static SkipCondition descriptionContains(String value) {
        return new SkipCondition(Type.DESCRIPTION_CONTAINS, value, 0);
    }

    public static SkipCondition answerContains(String value) {
        return new SkipCondition(Type.ANSWER_CONTAINS, value, 0);
    }

    public static SkipCondition confidenceAbove(double threshold) {
        return new SkipCondition(Type.CONFIDENCE_ABOVE, null, threshold);
    }

    public static SkipCondition candidateCountBelow(double threshold) {
        return new SkipCondition(Type.CANDIDATE_COUNT_BELOW, null, threshold);
    }
}
