package com.tradecodes.classifier.model;

/**
 * A recorded answer. {@code matchedOption} is false when the answer matched none of the offered options.
 */
public record AnsweredQuestion(String questionId, String selectedCode, String selectedLabel, boolean matchedOption) {
}
