package com.tradecodes.classifier.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;

import java.util.List;

/**
 * Result of a classify or answer call: a classification, a question, or a request for more detail.
 */
@Getter
@Schema(description = "Classification outcome: a result, a clarifying question or a need-more-info message")
public class ClassificationResponse {

    public enum Type {
        CLASSIFICATION,
        QUESTION,
        NEED_MORE_INFO
    }

    @Schema(description = "Outcome kind", example = "QUESTION")
    private final Type type;

    @Schema(description = "Conversation identifier to use for follow-up answers")
    private final String conversationId;

    private final ClassificationResult result;

    private final SmartQuestion question;

    @Schema(description = "Other questions selected for the same round")
    private final List<SmartQuestion> followUpQuestions;

    @Schema(description = "Explanation when more information is needed")
    private final String message;

    private ClassificationResponse(Type type,
                                   String conversationId,
                                   ClassificationResult result,
                                   SmartQuestion question,
                                   List<SmartQuestion> followUpQuestions,
                                   String message) {
        this.type = type;
        this.conversationId = conversationId;
        this.result = result;
        this.question = question;
        this.followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
        this.message = message;
    }

    public static ClassificationResponse classification(String conversationId, ClassificationResult result) {
        return new ClassificationResponse(Type.CLASSIFICATION, conversationId, result, null, List.of(), null);
    }

    public static ClassificationResponse question(String conversationId, SmartQuestion question, List<SmartQuestion> followUps) {
        return new ClassificationResponse(Type.QUESTION, conversationId, null, question, followUps, null);
    }

    public static ClassificationResponse needMoreInfo(String conversationId, String message) {
        return new ClassificationResponse(Type.NEED_MORE_INFO, conversationId, null, null, List.of(), message);
    }

    public boolean canClassify() {
        return type == Type.CLASSIFICATION && result != null;
    }
}
