package com.tradecodes.classifier.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * Answer to a clarifying question. {@code selectedOptionCode} may be an option code,
 * an option label, {@code CODE::Label}, or free text.
 */
@Data
@Schema(description = "Answer to a clarifying question")
public class AnswerRequest {

    @Schema(description = "Conversation the question belongs to", requiredMode = Schema.RequiredMode.REQUIRED)
    private String conversationId;

    @Schema(description = "Identifier of the question being answered", example = "ambiguity_coffee",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String questionId;

    @Schema(description = "Selected option code or label", example = "09")
    private String selectedOptionCode;
}
