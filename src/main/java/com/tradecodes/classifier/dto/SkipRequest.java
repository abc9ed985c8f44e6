package com.tradecodes.classifier.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Request to stop asking questions and classify with what is known")
public class SkipRequest {

    @Schema(description = "Conversation to finish", requiredMode = Schema.RequiredMode.REQUIRED)
    private String conversationId;
}
