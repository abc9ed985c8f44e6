package com.tradecodes.classifier.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Product description to classify")
public class ClassifyRequest {

    @Schema(description = "Free-text product description", example = "steel nuts and bolts", requiredMode = Schema.RequiredMode.REQUIRED)
    private String query;

    @Schema(description = "Existing conversation to continue; omit to start a new one")
    private String conversationId;
}
