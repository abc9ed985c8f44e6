package com.tradecodes.classifier.controller;

import com.tradecodes.classifier.dto.AnswerRequest;
import com.tradecodes.classifier.dto.ClassifyRequest;
import com.tradecodes.classifier.dto.SkipRequest;
import com.tradecodes.classifier.model.ClassificationResponse;
import com.tradecodes.classifier.model.ConversationSnapshot;
import com.tradecodes.classifier.service.ClassificationDecisionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/api/classify")
@Tag(name = "Classification", description = "Conversational tariff code classification")
public class ClassificationController {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationController.class);

    private final ClassificationDecisionEngine decisionEngine;

    public ClassificationController(ClassificationDecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    @Operation(
            summary = "Classify a product description",
            description = "Returns a tariff code, a clarifying question, or a request for more detail. " +
                    "Pass the returned conversationId with answers to continue the dialogue."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Classification step completed",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ClassificationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Query is missing", content = @Content),
            @ApiResponse(responseCode = "500", description = "Unexpected server error", content = @Content)
    })
    @PostMapping
    public ResponseEntity<?> classify(@RequestBody ClassifyRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuery())) {
            return ResponseEntity.badRequest().body("query must not be empty");
        }
        try {
            return ResponseEntity.ok(decisionEngine.classify(request.getQuery(), request.getConversationId()));
        } catch (Exception e) {
            logger.error("Classification failed for '{}': {}", request.getQuery(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    /**
     * Applies an answer to a pending question.
     */
    @Operation(
            summary = "Answer a clarifying question",
            description = "Narrows the candidate codes with the selected option and continues the classification."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Answer applied",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ClassificationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Conversation or question id missing", content = @Content),
            @ApiResponse(responseCode = "404", description = "Conversation not found or expired", content = @Content),
            @ApiResponse(responseCode = "500", description = "Unexpected server error", content = @Content)
    })
    @PostMapping("/answer")
    public ResponseEntity<?> answer(@RequestBody AnswerRequest request) {
        if (request == null || !StringUtils.hasText(request.getConversationId()) || !StringUtils.hasText(request.getQuestionId())) {
            return ResponseEntity.badRequest().body("conversationId and questionId are required");
        }
        if (!decisionEngine.isActive(request.getConversationId())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Conversation not found or expired: " + request.getConversationId());
        }
        try {
            return ResponseEntity.ok(decisionEngine.answerQuestion(
                    request.getConversationId(), request.getQuestionId(), request.getSelectedOptionCode()));
        } catch (Exception e) {
            logger.error("Failed to apply answer to {} in {}: {}", request.getQuestionId(), request.getConversationId(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    @Operation(
            summary = "Skip remaining questions",
            description = "Returns the best classification the answers so far support, at reduced confidence."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Best available classification",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ClassificationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Conversation id missing", content = @Content),
            @ApiResponse(responseCode = "404", description = "Conversation not found or expired", content = @Content),
            @ApiResponse(responseCode = "500", description = "Unexpected server error", content = @Content)
    })
    @PostMapping("/skip")
    public ResponseEntity<?> skip(@RequestBody SkipRequest request) {
        if (request == null || !StringUtils.hasText(request.getConversationId())) {
            return ResponseEntity.badRequest().body("conversationId is required");
        }
        if (!decisionEngine.isActive(request.getConversationId())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Conversation not found or expired: " + request.getConversationId());
        }
        try {
            return ResponseEntity.ok(decisionEngine.skip(request.getConversationId()));
        } catch (Exception e) {
            logger.error("Failed to skip questions in {}: {}", request.getConversationId(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    @Operation(summary = "Get the state of an open conversation")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Conversation found",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ConversationSnapshot.class))),
            @ApiResponse(responseCode = "404", description = "Conversation not found or expired", content = @Content)
    })
    @GetMapping("/{conversationId}")
    public ResponseEntity<?> conversation(
            @Parameter(description = "Conversation identifier", required = true)
            @PathVariable String conversationId) {
        Optional<ConversationSnapshot> snapshot = decisionEngine.describe(conversationId);
        if (snapshot.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Conversation not found or expired: " + conversationId);
        }
        return ResponseEntity.ok(snapshot.get());
    }

    @Operation(summary = "Discard a conversation")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Conversation discarded")
    })
    @DeleteMapping("/{conversationId}")
    public ResponseEntity<Void> reset(
            @Parameter(description = "Conversation identifier", required = true)
            @PathVariable String conversationId) {
        decisionEngine.reset(conversationId);
        return ResponseEntity.noContent().build();
    }
}
