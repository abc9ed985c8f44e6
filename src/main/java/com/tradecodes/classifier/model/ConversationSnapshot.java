package com.tradecodes.classifier.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of an open conversation.
 */
@Schema(description = "State of an open classification conversation")
public record ConversationSnapshot(String conversationId,
                                   String originalQuery,
                                   String searchQuery,
                                   int round,
                                   Instant createdAt,
                                   List<AnsweredQuestion> answeredQuestions,
                                   List<String> pendingQuestionIds,
                                   List<String> codeFilters,
                                   List<String> candidateCodes) {

    public static ConversationSnapshot of(ConversationContext context) {
        return new ConversationSnapshot(
                context.getConversationId(),
                context.getOriginalQuery(),
                context.searchQuery(),
                context.getRound(),
                context.getCreatedAt(),
                List.copyOf(context.getAnsweredQuestions()),
                List.copyOf(context.getPendingQuestions().keySet()),
                List.copyOf(context.getCodeFilters()),
                context.getNarrowedCandidates().stream()
                        .filter(candidate -> context.matchesFilters(candidate.code()))
                        .map(Candidate::code)
                        .toList());
    }
}
