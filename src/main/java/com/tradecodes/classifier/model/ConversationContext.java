package com.tradecodes.classifier.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulated state of one classification dialogue.
 * <p>
 * Instances are only read and written while holding the per-conversation lock of the store.
 */
@Getter
public class ConversationContext {

    private final String conversationId;
    private final String originalQuery;
    private final Instant createdAt;
    private final List<AnsweredQuestion> answeredQuestions = new ArrayList<>();
    private final List<String> accumulatedKeywords = new ArrayList<>();
    private final Set<String> codeFilters = new LinkedHashSet<>();
    private final Map<String, SmartQuestion> pendingQuestions = new LinkedHashMap<>();
    private List<Candidate> narrowedCandidates = List.of();
    private List<SmartQuestion> deferredQuestions = List.of();
    private int round = 1;

    public ConversationContext(String conversationId, String originalQuery) {
        this.conversationId = conversationId;
        this.originalQuery = originalQuery == null ? "" : originalQuery.trim();
        this.createdAt = Instant.now();
    }

    public List<AnsweredQuestion> getAnsweredQuestions() {
        return Collections.unmodifiableList(answeredQuestions);
    }

    public List<String> getAccumulatedKeywords() {
        return Collections.unmodifiableList(accumulatedKeywords);
    }

    public Set<String> getCodeFilters() {
        return Collections.unmodifiableSet(codeFilters);
    }

    public Map<String, SmartQuestion> getPendingQuestions() {
        return Collections.unmodifiableMap(pendingQuestions);
    }

    public void recordAnswer(AnsweredQuestion answer) {
        answeredQuestions.add(answer);
        pendingQuestions.remove(answer.questionId());
        if (answer.selectedLabel() != null && !answer.selectedLabel().isBlank()
                && !accumulatedKeywords.contains(answer.selectedLabel())) {
            accumulatedKeywords.add(answer.selectedLabel());
        }
    }

    public boolean isAnswered(String questionId) {
        return answeredQuestions.stream().anyMatch(a -> a.questionId().equals(questionId));
    }

    public Optional<SmartQuestion> pendingQuestion(String questionId) {
        return Optional.ofNullable(pendingQuestions.get(questionId));
    }

    public void replacePendingQuestions(List<SmartQuestion> questions) {
        pendingQuestions.clear();
        questions.forEach(q -> pendingQuestions.put(q.id(), q));
    }

    /**
     * Restricts later retrieval to codes starting with one of the given prefixes.
     */
    public void narrowTo(Set<String> prefixes) {
        if (prefixes == null || prefixes.isEmpty()) {
            return;
        }
        codeFilters.clear();
        codeFilters.addAll(prefixes);
    }

    public void setNarrowedCandidates(List<Candidate> candidates) {
        this.narrowedCandidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public void setDeferredQuestions(List<SmartQuestion> questions) {
        this.deferredQuestions = questions == null ? List.of() : List.copyOf(questions);
    }

    public void nextRound() {
        round++;
    }

    public boolean matchesFilters(String code) {
        if (codeFilters.isEmpty()) {
            return true;
        }
        String digits = code == null ? "" : code.replaceAll("[^0-9]", "");
        return codeFilters.stream().anyMatch(prefix -> digits.startsWith(prefix.replaceAll("[^0-9]", "")));
    }

    /**
     * Original query followed by every answer label, the text retrieval runs on.
     */
    public String searchQuery() {
        if (accumulatedKeywords.isEmpty()) {
            return originalQuery;
        }
        return (originalQuery + " " + String.join(" ", accumulatedKeywords)).trim();
    }

    public String answersText() {
        return String.join(" ", accumulatedKeywords).toLowerCase();
    }
}
