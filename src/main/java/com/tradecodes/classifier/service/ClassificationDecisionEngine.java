package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Alternative;
import com.tradecodes.classifier.model.AmbiguityCheck;
import com.tradecodes.classifier.model.AnsweredQuestion;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CandidateAnalysis;
import com.tradecodes.classifier.model.ChapterPrediction;
import com.tradecodes.classifier.model.ChapterPredictionResult;
import com.tradecodes.classifier.model.ClassificationResponse;
import com.tradecodes.classifier.model.ClassificationResult;
import com.tradecodes.classifier.model.CompletionVerdict;
import com.tradecodes.classifier.model.ConfidenceLevel;
import com.tradecodes.classifier.model.ConversationContext;
import com.tradecodes.classifier.model.ConversationSnapshot;
import com.tradecodes.classifier.model.Differential;
import com.tradecodes.classifier.model.FunctionalOverride;
import com.tradecodes.classifier.model.OrchestrationResult;
import com.tradecodes.classifier.model.QuestionOption;
import com.tradecodes.classifier.model.SmartQuestion;
import com.tradecodes.classifier.model.SpecificityAnalysis;
import com.tradecodes.classifier.model.SpecificityLevel;
import com.tradecodes.classifier.model.TermAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Drives one classification dialogue: retrieval, confidence analysis, and the choice between
 * a direct result, a clarifying question, completion-service verification, or a request for more detail.
 * <p>
 * Every path ends in a {@link ClassificationResponse}; collaborator failures degrade, they never escape.
 */
@Service
public class ClassificationDecisionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationDecisionEngine.class);

    private static final String OPTION_SEPARATOR = "::";
    private static final Pattern LEADING_CODE = Pattern.compile("^[\\d.]+\\s*[-:]\\s*");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[-:\\s]+");
    private static final Pattern TRAILING_QUALIFIER =
            Pattern.compile(",?\\s*(whether or not|including|excluding).*$", Pattern.CASE_INSENSITIVE);
    private static final int MAX_LABEL_LENGTH = 50;
    private static final int MIN_RETRIEVAL_QUERY_LENGTH = 3;

    private final TermAnalyzer termAnalyzer;
    private final InputSpecificityAnalyzer specificityAnalyzer;
    private final ChapterPredictor chapterPredictor;
    private final CandidateGenerator candidateGenerator;
    private final CandidateScorer candidateScorer;
    private final Reranker reranker;
    private final DifferentialAnalyzer differentialAnalyzer;
    private final QuestionOrchestrator questionOrchestrator;
    private final CompletionService completionService;
    private final ConversationContextStore contextStore;
    private final ClassifierProperties.Decision decision;
    private final double overrideConfidence;

    public ClassificationDecisionEngine(TermAnalyzer termAnalyzer,
                                        InputSpecificityAnalyzer specificityAnalyzer,
                                        ChapterPredictor chapterPredictor,
                                        CandidateGenerator candidateGenerator,
                                        CandidateScorer candidateScorer,
                                        Reranker reranker,
                                        DifferentialAnalyzer differentialAnalyzer,
                                        QuestionOrchestrator questionOrchestrator,
                                        CompletionService completionService,
                                        ConversationContextStore contextStore,
                                        ClassifierProperties properties) {
        this.termAnalyzer = termAnalyzer;
        this.specificityAnalyzer = specificityAnalyzer;
        this.chapterPredictor = chapterPredictor;
        this.candidateGenerator = candidateGenerator;
        this.candidateScorer = candidateScorer;
        this.reranker = reranker;
        this.differentialAnalyzer = differentialAnalyzer;
        this.questionOrchestrator = questionOrchestrator;
        this.completionService = completionService;
        this.contextStore = contextStore;
        this.decision = properties.getDecision();
        this.overrideConfidence = properties.getChapter().getOverrideConfidence();
    }

    /**
     * Classifies a product description, continuing the conversation when an id is supplied.
     * <p>
     * A description that differs from the one the conversation was opened with starts the
     * conversation over under the same id; earlier answers belong to the old description.
     */
    public ClassificationResponse classify(String query, String conversationId) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.length() < decision.getMinQueryLength()) {
            return ClassificationResponse.needMoreInfo(conversationId,
                    "Please describe the product in a few more words.");
        }
        String id = conversationId == null || conversationId.isBlank() ? contextStore.newConversationId() : conversationId;
        return contextStore.withLock(id, () -> {
            Optional<ConversationContext> existing = contextStore.find(id);
            ConversationContext context;
            if (existing.isPresent() && existing.get().getOriginalQuery().equalsIgnoreCase(trimmed)) {
                context = existing.get();
            } else {
                if (existing.isPresent()) {
                    logger.info("New description for conversation {}; starting over", id);
                }
                context = contextStore.start(id, trimmed);
            }
            return runClassification(context);
        });
    }

    /**
     * Applies an answer to a pending question and continues the dialogue.
     *
     * @param selectedOptionCode option code, option label, or {@code CODE::Label}; anything else is kept as free text
     */
    public ClassificationResponse answerQuestion(String conversationId, String questionId, String selectedOptionCode) {
        return contextStore.withLock(conversationId, () -> {
            Optional<ConversationContext> found = contextStore.find(conversationId);
            if (found.isEmpty()) {
                logger.warn("Answer received for unknown or expired conversation {}", conversationId);
                return expired(conversationId);
            }
            return applyAnswer(found.get(), questionId, selectedOptionCode);
        });
    }

    /**
     * Stops asking and returns the best classification the conversation's current shortlist supports.
     */
    public ClassificationResponse skip(String conversationId) {
        return contextStore.withLock(conversationId, () -> {
            Optional<ConversationContext> found = contextStore.find(conversationId);
            if (found.isEmpty()) {
                logger.warn("Skip requested for unknown or expired conversation {}", conversationId);
                return expired(conversationId);
            }
            ConversationContext context = found.get();
            List<Candidate> remaining = context.getNarrowedCandidates().stream()
                    .filter(candidate -> context.matchesFilters(candidate.code()))
                    .toList();
            if (remaining.isEmpty()) {
                remaining = context.getNarrowedCandidates();
            }
            if (remaining.isEmpty()) {
                contextStore.remove(conversationId);
                return ClassificationResponse.needMoreInfo(conversationId,
                        "Nothing has been matched yet. Please describe the product in more detail.");
            }
            logger.info("Skipping remaining questions for conversation {} in round {}", conversationId, context.getRound());
            return fallback(context, context.searchQuery(), remaining);
        });
    }

    /**
     * Snapshot of an open conversation, read under its lock.
     */
    public Optional<ConversationSnapshot> describe(String conversationId) {
        return contextStore.withLock(conversationId, () -> contextStore.find(conversationId).map(ConversationSnapshot::of));
    }

    public boolean isActive(String conversationId) {
        return contextStore.find(conversationId).isPresent();
    }

    public void reset(String conversationId) {
        contextStore.remove(conversationId);
        logger.info("Conversation {} reset", conversationId);
    }

    private ClassificationResponse runClassification(ConversationContext context) {
        String conversationId = context.getConversationId();
        String searchQuery = context.searchQuery();
        TermAnalysis analysis = termAnalyzer.analyze(searchQuery);
        SpecificityAnalysis specificity = specificityAnalyzer.analyze(searchQuery);
        String retrievalQuery = analysis.fullQueryWithoutPackaging() != null
                && analysis.fullQueryWithoutPackaging().trim().length() >= MIN_RETRIEVAL_QUERY_LENGTH
                ? analysis.fullQueryWithoutPackaging().trim()
                : searchQuery;
        logger.info("Classifying '{}' (conversation {}, round {}, specificity {})",
                retrievalQuery, conversationId, context.getRound(), specificity.level());

        ChapterPredictionResult prediction = scopeToSelectedChapter(context, chapterPredictor.predictChapters(retrievalQuery));
        if (prediction.requiresDisambiguation() && context.getCodeFilters().isEmpty()) {
            AmbiguityCheck ambiguity = prediction.ambiguity();
            String questionId = "ambiguity_" + ambiguity.term();
            if (!context.isAnswered(questionId)) {
                SmartQuestion question = SmartQuestion.hierarchy(questionId, ambiguity.disambiguationQuestion(),
                        ambiguity.options().stream()
                                .map(option -> new QuestionOption(option.chapter(), option.label(), null, List.of()))
                                .toList());
                context.replacePendingQuestions(List.of(question));
                logger.info("Term '{}' is ambiguous; asking before searching", ambiguity.term());
                return ClassificationResponse.question(conversationId, question, List.of());
            }
        }

        List<Candidate> generated = candidateGenerator.generate(retrievalQuery, prediction);
        List<Candidate> scored = candidateScorer.score(retrievalQuery, generated, prediction);
        List<Candidate> ranked = reranker.rerank(retrievalQuery, analysis, scored).stream()
                .filter(candidate -> context.matchesFilters(candidate.code()))
                .toList();
        if (ranked.isEmpty()) {
            contextStore.remove(conversationId);
            return ClassificationResponse.needMoreInfo(conversationId,
                    "No matching tariff codes were found for \"" + searchQuery + "\". Please add detail such as material or use.");
        }

        List<Candidate> leaves = ranked.stream().filter(Candidate::isLeaf).toList();
        List<Candidate> shortlist = leaves.isEmpty() ? ranked : leaves;
        context.setNarrowedCandidates(shortlist);

        CandidateAnalysis candidateAnalysis = analyzeCandidates(shortlist, specificity);
        Candidate top = shortlist.get(0);
        logger.info("Top {} sim={} gap={} level={} chapters={} dominant={} ({})",
                top.code(), round3(candidateAnalysis.topSimilarity()), round3(candidateAnalysis.gap()),
                candidateAnalysis.level(), candidateAnalysis.chapterCount(),
                candidateAnalysis.dominantChapter(), round3(candidateAnalysis.dominantShare()));

        if (candidateAnalysis.level() == ConfidenceLevel.HIGH) {
            return complete(context, buildResult(searchQuery, top, toPercent(top.similarity()), shortlist, null));
        }

        if (specificity.level() == SpecificityLevel.HIGH
                && candidateAnalysis.topSimilarity() >= decision.getHighSpecificitySimilarity()
                && (candidateAnalysis.chapterCount() == 1 || candidateAnalysis.dominantShare() >= decision.getDominantChapterShare())) {
            logger.info("Specific input with dominant chapter {}; classifying directly", candidateAnalysis.dominantChapter());
            return complete(context, buildResult(searchQuery, top, toPercent(top.similarity()), shortlist, null));
        }

        if (candidateAnalysis.level() == ConfidenceLevel.MEDIUM) {
            Optional<ClassificationResult> verified = verify(searchQuery, shortlist, 1.0);
            if (verified.isPresent()) {
                return complete(context, verified.get());
            }
        }

        List<SmartQuestion> questions = buildQuestions(context, searchQuery, shortlist, candidateAnalysis);
        if (!questions.isEmpty()) {
            context.replacePendingQuestions(questions);
            SmartQuestion first = questions.get(0);
            logger.info("Asking '{}' with {} follow-ups", first.id(), questions.size() - 1);
            return ClassificationResponse.question(conversationId, first, questions.subList(1, questions.size()));
        }

        return fallback(context, searchQuery, shortlist);
    }

    private ClassificationResponse applyAnswer(ConversationContext context, String questionId, String selectedOptionCode) {
        String answer = selectedOptionCode == null ? "" : selectedOptionCode.trim();
        Optional<SmartQuestion> question = context.pendingQuestion(questionId)
                .or(() -> context.getDeferredQuestions().stream().filter(q -> q.id().equals(questionId)).findFirst());
        Optional<QuestionOption> option = question.flatMap(q -> matchOption(q, answer));

        if (option.isEmpty()) {
            String freeText = labelPart(answer);
            logger.info("Answer '{}' to {} matched no option; keeping it as free text", freeText, questionId);
            context.recordAnswer(new AnsweredQuestion(questionId, answer, freeText, false));
            context.nextRound();
            return runClassification(context);
        }

        QuestionOption selected = option.get();
        context.recordAnswer(new AnsweredQuestion(questionId, selected.code(), selected.label(), true));
        Set<String> prefixes = narrowingPrefixes(selected);
        context.narrowTo(prefixes);
        logger.info("Answer '{}' to {} narrows to {}", selected.label(), questionId, prefixes);

        List<Candidate> remaining = context.getNarrowedCandidates().stream()
                .filter(candidate -> context.matchesFilters(candidate.code()))
                .toList();
        if (selected.codesIncluded().size() == 1 || remaining.size() == 1) {
            String code = selected.codesIncluded().size() == 1 ? selected.codesIncluded().get(0) : remaining.get(0).code();
            Optional<Candidate> match = context.getNarrowedCandidates().stream()
                    .filter(candidate -> candidate.code().equals(code))
                    .findFirst();
            if (match.isPresent()) {
                return complete(context, buildResult(context.searchQuery(), match.get(), decision.getNarrowedConfidence(),
                        context.getNarrowedCandidates(), "Narrowed to a single code by your answers"));
            }
        }

        context.nextRound();
        return runClassification(context);
    }

    /**
     * When answers have settled on one chapter, retrieval is scoped to it as if a functional override had fired.
     */
    private ChapterPredictionResult scopeToSelectedChapter(ConversationContext context, ChapterPredictionResult prediction) {
        Set<String> chapters = context.getCodeFilters().stream()
                .map(prefix -> prefix.replaceAll("[^0-9]", ""))
                .filter(digits -> digits.length() >= 2)
                .map(digits -> digits.substring(0, 2))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (chapters.size() != 1 || prediction.hasOverride()) {
            return prediction;
        }
        String chapter = chapters.iterator().next();
        String reason = "Chapter selected during the conversation";
        ChapterPrediction selected = new ChapterPrediction(chapter, chapterPredictor.chapterName(chapter),
                overrideConfidence, List.of(), reason);
        return new ChapterPredictionResult(List.of(selected), new FunctionalOverride(chapter, null, reason), null, false);
    }

    CandidateAnalysis analyzeCandidates(List<Candidate> candidates, SpecificityAnalysis specificity) {
        double topSimilarity = candidates.get(0).similarity();
        double gap = candidates.size() == 1
                ? decision.getSingleCandidateGap()
                : Math.max(0, topSimilarity - candidates.get(1).similarity());

        ConfidenceLevel level = ConfidenceLevel.LOW;
        if (topSimilarity >= specificity.adjustedConfidenceThreshold() && gap >= specificity.adjustedGapThreshold()) {
            level = ConfidenceLevel.HIGH;
        } else if (topSimilarity >= decision.getMediumSimilarityThreshold() && gap >= decision.getMediumGapThreshold()) {
            level = ConfidenceLevel.MEDIUM;
        }

        List<Candidate> topN = candidates.stream().limit(decision.getDominantTopN()).toList();
        Map<String, Long> byChapter = topN.stream()
                .collect(Collectors.groupingBy(Candidate::chapter, LinkedHashMap::new, Collectors.counting()));
        Map.Entry<String, Long> dominant = byChapter.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElse(Map.entry("", 0L));
        double share = topN.isEmpty() ? 0 : (double) dominant.getValue() / topN.size();
        return new CandidateAnalysis(topSimilarity, gap, level, byChapter.size(), dominant.getKey(), share);
    }

    private List<SmartQuestion> buildQuestions(ConversationContext context,
                                               String searchQuery,
                                               List<Candidate> candidates,
                                               CandidateAnalysis candidateAnalysis) {
        List<SmartQuestion> questions = new ArrayList<>();
        List<Candidate> pool = candidates.stream().limit(decision.getHierarchyQuestionPool()).toList();

        Optional<SmartQuestion> hierarchy = hierarchyQuestion(context, pool, "chapter_", Candidate::chapter,
                "Which category best describes your product?");
        if (hierarchy.isEmpty()) {
            hierarchy = hierarchyQuestion(context, pool, "heading_", Candidate::heading,
                    "Which type of product is this?");
        }
        hierarchy.ifPresent(questions::add);

        List<Differential> differentials = differentialAnalyzer.analyze(pool, searchQuery);
        Map<String, String> previousAnswers = new LinkedHashMap<>();
        context.getAnsweredQuestions().forEach(answer -> previousAnswers.put(answer.questionId(), answer.selectedLabel()));
        OrchestrationResult orchestration = questionOrchestrator.orchestrate(differentials, searchQuery, previousAnswers,
                context.getRound(), candidates.size(), toPercent(candidateAnalysis.topSimilarity()));
        context.setDeferredQuestions(orchestration.nextRoundQuestions());
        if (orchestration.readyToClassify()) {
            logger.info("Ready to classify in round {}: {}", context.getRound(), orchestration.reason());
            return questions;
        }
        orchestration.questions().stream()
                .filter(question -> !context.isAnswered(question.id()))
                .forEach(questions::add);
        return questions;
    }

    /**
     * Groups the pool by chapter or heading and asks which group applies, when more than one is present.
     */
    private Optional<SmartQuestion> hierarchyQuestion(ConversationContext context,
                                                      List<Candidate> pool,
                                                      String idPrefix,
                                                      Function<Candidate, String> groupKey,
                                                      String text) {
        boolean alreadyAsked = context.getAnsweredQuestions().stream()
                .anyMatch(answer -> answer.questionId().startsWith(idPrefix));
        if (alreadyAsked) {
            return Optional.empty();
        }
        Map<String, List<Candidate>> groups = pool.stream()
                .collect(Collectors.groupingBy(groupKey, LinkedHashMap::new, Collectors.toList()));
        if (groups.size() < 2) {
            return Optional.empty();
        }
        List<QuestionOption> options = groups.entrySet().stream()
                .sorted(Comparator.comparingDouble((Map.Entry<String, List<Candidate>> e) -> e.getValue().get(0).similarity())
                        .reversed())
                .limit(decision.getMaxQuestionOptions())
                .map(e -> {
                    Candidate first = e.getValue().get(0);
                    List<String> codes = e.getValue().stream().map(Candidate::code).toList();
                    return new QuestionOption(e.getKey(), createFriendlyLabel(first.description()), first.description(), codes);
                })
                .toList();
        return Optional.of(SmartQuestion.hierarchy(idPrefix + context.getRound(), text, options));
    }

    private ClassificationResponse fallback(ConversationContext context, String searchQuery, List<Candidate> candidates) {
        Optional<ClassificationResult> verified = verify(searchQuery, candidates, decision.getFallbackConfidenceFactor());
        if (verified.isPresent()) {
            return complete(context, verified.get());
        }
        Candidate top = candidates.get(0);
        if (top.similarity() >= decision.getMinSimilarity()) {
            int confidence = toPercent(top.similarity() * decision.getFallbackConfidenceFactor());
            return complete(context, buildResult(searchQuery, top, confidence, candidates,
                    "Best match at reduced confidence; verification was unavailable"));
        }
        contextStore.remove(context.getConversationId());
        return ClassificationResponse.needMoreInfo(context.getConversationId(),
                "The description matches several unrelated codes. Please add detail such as material, form or use.");
    }

    /**
     * Asks the completion service to pick among the shortlist. Only verdicts naming a shortlisted code are used.
     */
    private Optional<ClassificationResult> verify(String query, List<Candidate> candidates, double confidenceFactor) {
        List<Candidate> shortlist = candidates.stream().limit(decision.getVerificationCandidates()).toList();
        CompletionVerdict verdict;
        try {
            verdict = completionService.verify(query, shortlist);
        } catch (VerificationFailureException e) {
            logger.warn("Verification failed for '{}': {}", query, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.error("Unexpected verification error for '{}': {}", query, e.getMessage(), e);
            return Optional.empty();
        }
        if (verdict == null || verdict.confidence() < decision.getVerificationAcceptConfidence()) {
            logger.info("Verification confidence too low for '{}': {}", query, verdict == null ? null : verdict.confidence());
            return Optional.empty();
        }
        String verdictDigits = verdict.code().replaceAll("[^0-9]", "");
        Optional<Candidate> match = candidates.stream()
                .filter(candidate -> candidate.code().equals(verdict.code()) || candidate.digits().equals(verdictDigits))
                .findFirst();
        if (match.isEmpty()) {
            logger.warn("Verification suggested {} which is not among the candidates", verdict.code());
            return Optional.empty();
        }
        int confidence = toPercent(verdict.confidence() * confidenceFactor);
        return Optional.of(buildResult(query, match.get(), confidence, candidates, verdict.reasoning()));
    }

    private static ClassificationResponse expired(String conversationId) {
        return ClassificationResponse.needMoreInfo(conversationId,
                "This conversation has expired. Please start a new classification.");
    }

    private ClassificationResponse complete(ConversationContext context, ClassificationResult result) {
        contextStore.remove(context.getConversationId());
        logger.info("Classified conversation {} as {} ({}%)", context.getConversationId(), result.code(), result.confidence());
        return ClassificationResponse.classification(context.getConversationId(), result);
    }

    private ClassificationResult buildResult(String query,
                                             Candidate chosen,
                                             int confidence,
                                             List<Candidate> candidates,
                                             String extraReasoning) {
        List<Alternative> alternatives = candidates.stream()
                .filter(candidate -> !candidate.code().equals(chosen.code()))
                .filter(candidate -> !candidate.description().trim().toLowerCase().startsWith("other"))
                .limit(decision.getMaxAlternatives())
                .map(candidate -> new Alternative(candidate.code(), candidate.description(), toPercent(candidate.similarity())))
                .toList();
        String reasoning = "\"" + query + "\" → " + chosen.description();
        if (extraReasoning != null && !extraReasoning.isBlank()) {
            reasoning = reasoning + ". " + extraReasoning;
        }
        return new ClassificationResult(chosen.code(), chosen.description(), confidence, reasoning, alternatives);
    }

    private Optional<QuestionOption> matchOption(SmartQuestion question, String answer) {
        String codePart = answer;
        String labelPart = answer;
        int separator = answer.indexOf(OPTION_SEPARATOR);
        if (separator >= 0) {
            codePart = answer.substring(0, separator).trim();
            labelPart = answer.substring(separator + OPTION_SEPARATOR.length()).trim();
        }
        for (QuestionOption option : question.options()) {
            if (option.code() != null && option.code().equalsIgnoreCase(codePart)) {
                return Optional.of(option);
            }
        }
        for (QuestionOption option : question.options()) {
            if (option.label() != null && (option.label().equalsIgnoreCase(labelPart) || option.label().equalsIgnoreCase(answer))) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }

    private static String labelPart(String answer) {
        int separator = answer.indexOf(OPTION_SEPARATOR);
        return separator >= 0 ? answer.substring(separator + OPTION_SEPARATOR.length()).trim() : answer;
    }

    /**
     * Codes the option keeps, or the option code itself when it is a code prefix such as a chapter or heading.
     */
    private static Set<String> narrowingPrefixes(QuestionOption option) {
        Set<String> prefixes = new LinkedHashSet<>(option.codesIncluded());
        if (prefixes.isEmpty() && option.code() != null && option.code().matches("[\\d.]+")) {
            prefixes.add(option.code());
        }
        return prefixes;
    }

    /**
     * Short option label derived from a tariff description.
     */
    public static String createFriendlyLabel(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        String label = LEADING_CODE.matcher(description.trim()).replaceFirst("");
        label = LEADING_PUNCTUATION.matcher(label).replaceFirst("");
        label = TRAILING_QUALIFIER.matcher(label).replaceFirst("");
        String[] parts = label.split("[,;]");
        label = parts.length == 0 ? "" : parts[0].trim();
        if (label.isEmpty()) {
            label = description.trim();
        }
        label = Character.toUpperCase(label.charAt(0)) + label.substring(1);
        if (label.length() > MAX_LABEL_LENGTH) {
            label = label.substring(0, MAX_LABEL_LENGTH - 3) + "...";
        }
        return label;
    }

    private static int toPercent(double similarity) {
        return (int) Math.round(similarity * 100);
    }

    private static double round3(double value) {
        return Math.round(value * 1000) / 1000.0;
    }
}
