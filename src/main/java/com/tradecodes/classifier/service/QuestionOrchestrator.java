package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Differential;
import com.tradecodes.classifier.model.DifferentialOption;
import com.tradecodes.classifier.model.DifferentialType;
import com.tradecodes.classifier.model.DistinctionType;
import com.tradecodes.classifier.model.OrchestrationResult;
import com.tradecodes.classifier.model.QuestionCategory;
import com.tradecodes.classifier.model.QuestionOption;
import com.tradecodes.classifier.model.QuestionPriority;
import com.tradecodes.classifier.model.SkipCondition;
import com.tradecodes.classifier.model.SmartQuestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns differentials into prioritized, dependency-ordered questions and picks the ones to ask
 * in the current round.
 */
@Service
public class QuestionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(QuestionOrchestrator.class);

    private static final Set<String> GENERIC_OPTIONS = Set.of(
            "other", "others", "n.e.s", "n.e.s.", "nes", "etc", "etc.",
            "not elsewhere specified", "not specified", "unspecified",
            "miscellaneous", "general", "various", "different", "mixed");

    private static final Pattern CODE_LIKE = Pattern.compile("\\d{4}\\.\\d{2}");
    private static final List<Pattern> TECHNICAL_PATTERNS = List.of(
            Pattern.compile("^\\d{4}\\.\\d{2}"),
            Pattern.compile("^[A-Z]{2,5}$"),
            Pattern.compile("\\d{3,}[A-Z]"),
            Pattern.compile("^[<>≤≥]\\s*\\d"));

    private static final Map<DifferentialType, QuestionCategory> CATEGORY_BY_TYPE = new EnumMap<>(DifferentialType.class);
    private static final Map<QuestionCategory, QuestionPriority> PRIORITY_BY_CATEGORY = new EnumMap<>(QuestionCategory.class);
    private static final Map<QuestionCategory, List<QuestionCategory>> DEPENDENCIES = new EnumMap<>(QuestionCategory.class);

    static {
        CATEGORY_BY_TYPE.put(DifferentialType.SPECIES, QuestionCategory.IDENTITY);
        CATEGORY_BY_TYPE.put(DifferentialType.MATERIAL, QuestionCategory.IDENTITY);
        CATEGORY_BY_TYPE.put(DifferentialType.TERM, QuestionCategory.IDENTITY);
        CATEGORY_BY_TYPE.put(DifferentialType.FORM, QuestionCategory.STATE);
        CATEGORY_BY_TYPE.put(DifferentialType.PROCESSING, QuestionCategory.STATE);
        CATEGORY_BY_TYPE.put(DifferentialType.GRADE, QuestionCategory.QUALITY);
        CATEGORY_BY_TYPE.put(DifferentialType.SPECIFICATION, QuestionCategory.SPECIFICATION);
        CATEGORY_BY_TYPE.put(DifferentialType.PRICE, QuestionCategory.SPECIFICATION);
        CATEGORY_BY_TYPE.put(DifferentialType.PACKAGING, QuestionCategory.PACKAGING);
        CATEGORY_BY_TYPE.put(DifferentialType.USE, QuestionCategory.USE);
        CATEGORY_BY_TYPE.put(DifferentialType.GENDER, QuestionCategory.TARGET);

        PRIORITY_BY_CATEGORY.put(QuestionCategory.IDENTITY, QuestionPriority.CRITICAL);
        PRIORITY_BY_CATEGORY.put(QuestionCategory.STATE, QuestionPriority.IMPORTANT);
        PRIORITY_BY_CATEGORY.put(QuestionCategory.USE, QuestionPriority.IMPORTANT);
        PRIORITY_BY_CATEGORY.put(QuestionCategory.QUALITY, QuestionPriority.CLARIFYING);
        PRIORITY_BY_CATEGORY.put(QuestionCategory.SPECIFICATION, QuestionPriority.CLARIFYING);
        PRIORITY_BY_CATEGORY.put(QuestionCategory.PACKAGING, QuestionPriority.CLARIFYING);
        PRIORITY_BY_CATEGORY.put(QuestionCategory.TARGET, QuestionPriority.CLARIFYING);
        PRIORITY_BY_CATEGORY.put(QuestionCategory.OTHER, QuestionPriority.OPTIONAL);

        DEPENDENCIES.put(QuestionCategory.IDENTITY, List.of());
        DEPENDENCIES.put(QuestionCategory.STATE, List.of(QuestionCategory.IDENTITY));
        DEPENDENCIES.put(QuestionCategory.USE, List.of(QuestionCategory.IDENTITY));
        DEPENDENCIES.put(QuestionCategory.QUALITY, List.of(QuestionCategory.IDENTITY, QuestionCategory.STATE));
        DEPENDENCIES.put(QuestionCategory.SPECIFICATION, List.of(QuestionCategory.IDENTITY));
        DEPENDENCIES.put(QuestionCategory.PACKAGING, List.of(QuestionCategory.IDENTITY, QuestionCategory.STATE));
        DEPENDENCIES.put(QuestionCategory.TARGET, List.of(QuestionCategory.IDENTITY));
        DEPENDENCIES.put(QuestionCategory.OTHER, List.of(QuestionCategory.IDENTITY, QuestionCategory.STATE, QuestionCategory.QUALITY));
    }

    private final ClassifierProperties.Orchestrator settings;

    public QuestionOrchestrator(ClassifierProperties properties) {
        this.settings = properties.getOrchestrator();
    }

    /**
     * Filters, converts and selects questions for one round.
     *
     * @param previousAnswers answer text keyed by question id
     * @param confidence      current confidence, 0..100
     */
    public OrchestrationResult orchestrate(List<Differential> differentials,
                                           String productDescription,
                                           Map<String, String> previousAnswers,
                                           int round,
                                           int candidateCount,
                                           double confidence) {
        List<Differential> kept = filterLowQuality(differentials, productDescription);
        List<SmartQuestion> questions = toSmartQuestions(kept);
        OrchestrationResult result = selectQuestionsForRound(questions, productDescription, previousAnswers,
                round, candidateCount, confidence);
        logger.info("Round {}: selected {} questions, {} left for later rounds, ready={}",
                round, result.questions().size(), result.nextRoundQuestions().size(), result.readyToClassify());
        return result;
    }

    /**
     * Drops differentials that would make poor questions. Species, sibling and variety differentials are always kept.
     */
    public List<Differential> filterLowQuality(List<Differential> differentials, String productDescription) {
        String description = lower(productDescription);
        List<Differential> kept = new ArrayList<>();
        for (Differential differential : differentials) {
            String reason = filterReason(differential, description);
            if (reason != null) {
                logger.debug("Dropping differential '{}': {}", differential.feature(), reason);
            } else {
                kept.add(differential);
            }
        }
        return kept;
    }

    private String filterReason(Differential differential, String description) {
        if (differential.type() == DifferentialType.SPECIES
                || differential.id().startsWith("sibling_")
                || differential.id().startsWith("variety")) {
            return null;
        }
        if (differential.affectedCodes().size() < 2) {
            return "affects fewer than 2 codes";
        }
        if (hasProductNameOptions(differential)) {
            return "options look like product names";
        }
        long meaningful = differential.options().stream()
                .filter(o -> !isGeneric(o.value()) && !o.matchingCodes().isEmpty())
                .count();
        if (meaningful < 2) {
            return "fewer than 2 meaningful options";
        }
        long covered = differential.options().stream()
                .filter(o -> description.contains(lower(o.value())))
                .count();
        if (covered == 1) {
            return "already covered by description";
        }
        if (differential.type() == DifferentialType.TERM && hasOnlyTechnicalOptions(differential)) {
            return "options are technical codes";
        }
        Set<Set<String>> codeSets = new HashSet<>();
        differential.options().forEach(o -> codeSets.add(new HashSet<>(o.matchingCodes())));
        if (codeSets.size() < 2) {
            return "all options map to the same codes";
        }
        return null;
    }

    private static boolean hasProductNameOptions(Differential differential) {
        long suspicious = differential.options().stream().filter(o -> {
            String value = lower(o.value());
            return (value.length() <= 2 && !value.matches(".*\\d.*")) || CODE_LIKE.matcher(value).find();
        }).count();
        return suspicious > differential.options().size() / 2.0;
    }

    private static boolean hasOnlyTechnicalOptions(Differential differential) {
        long technical = differential.options().stream()
                .filter(o -> TECHNICAL_PATTERNS.stream().anyMatch(p -> p.matcher(o.value()).find()))
                .count();
        return technical > differential.options().size() * 0.7;
    }

    static boolean isGeneric(String value) {
        return value == null || GENERIC_OPTIONS.contains(value.toLowerCase(Locale.ROOT).trim());
    }

    public List<SmartQuestion> toSmartQuestions(List<Differential> differentials) {
        List<SmartQuestion> questions = new ArrayList<>();
        for (Differential differential : differentials) {
            QuestionCategory category = CATEGORY_BY_TYPE.getOrDefault(differential.type(), QuestionCategory.OTHER);
            List<QuestionOption> options = differential.options().stream()
                    .limit(settings.getMaxOptions())
                    .map(QuestionOrchestrator::toOption)
                    .toList();
            questions.add(new SmartQuestion(
                    "smart_" + differential.id(),
                    differential.questionText() != null && !differential.questionText().isBlank()
                            ? differential.questionText()
                            : defaultQuestionText(differential),
                    differential,
                    options,
                    priorityOf(differential, category),
                    category,
                    category.hierarchyLevel(),
                    DEPENDENCIES.get(category),
                    skipConditions(differential),
                    impactScore(differential),
                    true));
        }
        return questions;
    }

    /**
     * Options with a single matching code carry that code, so the answer maps straight back to a tariff line.
     */
    private static QuestionOption toOption(DifferentialOption option) {
        String code = option.matchingCodes().size() == 1 ? option.matchingCodes().get(0) : option.value();
        return new QuestionOption(code, option.displayText(), null, option.matchingCodes());
    }

    private QuestionPriority priorityOf(Differential differential, QuestionCategory category) {
        if (differential.type() == DifferentialType.SPECIES || differential.type() == DifferentialType.MATERIAL) {
            return QuestionPriority.CRITICAL;
        }
        QuestionPriority priority = PRIORITY_BY_CATEGORY.get(category);
        if (differential.importance() >= settings.getImportancePromotionThreshold()) {
            if (priority == QuestionPriority.CLARIFYING) {
                return QuestionPriority.IMPORTANT;
            }
            if (priority == QuestionPriority.OPTIONAL) {
                return QuestionPriority.CLARIFYING;
            }
        }
        return priority;
    }

    /**
     * 0..100: five points per affected code (at most 50), plus 20 for a binary choice and 20 for identity or state types.
     */
    static int impactScore(Differential differential) {
        int base = Math.min(differential.affectedCodes().size() * 5, 50);
        int binary = differential.distinctionType() == DistinctionType.BINARY ? 20 : 0;
        DifferentialType type = differential.type();
        int typeBonus = type == DifferentialType.SPECIES || type == DifferentialType.MATERIAL
                || type == DifferentialType.FORM || type == DifferentialType.PROCESSING ? 20 : 0;
        return Math.min(100, base + binary + typeBonus);
    }

    private List<SkipCondition> skipConditions(Differential differential) {
        List<SkipCondition> conditions = new ArrayList<>();
        for (DifferentialOption option : differential.options()) {
            if (option.value().length() >= 4 && !isGeneric(option.value())) {
                conditions.add(SkipCondition.descriptionContains(option.value()));
                conditions.add(SkipCondition.answerContains(option.value()));
            }
        }
        if (differential.type() == DifferentialType.PACKAGING) {
            conditions.add(SkipCondition.confidenceAbove(settings.getPackagingSkipConfidence()));
        }
        if (differential.type() == DifferentialType.GRADE) {
            conditions.add(SkipCondition.candidateCountBelow(settings.getGradeSkipCandidateCount()));
        }
        return conditions;
    }

    private static String defaultQuestionText(Differential differential) {
        if (differential.type() == DifferentialType.SPECIES) {
            return "What species or variety is this product?";
        }
        if (differential.type() == DifferentialType.TERM) {
            return "Which type best describes this product?";
        }
        return "What is the " + lower(differential.feature()) + "?";
    }

    /**
     * Picks this round's questions. Every non-empty ordered list yields at least one question, so feeding
     * {@code nextRoundQuestions} back in empties the list in at most as many rounds as there are questions.
     */
    public OrchestrationResult selectQuestionsForRound(List<SmartQuestion> allQuestions,
                                                       String productDescription,
                                                       Map<String, String> previousAnswers,
                                                       int round,
                                                       int candidateCount,
                                                       double confidence) {
        Map<String, String> answers = previousAnswers == null ? Map.of() : previousAnswers;
        String description = lower(productDescription);
        String answerText = lower(String.join(" ", answers.values()));

        List<SmartQuestion> eligible = new ArrayList<>();
        for (SmartQuestion question : allQuestions) {
            if (answers.containsKey(question.id())) {
                continue;
            }
            String skip = skipReason(question, description, answerText, candidateCount, confidence);
            if (skip != null) {
                logger.debug("Skipping question {}: {}", question.id(), skip);
                continue;
            }
            eligible.add(question);
        }

        List<SmartQuestion> ordered = resolveQuestionOrder(eligible, answers.keySet());
        List<SmartQuestion> selected = selectByRound(ordered, round);
        List<SmartQuestion> remaining = new ArrayList<>(ordered);
        remaining.removeAll(selected);

        String readyReason = readyReason(eligible, selected, candidateCount, confidence);
        return new OrchestrationResult(selected, remaining, readyReason != null, readyReason, round);
    }

    private static String skipReason(SmartQuestion question, String description, String answerText,
                                     int candidateCount, double confidence) {
        for (SkipCondition condition : question.skipConditions()) {
            if (condition.type() == SkipCondition.Type.DESCRIPTION_CONTAINS
                    && description.contains(lower(condition.value()))) {
                return "description already mentions '" + condition.value() + "'";
            }
            if (condition.type() == SkipCondition.Type.ANSWER_CONTAINS
                    && !answerText.isEmpty() && answerText.contains(lower(condition.value()))) {
                return "an earlier answer mentions '" + condition.value() + "'";
            }
            if (condition.type() == SkipCondition.Type.CANDIDATE_COUNT_BELOW && candidateCount < condition.threshold()) {
                return "only " + candidateCount + " candidates remain";
            }
            if (condition.type() == SkipCondition.Type.CONFIDENCE_ABOVE && confidence > condition.threshold()) {
                return "confidence " + confidence + " above " + condition.threshold();
            }
        }
        return null;
    }

    /**
     * Orders questions so that each comes after the questions of the categories it depends on.
     * Questions still blocked after {@code 2n} passes are appended in input order.
     */
    public List<SmartQuestion> resolveQuestionOrder(List<SmartQuestion> questions, Set<String> answeredIds) {
        Map<String, List<String>> dependsOn = new LinkedHashMap<>();
        for (SmartQuestion question : questions) {
            List<String> deps = new ArrayList<>();
            for (SmartQuestion other : questions) {
                if (!other.id().equals(question.id()) && question.dependencies().contains(other.category())) {
                    deps.add(other.id());
                }
            }
            dependsOn.put(question.id(), deps);
        }

        List<SmartQuestion> ordered = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        Set<String> pending = new LinkedHashSet<>(dependsOn.keySet());
        int iterations = questions.size() * 2;
        while (!pending.isEmpty() && iterations-- > 0) {
            for (SmartQuestion question : questions) {
                if (!pending.contains(question.id())) {
                    continue;
                }
                boolean satisfied = dependsOn.get(question.id()).stream()
                        .allMatch(dep -> placed.contains(dep) || answeredIds.contains(dep));
                if (satisfied) {
                    ordered.add(question);
                    placed.add(question.id());
                    pending.remove(question.id());
                }
            }
        }
        for (SmartQuestion question : questions) {
            if (pending.contains(question.id())) {
                ordered.add(question);
            }
        }
        return ordered;
    }

    private List<SmartQuestion> selectByRound(List<SmartQuestion> ordered, int round) {
        int max = Math.max(1, settings.getMaxQuestionsPerRound());
        List<SmartQuestion> selected = new ArrayList<>();
        if (round <= 1) {
            selected.addAll(withPriority(ordered, QuestionPriority.CRITICAL));
            List<SmartQuestion> important = withPriority(ordered, QuestionPriority.IMPORTANT);
            selected.addAll(important.subList(0, Math.min(important.size(), Math.max(0, max - selected.size()))));
        } else if (round == 2) {
            List<SmartQuestion> important = withPriority(ordered, QuestionPriority.IMPORTANT);
            selected.addAll(important.subList(0, Math.min(important.size(), Math.min(2, max))));
            List<SmartQuestion> clarifying = withPriority(ordered, QuestionPriority.CLARIFYING);
            selected.addAll(clarifying.subList(0, Math.min(clarifying.size(), Math.max(0, max - selected.size()))));
        } else {
            ordered.stream()
                    .filter(q -> q.impactScore() > settings.getHighImpactThreshold())
                    .limit(max)
                    .forEach(selected::add);
        }
        if (selected.isEmpty() && !ordered.isEmpty()) {
            selected.add(ordered.get(0));
        }
        return selected.size() > max ? new ArrayList<>(selected.subList(0, max)) : selected;
    }

    private static List<SmartQuestion> withPriority(List<SmartQuestion> questions, QuestionPriority priority) {
        return questions.stream().filter(q -> q.priority() == priority).toList();
    }

    private String readyReason(List<SmartQuestion> remaining, List<SmartQuestion> selected,
                               int candidateCount, double confidence) {
        if (remaining.isEmpty() && selected.isEmpty()) {
            return "All questions answered";
        }
        if (candidateCount == 1) {
            return "Single candidate remaining";
        }
        boolean critical = remaining.stream().anyMatch(q -> q.priority() == QuestionPriority.CRITICAL);
        if (confidence >= settings.getReadyConfidence() && !critical) {
            return "High confidence with no critical questions";
        }
        boolean important = remaining.stream()
                .anyMatch(q -> q.priority() == QuestionPriority.CRITICAL || q.priority() == QuestionPriority.IMPORTANT);
        if (candidateCount <= 2 && !important) {
            return "Only " + candidateCount + " candidates with optional questions remaining";
        }
        return null;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
