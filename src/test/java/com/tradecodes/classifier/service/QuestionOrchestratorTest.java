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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionOrchestratorTest {

    private QuestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new QuestionOrchestrator(new ClassifierProperties());
    }

    @Test
    void feedingLeftoversBackEmptiesTheQueueWithinQuestionCountRounds() {
        List<SmartQuestion> all = List.of(
                question("identity", QuestionPriority.CRITICAL, QuestionCategory.IDENTITY, 60),
                question("state", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40),
                question("use", QuestionPriority.IMPORTANT, QuestionCategory.USE, 35),
                question("grade", QuestionPriority.CLARIFYING, QuestionCategory.QUALITY, 10),
                question("pack", QuestionPriority.CLARIFYING, QuestionCategory.PACKAGING, 5),
                question("target", QuestionPriority.OPTIONAL, QuestionCategory.TARGET, 20),
                question("other", QuestionPriority.OPTIONAL, QuestionCategory.OTHER, 0));

        List<SmartQuestion> remaining = all;
        int round = 1;
        while (!remaining.isEmpty()) {
            assertThat(round).isLessThanOrEqualTo(all.size());
            OrchestrationResult result = orchestrator.selectQuestionsForRound(remaining, "", Map.of(), round, 10, 40);
            assertThat(result.questions()).isNotEmpty();
            assertThat(result.nextRoundQuestions()).hasSizeLessThan(remaining.size());
            remaining = result.nextRoundQuestions();
            round++;
        }
    }

    @Test
    void firstRoundAsksCriticalThenImportantUpToTheCap() {
        List<SmartQuestion> all = List.of(
                question("identity", QuestionPriority.CRITICAL, QuestionCategory.IDENTITY, 60),
                question("state1", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40),
                question("state2", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40),
                question("use", QuestionPriority.IMPORTANT, QuestionCategory.USE, 40),
                question("grade", QuestionPriority.CLARIFYING, QuestionCategory.QUALITY, 10));

        OrchestrationResult result = orchestrator.selectQuestionsForRound(all, "", Map.of(), 1, 10, 40);

        assertThat(result.questions()).extracting(SmartQuestion::id).containsExactly("identity", "state1", "state2");
        assertThat(result.nextRoundQuestions()).extracting(SmartQuestion::id).containsExactly("use", "grade");
        assertThat(result.readyToClassify()).isFalse();
    }

    @Test
    void secondRoundAsksTwoImportantThenClarifying() {
        List<SmartQuestion> all = List.of(
                question("state1", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40),
                question("state2", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40),
                question("use", QuestionPriority.IMPORTANT, QuestionCategory.USE, 35),
                question("grade", QuestionPriority.CLARIFYING, QuestionCategory.QUALITY, 10),
                question("pack", QuestionPriority.CLARIFYING, QuestionCategory.PACKAGING, 5));

        OrchestrationResult result = orchestrator.selectQuestionsForRound(all, "", Map.of(), 2, 10, 40);

        assertThat(result.questions()).extracting(SmartQuestion::id).containsExactly("state1", "state2", "grade");
        assertThat(result.nextRoundQuestions()).extracting(SmartQuestion::id).containsExactly("use", "pack");
        assertThat(result.round()).isEqualTo(2);
    }

    @Test
    void laterRoundsAskOnlyHighImpactQuestions() {
        List<SmartQuestion> all = List.of(
                question("state", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 20),
                question("grade", QuestionPriority.CLARIFYING, QuestionCategory.QUALITY, 45),
                question("pack", QuestionPriority.CLARIFYING, QuestionCategory.PACKAGING, 31),
                question("other", QuestionPriority.OPTIONAL, QuestionCategory.OTHER, 30));

        OrchestrationResult result = orchestrator.selectQuestionsForRound(all, "", Map.of(), 3, 10, 40);

        assertThat(result.questions()).extracting(SmartQuestion::id).containsExactly("grade", "pack");
        assertThat(result.nextRoundQuestions()).extracting(SmartQuestion::id).containsExactly("state", "other");
    }

    @Test
    void laterRoundWithoutHighImpactQuestionsStillAsksOne() {
        List<SmartQuestion> all = List.of(
                question("grade", QuestionPriority.CLARIFYING, QuestionCategory.QUALITY, 10),
                question("pack", QuestionPriority.CLARIFYING, QuestionCategory.PACKAGING, 5));

        OrchestrationResult result = orchestrator.selectQuestionsForRound(all, "", Map.of(), 4, 10, 40);

        assertThat(result.questions()).extracting(SmartQuestion::id).containsExactly("grade");
        assertThat(result.nextRoundQuestions()).extracting(SmartQuestion::id).containsExactly("pack");
    }

    @Test
    void highConfidenceWithoutCriticalQuestionsIsReady() {
        OrchestrationResult result = orchestrator.selectQuestionsForRound(
                List.of(question("state", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40)),
                "", Map.of(), 1, 5, 90);

        assertThat(result.readyToClassify()).isTrue();
        assertThat(result.reason()).isEqualTo("High confidence with no critical questions");
    }

    @Test
    void highConfidenceWithCriticalQuestionIsNotReady() {
        OrchestrationResult result = orchestrator.selectQuestionsForRound(
                List.of(question("identity", QuestionPriority.CRITICAL, QuestionCategory.IDENTITY, 60)),
                "", Map.of(), 1, 5, 95);

        assertThat(result.readyToClassify()).isFalse();
        assertThat(result.reason()).isNull();
    }

    @Test
    void twoCandidatesWithOnlyClarifyingQuestionsAreReady() {
        OrchestrationResult result = orchestrator.selectQuestionsForRound(
                List.of(question("grade", QuestionPriority.CLARIFYING, QuestionCategory.QUALITY, 10)),
                "", Map.of(), 1, 2, 40);

        assertThat(result.readyToClassify()).isTrue();
        assertThat(result.reason()).isEqualTo("Only 2 candidates with optional questions remaining");
    }

    @Test
    void everyQuestionAnsweredIsReady() {
        OrchestrationResult result = orchestrator.selectQuestionsForRound(
                List.of(question("state", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40)),
                "", Map.of("state", "Frozen"), 2, 5, 40);

        assertThat(result.questions()).isEmpty();
        assertThat(result.readyToClassify()).isTrue();
        assertThat(result.reason()).isEqualTo("All questions answered");
    }

    @Test
    void dependenciesPutIdentityQuestionsFirst() {
        SmartQuestion packaging = new SmartQuestion("packaging", "Packaging?", null, options(),
                QuestionPriority.CLARIFYING, QuestionCategory.PACKAGING, 3,
                List.of(QuestionCategory.IDENTITY, QuestionCategory.STATE), List.of(), 10, true);

        List<SmartQuestion> ordered = orchestrator.resolveQuestionOrder(List.of(
                packaging,
                question("state", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40),
                question("identity", QuestionPriority.CRITICAL, QuestionCategory.IDENTITY, 60)), Set.of());

        assertThat(ordered).extracting(SmartQuestion::id).containsExactly("identity", "state", "packaging");
    }

    @Test
    void cyclicDependenciesAreAppendedInInputOrder() {
        SmartQuestion first = new SmartQuestion("a", "A?", null, options(), QuestionPriority.IMPORTANT,
                QuestionCategory.STATE, 2, List.of(QuestionCategory.USE), List.of(), 40, true);
        SmartQuestion second = new SmartQuestion("b", "B?", null, options(), QuestionPriority.IMPORTANT,
                QuestionCategory.USE, 2, List.of(QuestionCategory.STATE), List.of(), 40, true);

        List<SmartQuestion> ordered = orchestrator.resolveQuestionOrder(List.of(first, second), Set.of());

        assertThat(ordered).extracting(SmartQuestion::id).containsExactly("a", "b");
    }

    @Test
    void questionsAnsweredByTheDescriptionAreSkipped() {
        SmartQuestion variety = new SmartQuestion("smart_variety", "Which variety?", null, options(),
                QuestionPriority.CRITICAL, QuestionCategory.IDENTITY, 1, List.of(),
                List.of(SkipCondition.descriptionContains("arabica")), 60, true);
        SmartQuestion form = question("smart_form", QuestionPriority.IMPORTANT, QuestionCategory.STATE, 40);

        OrchestrationResult result = orchestrator.selectQuestionsForRound(List.of(variety, form),
                "arabica coffee beans", Map.of(), 1, 10, 40);

        assertThat(result.questions()).extracting(SmartQuestion::id).containsExactly("smart_form");
    }

    @Test
    void singleRemainingCandidateIsReadyToClassify() {
        OrchestrationResult result = orchestrator.selectQuestionsForRound(
                List.of(question("identity", QuestionPriority.CRITICAL, QuestionCategory.IDENTITY, 60)),
                "", Map.of(), 1, 1, 40);

        assertThat(result.readyToClassify()).isTrue();
        assertThat(result.reason()).isEqualTo("Single candidate remaining");
    }

    @Test
    void siblingDifferentialBecomesCriticalQuestionWithCodeOptions() {
        Differential siblings = Differential.of("sibling_0804.50", "Mango Variety", DifferentialType.SPECIES,
                DistinctionType.MULTI, List.of(
                        new DifferentialOption("alphonso", "Alphonso", List.of("0804.50.21")),
                        new DifferentialOption("banganapalli", "Banganapalli", List.of("0804.50.22"))),
                6, "Which specific mango variety is this?");

        OrchestrationResult result = orchestrator.orchestrate(List.of(siblings), "fresh mango", Map.of(), 1, 2, 40);

        assertThat(result.questions()).hasSize(1);
        SmartQuestion question = result.questions().get(0);
        assertThat(question.id()).isEqualTo("smart_sibling_0804.50");
        assertThat(question.priority()).isEqualTo(QuestionPriority.CRITICAL);
        assertThat(question.options()).extracting(QuestionOption::code).containsExactly("0804.50.21", "0804.50.22");
    }

    @Test
    void materialDifferentialNamedInDescriptionIsFiltered() {
        Differential material = Differential.of("material", "Material", DifferentialType.MATERIAL, List.of(
                new DifferentialOption("cotton", "Cotton", List.of("6109.10.00")),
                new DifferentialOption("synthetic", "Synthetic", List.of("6109.90.00"))), 2, "What material?");

        assertThat(orchestrator.filterLowQuality(List.of(material), "cotton t-shirt")).isEmpty();
        assertThat(orchestrator.filterLowQuality(List.of(material), "t-shirt")).containsExactly(material);
    }

    @Test
    void genericOptionsAreRecognized() {
        assertThat(QuestionOrchestrator.isGeneric("Other")).isTrue();
        assertThat(QuestionOrchestrator.isGeneric("arabica")).isFalse();
    }

    private static SmartQuestion question(String id, QuestionPriority priority, QuestionCategory category, int impact) {
        List<QuestionCategory> dependencies = category == QuestionCategory.IDENTITY
                ? List.of()
                : List.of(QuestionCategory.IDENTITY);
        return new SmartQuestion(id, id + "?", null, options(), priority, category, category.hierarchyLevel(),
                dependencies, List.of(), impact, true);
    }

    private static List<QuestionOption> options() {
        return List.of(new QuestionOption("a", "A", null, List.of("0000.00.01")),
                new QuestionOption("b", "B", null, List.of("0000.00.02")));
    }
}
