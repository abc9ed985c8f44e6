package com.tradecodes.classifier.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic tables loaded from the {@code rules/*.json} classpath resources.
 * Built once at startup and shared read-only by the pipeline components.
 */
public record ClassificationRules(TermDictionary termDictionary,
                                  ChapterRules chapterRules,
                                  RerankerRules rerankerRules,
                                  DifferentialTerms differentialTerms,
                                  SpecificitySignals specificitySignals,
                                  ScoringTerms scoringTerms) {

    public record CompoundTerm(String phrase, String category, int priority) {
    }

    public record TermDictionary(List<CompoundTerm> compoundTerms,
                                 Set<String> productTerms,
                                 Set<String> varietyTerms,
                                 Set<String> processingTerms,
                                 Set<String> materialTerms,
                                 Set<String> packagingTerms,
                                 Set<String> descriptiveTerms,
                                 Set<String> stopWords,
                                 String measurementPattern,
                                 String colorPattern) {
    }

    public record ChapterRule(String chapter, String name, int priority, List<String> include, List<String> exclude) {
    }

    public record OverrideRule(List<String> keywords, String forceChapter, String reason) {
    }

    public record AmbiguousOption(String label, String chapter) {
    }

    public record Indicator(String pattern, String chapter) {
    }

    public record AmbiguousTerm(String term, String question, List<AmbiguousOption> options, List<Indicator> indicators) {
    }

    public record ChapterRules(List<ChapterRule> chapters,
                               List<OverrideRule> functionalOverrides,
                               List<AmbiguousTerm> ambiguousTerms) {
    }

    public record FinishedProductRule(String keyword, List<String> targetChapters, List<String> penalizeChapters, int priority) {
    }

    public record RerankerRules(List<FinishedProductRule> finishedProductKeywords,
                                Map<String, List<String>> rawMaterialHeadings) {
    }

    public record DifferentialTerms(Map<String, Set<String>> categories,
                                    Set<String> varieties,
                                    Set<String> stopwords,
                                    Map<String, String> siblingFeatureNames) {
    }

    public record SpecificitySignals(List<String> varietyKeywords,
                                     List<String> processingKeywords,
                                     List<String> sizeKeywords,
                                     List<String> colorKeywords,
                                     List<String> materialKeywords,
                                     List<String> brandKeywords,
                                     String unitPattern) {
    }

    public record ScoringTerms(Set<String> stopWords, List<String> materialKeywords, List<String> functionKeywords) {
    }
}
