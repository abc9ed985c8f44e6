package com.tradecodes.classifier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable weights and thresholds of the classification pipeline, bound from {@code app.classifier.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.classifier")
public class ClassifierProperties {

    private Decision decision = new Decision();
    private Retrieval retrieval = new Retrieval();
    private Scoring scoring = new Scoring();
    private Chapter chapter = new Chapter();
    private Reranker reranker = new Reranker();
    private Orchestrator orchestrator = new Orchestrator();
    private Conversation conversation = new Conversation();

    @Data
    public static class Decision {
        private double highConfidenceThreshold = 0.55;
        private double confidenceGapThreshold = 0.08;
        private double mediumSimilarityThreshold = 0.45;
        private double mediumGapThreshold = 0.03;
        /** Gap assumed when only one candidate exists. */
        private double singleCandidateGap = 0.2;
        private double minSimilarity = 0.25;
        private double highSpecificitySimilarity = 0.50;
        private double dominantChapterShare = 0.8;
        private int dominantTopN = 5;
        private double verificationAcceptConfidence = 0.75;
        private double fallbackConfidenceFactor = 0.8;
        /** Confidence reported when answers leave exactly one code. */
        private int narrowedConfidence = 95;
        private int maxAlternatives = 3;
        private int hierarchyQuestionPool = 15;
        private int maxQuestionOptions = 5;
        private int attributeOptionLimit = 6;
        private int verificationCandidates = 8;
        private int minQueryLength = 2;
    }

    @Data
    public static class Retrieval {
        private int initialSearchLimit = 30;
        private int lexicalLimit = 50;
        private int keywordPassLimit = 15;
        private int scopedChapterCount = 2;
        private int maxCandidates = 40;
        private double vectorMinSimilarity = 0.25;
        private double fuzzyThreshold = 0.75;
        private double exactMatchScore = 10;
        private double partialMatchScore = 5;
        private double fuzzyMatchScore = 3;
        private double semanticScale = 10;
        private double exactMergeWeight = 0.7;
        private double defaultMergeWeight = 0.6;
        /** Queries with at least this many meaningful tokens use the semantic channel only. */
        private int semanticOnlyTokenThreshold = 3;
        private int noiseMinMatchedTerms = 2;
        private List<String> fuzzyAllowedChapters = new ArrayList<>();
        private long timeoutMs = 5000;
    }

    @Data
    public static class Scoring {
        private double perTermBonus = 2;
        private double multiTermBonus = 3;
        private double allTermsBonus = 5;
        private double functionAndMaterialBonus = 5;
        private double functionOnlyBonus = 3;
        private double materialOnlyPenalty = -3;
        private double contextBoostPerWord = 3;
        private double contextBoostCap = 10;
    }

    @Data
    public static class Chapter {
        private double includeWeight = 20;
        private double excludePenalty = 30;
        private double phraseBonus = 15;
        private double priorityDivisor = 5;
        private double ambiguityMargin = 0.15;
        private double maxConfidence = 0.99;
        private double overrideConfidence = 0.95;
        private double overrideBoost = 30;
        private double overridePenalty = -20;
        private double rankBoostBase = 15;
        private double rankBoostStep = 5;
        private double unpredictedPenalty = -5;
        private int maxPredictions = 5;
    }

    @Data
    public static class Reranker {
        private double boostAmount = 0.15;
        private double penaltyAmount = 0.10;
        private double materialPenalty = 0.20;
    }

    @Data
    public static class Orchestrator {
        private int maxQuestionsPerRound = 3;
        private int highImpactThreshold = 30;
        private int readyConfidence = 90;
        private int packagingSkipConfidence = 85;
        private int gradeSkipCandidateCount = 1;
        private int maxOptions = 5;
        private int importancePromotionThreshold = 10;
    }

    @Data
    public static class Conversation {
        private Duration idleTtl = Duration.ofMinutes(30);
        private long maxEntries = 10_000;
        private int lockStripes = 64;
    }
}
