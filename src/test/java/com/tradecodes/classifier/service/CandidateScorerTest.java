package com.tradecodes.classifier.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.config.ClassificationRulesConfig;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CandidateSource;
import com.tradecodes.classifier.model.ChapterPredictionResult;
import com.tradecodes.classifier.model.MatchType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateScorerTest {

    private ChapterPredictor chapterPredictor;
    private CandidateScorer scorer;

    @BeforeEach
    void setUp() {
        ClassificationRules rules = ClassificationRulesConfig.load(new ObjectMapper());
        ClassifierProperties properties = new ClassifierProperties();
        chapterPredictor = new ChapterPredictor(rules, properties);
        scorer = new CandidateScorer(chapterPredictor, new QueryContextParser(), rules, properties);
    }

    @Test
    void candidateMatchingEveryTermRanksFirst() {
        String query = "steel nuts and bolts";
        ChapterPredictionResult prediction = chapterPredictor.predictChapters(query);
        List<Candidate> candidates = List.of(
                candidate("7318.15.00", "Bolts of iron or steel", 0.62),
                candidate("7318.16.00", "Nuts of iron or steel", 0.62),
                candidate("7318.19.00", "Nuts and bolts of iron or steel", 0.62));

        List<Candidate> scored = scorer.score(query, candidates, prediction);

        assertThat(scored.get(0).code()).isEqualTo("7318.19.00");
        assertThat(scored.get(0).score()).isGreaterThan(scored.get(1).score());
    }

    @Test
    void conjunctiveBonusIsStrictlyMonotonic() {
        for (int termCount = 2; termCount <= 6; termCount++) {
            for (int matched = 0; matched < termCount; matched++) {
                assertThat(scorer.keywordBonus(termCount, termCount))
                        .as("all %d terms vs %d of them", termCount, matched)
                        .isGreaterThan(scorer.keywordBonus(matched, termCount));
            }
        }
    }

    @Test
    void keywordBonusFollowsPerTermMultiTermAndAllTermsWeights() {
        assertThat(scorer.keywordBonus(0, 3)).isZero();
        assertThat(scorer.keywordBonus(1, 3)).isEqualTo(2.0);
        assertThat(scorer.keywordBonus(2, 3)).isEqualTo(7.0);
        assertThat(scorer.keywordBonus(3, 3)).isEqualTo(14.0);
        assertThat(scorer.keywordBonus(1, 1)).isEqualTo(2.0);
    }

    @Test
    void scoringTwiceGivesIdenticalScores() {
        String query = "steel nuts and bolts";
        ChapterPredictionResult prediction = chapterPredictor.predictChapters(query);
        List<Candidate> candidates = List.of(
                candidate("7318.15.00", "Bolts of iron or steel", 0.71),
                candidate("7318.16.00", "Nuts of iron or steel", 0.55),
                candidate("7208.10.00", "Flat-rolled products of iron", 0.40));

        List<Candidate> first = scorer.score(query, candidates, prediction);
        List<Candidate> second = scorer.score(query, candidates, prediction);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void functionKeywordBeatsMaterialOnlyMatch() {
        String query = "ceramic brake pads";
        ChapterPredictionResult prediction = chapterPredictor.predictChapters(query);
        Candidate brakes = candidate("8708.30.00", "Brakes and servo-brakes; parts thereof", 0.5);
        Candidate tiles = candidate("6907.21.00", "Ceramic flags and paving, hearth or wall tiles", 0.5);

        CandidateScorer.ScoreBreakdown brakeScore = scorer.explain(query, brakes, prediction);
        CandidateScorer.ScoreBreakdown tileScore = scorer.explain(query, tiles, prediction);

        assertThat(brakeScore.functionBonus()).isEqualTo(3.0);
        assertThat(tileScore.functionBonus()).isEqualTo(-3.0);
        assertThat(brakeScore.chapterBoost()).isEqualTo(30.0);
        assertThat(brakeScore.total()).isGreaterThan(tileScore.total());
    }

    @Test
    void meaningfulTermsDropStopWordsAndShortTokens() {
        assertThat(scorer.meaningfulTerms("Nuts and bolts for a car")).containsExactly("nuts", "bolts", "car");
    }

    private static Candidate candidate(String code, String description, double similarity) {
        return new Candidate(code, description, similarity * 10, similarity, MatchType.SEMANTIC,
                CandidateSource.SEMANTIC, List.of(), List.of(), List.of());
    }
}
