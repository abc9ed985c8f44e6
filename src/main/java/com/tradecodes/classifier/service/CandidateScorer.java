package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.ChapterPredictionResult;
import com.tradecodes.classifier.model.QueryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Combines semantic similarity with keyword, query-context and chapter signals into one ranking score.
 * Scores are recomputed from the candidate's similarity on every call.
 */
@Service
public class CandidateScorer {

    private static final Logger logger = LoggerFactory.getLogger(CandidateScorer.class);

    private final ChapterPredictor chapterPredictor;
    private final QueryContextParser queryContextParser;
    private final ClassifierProperties.Scoring weights;
    private final double semanticScale;
    private final Set<String> stopWords;
    private final List<String> materialKeywords;
    private final List<String> functionKeywords;

    public CandidateScorer(ChapterPredictor chapterPredictor,
                           QueryContextParser queryContextParser,
                           ClassificationRules rules,
                           ClassifierProperties properties) {
        this.chapterPredictor = chapterPredictor;
        this.queryContextParser = queryContextParser;
        this.weights = properties.getScoring();
        this.semanticScale = properties.getRetrieval().getSemanticScale();
        this.stopWords = rules.scoringTerms().stopWords();
        this.materialKeywords = rules.scoringTerms().materialKeywords();
        this.functionKeywords = rules.scoringTerms().functionKeywords();
    }

    /**
     * Scores every candidate and returns them ordered by descending total score.
     */
    public List<Candidate> score(String query, List<Candidate> candidates, ChapterPredictionResult prediction) {
        List<String> terms = meaningfulTerms(query);
        QueryContext context = queryContextParser.parse(query);
        List<String> foundFunction = matchingTerms(terms, functionKeywords);
        List<String> foundMaterial = matchingTerms(terms, materialKeywords);

        List<Candidate> scored = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            ScoreBreakdown breakdown = breakdown(candidate, terms, context, foundFunction, foundMaterial, prediction);
            scored.add(candidate.withScore(breakdown.total()));
        }
        scored.sort(Comparator.comparingDouble(Candidate::score).reversed());
        if (logger.isDebugEnabled() && !scored.isEmpty()) {
            logger.debug("Scored {} candidates for '{}', top {} at {}", scored.size(), query,
                    scored.get(0).code(), String.format("%.2f", scored.get(0).score()));
        }
        return scored;
    }

    /**
     * Score components of one candidate, for diagnostics.
     */
    public ScoreBreakdown explain(String query, Candidate candidate, ChapterPredictionResult prediction) {
        List<String> terms = meaningfulTerms(query);
        return breakdown(candidate, terms, queryContextParser.parse(query),
                matchingTerms(terms, functionKeywords), matchingTerms(terms, materialKeywords), prediction);
    }

    public List<String> meaningfulTerms(String query) {
        return QueryTerms.meaningful(query, stopWords);
    }

    private ScoreBreakdown breakdown(Candidate candidate,
                                     List<String> terms,
                                     QueryContext context,
                                     List<String> foundFunction,
                                     List<String> foundMaterial,
                                     ChapterPredictionResult prediction) {
        double semantic = Math.max(0, Math.min(semanticScale, candidate.similarity() * semanticScale));
        List<String> matched = matchedTerms(terms, candidate);
        double keyword = keywordBonus(matched.size(), terms.size());
        double function = functionOverMaterial(candidate, foundFunction, foundMaterial);
        double contextBoost = contextBoost(candidate, context);
        double chapter = chapterPredictor.chapterBoost(candidate.code(), prediction);
        return new ScoreBreakdown(semantic, keyword, function, contextBoost, chapter, matched);
    }

    double keywordBonus(int matchedCount, int termCount) {
        if (termCount == 0) {
            return 0;
        }
        double bonus = matchedCount * weights.getPerTermBonus();
        if (matchedCount >= 2) {
            bonus += weights.getMultiTermBonus();
        }
        if (matchedCount == termCount && termCount >= 2) {
            bonus += weights.getAllTermsBonus();
        }
        return bonus;
    }

    private static List<String> matchedTerms(List<String> terms, Candidate candidate) {
        List<String> bag = new ArrayList<>();
        candidate.keywords().forEach(k -> bag.add(k.toLowerCase()));
        candidate.commonProducts().forEach(k -> bag.add(k.toLowerCase()));
        candidate.synonyms().forEach(k -> bag.add(k.toLowerCase()));
        bag.addAll(QueryTerms.words(candidate.description()));

        List<String> matched = new ArrayList<>();
        for (String term : terms) {
            if (bag.stream().anyMatch(t -> !t.isEmpty() && (t.contains(term) || term.contains(t)))) {
                matched.add(term);
            }
        }
        return matched;
    }

    private static List<String> matchingTerms(List<String> terms, List<String> keywords) {
        return terms.stream()
                .filter(term -> keywords.stream().anyMatch(k -> term.contains(k) || k.contains(term)))
                .toList();
    }

    /**
     * Applies only when the query names both a product function and a material.
     */
    private double functionOverMaterial(Candidate candidate, List<String> foundFunction, List<String> foundMaterial) {
        if (foundFunction.isEmpty() || foundMaterial.isEmpty()) {
            return 0;
        }
        String text = candidate.searchableText();
        boolean matchesFunction = foundFunction.stream().anyMatch(text::contains);
        boolean matchesMaterial = foundMaterial.stream().anyMatch(text::contains);
        if (matchesFunction && matchesMaterial) {
            return weights.getFunctionAndMaterialBonus();
        }
        if (matchesFunction) {
            return weights.getFunctionOnlyBonus();
        }
        if (matchesMaterial) {
            return weights.getMaterialOnlyPenalty();
        }
        return 0;
    }

    /**
     * Rewards candidates that describe the primary subject rather than the context it is used in.
     */
    private double contextBoost(Candidate candidate, QueryContext context) {
        if (context.contextWords().isEmpty()) {
            return 0;
        }
        String text = candidate.searchableText();
        double boost = 0;
        for (String word : context.primaryWords()) {
            if (!stopWords.contains(word) && text.contains(word)) {
                boost += weights.getContextBoostPerWord();
            }
        }
        return Math.min(weights.getContextBoostCap(), boost);
    }

    /**
     * @param semantic     similarity scaled to 0..10
     * @param keywordBonus per-term, multi-term and all-terms bonuses
     * @param functionBonus function-over-material adjunct
     * @param contextBoost primary subject boost
     * @param chapterBoost chapter prediction boost or penalty
     * @param matchedTerms query terms found in the candidate
     */
    public record ScoreBreakdown(double semantic,
                                 double keywordBonus,
                                 double functionBonus,
                                 double contextBoost,
                                 double chapterBoost,
                                 List<String> matchedTerms) {

        public double total() {
            return semantic + keywordBonus + functionBonus + contextBoost + chapterBoost;
        }
    }
}
