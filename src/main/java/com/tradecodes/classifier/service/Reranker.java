package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.TermAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Function-over-material pass: shifts similarity toward finished-goods chapters when the query names a
 * manufactured product, and away from raw-material headings of a named material.
 */
@Service
public class Reranker {

    private static final Logger logger = LoggerFactory.getLogger(Reranker.class);

    private final List<CompiledRule> rulesByLength;
    private final Map<String, List<String>> rawMaterialHeadings;
    private final ClassifierProperties.Reranker weights;
    private final double semanticScale;

    public Reranker(ClassificationRules rules, ClassifierProperties properties) {
        this.weights = properties.getReranker();
        this.semanticScale = properties.getRetrieval().getSemanticScale();
        this.rawMaterialHeadings = rules.rerankerRules().rawMaterialHeadings();
        List<CompiledRule> compiled = new ArrayList<>();
        for (ClassificationRules.FinishedProductRule rule : rules.rerankerRules().finishedProductKeywords()) {
            compiled.add(new CompiledRule(rule,
                    Pattern.compile("\\b" + Pattern.quote(rule.keyword().toLowerCase()) + "s?\\b")));
        }
        compiled.sort(Comparator.comparingInt((CompiledRule r) -> r.rule().keyword().length()).reversed());
        this.rulesByLength = List.copyOf(compiled);
    }

    /**
     * Finished-product keywords found in the query, longest keyword first.
     */
    public List<ClassificationRules.FinishedProductRule> detectFinishedProducts(String query) {
        String normalized = query == null ? "" : query.toLowerCase().trim();
        List<ClassificationRules.FinishedProductRule> detected = new ArrayList<>();
        for (CompiledRule compiled : rulesByLength) {
            if (compiled.pattern().matcher(normalized).find()) {
                detected.add(compiled.rule());
            }
        }
        return detected;
    }

    /**
     * Adjusts similarity (clamped to [0, 1]) and score by the same delta, then re-sorts by score.
     */
    public List<Candidate> rerank(String query, TermAnalysis analysis, List<Candidate> candidates) {
        List<ClassificationRules.FinishedProductRule> detected = detectFinishedProducts(query);
        Optional<ClassificationRules.FinishedProductRule> primary = detected.stream()
                .max(Comparator.comparingInt(ClassificationRules.FinishedProductRule::priority));
        Set<String> penalizedHeadings = rawMaterialHeadingsFor(query, analysis, !detected.isEmpty());

        if (primary.isEmpty() && penalizedHeadings.isEmpty()) {
            return candidates;
        }

        List<Candidate> adjusted = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            double similarity = candidate.similarity();
            if (primary.isPresent()) {
                ClassificationRules.FinishedProductRule rule = primary.get();
                double multiplier = rule.priority() / 10.0;
                if (rule.targetChapters().contains(candidate.chapter())) {
                    similarity += weights.getBoostAmount() * multiplier;
                }
                if (rule.penalizeChapters().contains(candidate.chapter())) {
                    similarity -= weights.getPenaltyAmount() * multiplier;
                }
            }
            if (penalizedHeadings.contains(candidate.heading())) {
                similarity -= weights.getMaterialPenalty();
            }
            similarity = Math.max(0, Math.min(1, similarity));
            double delta = similarity - candidate.similarity();
            adjusted.add(delta == 0 ? candidate
                    : candidate.withScoreAndSimilarity(candidate.score() + delta * semanticScale, similarity));
        }
        adjusted.sort(Comparator.comparingDouble(Candidate::score).reversed());

        primary.ifPresent(rule -> logger.debug("Reranked {} candidates for '{}' using finished-product keyword '{}'",
                adjusted.size(), query, rule.keyword()));
        return adjusted;
    }

    /**
     * Raw-material headings for materials named in a query that also names a product.
     */
    private Set<String> rawMaterialHeadingsFor(String query, TermAnalysis analysis, boolean finishedProduct) {
        boolean product = finishedProduct || (analysis != null && analysis.hasProduct());
        if (!product) {
            return Set.of();
        }
        String normalized = query == null ? "" : query.toLowerCase();
        Set<String> headings = new HashSet<>();
        for (Map.Entry<String, List<String>> entry : rawMaterialHeadings.entrySet()) {
            if (KeywordPatterns.matches(normalized, entry.getKey())) {
                headings.addAll(entry.getValue());
            }
        }
        return headings;
    }

    private record CompiledRule(ClassificationRules.FinishedProductRule rule, Pattern pattern) {
    }
}
