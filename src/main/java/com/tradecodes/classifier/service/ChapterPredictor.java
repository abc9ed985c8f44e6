package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.AmbiguityCheck;
import com.tradecodes.classifier.model.ChapterOption;
import com.tradecodes.classifier.model.ChapterPrediction;
import com.tradecodes.classifier.model.ChapterPredictionResult;
import com.tradecodes.classifier.model.FunctionalOverride;
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
import java.util.regex.Pattern;

/**
 * Maps query keywords to top-level chapters.
 * <p>
 * Functional overrides run first and short-circuit everything else. Without an override the
 * predictor checks ambiguous terms and scores every chapter's include and exclude keywords.
 */
@Service
public class ChapterPredictor {

    private static final Logger logger = LoggerFactory.getLogger(ChapterPredictor.class);

    private final ClassificationRules.ChapterRules chapterRules;
    private final ClassifierProperties.Chapter weights;
    private final Map<String, ClassificationRules.ChapterRule> chaptersByCode = new LinkedHashMap<>();
    private final Map<String, List<CompiledIndicator>> indicatorsByTerm = new LinkedHashMap<>();

    public ChapterPredictor(ClassificationRules rules, ClassifierProperties properties) {
        this.chapterRules = rules.chapterRules();
        this.weights = properties.getChapter();
        chapterRules.chapters().forEach(rule -> chaptersByCode.put(rule.chapter(), rule));
        for (ClassificationRules.AmbiguousTerm term : chapterRules.ambiguousTerms()) {
            List<CompiledIndicator> compiled = term.indicators().stream()
                    .map(i -> new CompiledIndicator(Pattern.compile(i.pattern(), Pattern.CASE_INSENSITIVE), i.chapter()))
                    .toList();
            indicatorsByTerm.put(term.term(), compiled);
        }
    }

    /**
     * First override rule, in table order, with a keyword present in the query.
     */
    public Optional<FunctionalOverride> checkFunctionalOverrides(String query) {
        String text = normalize(query);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (ClassificationRules.OverrideRule rule : chapterRules.functionalOverrides()) {
            for (String keyword : rule.keywords()) {
                if (KeywordPatterns.matches(text, keyword.toLowerCase())) {
                    return Optional.of(new FunctionalOverride(rule.forceChapter(), keyword, rule.reason()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * One check per ambiguous term present in the query, in table order.
     */
    public List<AmbiguityCheck> checkAmbiguousTerms(String query) {
        String text = normalize(query);
        List<AmbiguityCheck> checks = new ArrayList<>();
        for (ClassificationRules.AmbiguousTerm term : chapterRules.ambiguousTerms()) {
            String word = term.term().toLowerCase();
            if (!KeywordPatterns.matches(text, word)) {
                continue;
            }
            checks.add(resolve(term, word, text));
        }
        return checks;
    }

    private AmbiguityCheck resolve(ClassificationRules.AmbiguousTerm term, String word, String text) {
        for (CompiledIndicator indicator : indicatorsByTerm.getOrDefault(term.term(), List.of())) {
            if (indicator.pattern().matcher(text).find()) {
                return AmbiguityCheck.resolved(term.term(), indicator.chapter());
            }
        }

        Set<String> optionChapters = new LinkedHashSet<>();
        term.options().forEach(option -> optionChapters.add(option.chapter()));
        for (ClassificationRules.ChapterRule chapter : chapterRules.chapters()) {
            for (String keyword : chapter.include()) {
                if (!mentionsTerm(keyword, word) && KeywordPatterns.matchesWithPlural(text, keyword.toLowerCase())) {
                    String resolved = optionChapters.contains(chapter.chapter()) ? chapter.chapter() : null;
                    return AmbiguityCheck.resolved(term.term(), resolved);
                }
            }
            for (String keyword : chapter.exclude()) {
                if (!mentionsTerm(keyword, word) && KeywordPatterns.matchesWithPlural(text, keyword.toLowerCase())) {
                    return AmbiguityCheck.resolved(term.term(), null);
                }
            }
        }

        List<ChapterOption> options = term.options().stream()
                .map(option -> new ChapterOption(option.label(), option.chapter()))
                .toList();
        return AmbiguityCheck.ambiguous(term.term(), term.question(), options);
    }

    private static boolean mentionsTerm(String keyword, String term) {
        return KeywordPatterns.matches(keyword.toLowerCase(), term);
    }

    public ChapterPredictionResult predictChapters(String query) {
        String text = normalize(query);
        if (text.isEmpty()) {
            return ChapterPredictionResult.empty();
        }

        Optional<FunctionalOverride> override = checkFunctionalOverrides(text);
        if (override.isPresent()) {
            FunctionalOverride rule = override.get();
            ChapterPrediction forced = new ChapterPrediction(rule.forceChapter(), chapterName(rule.forceChapter()),
                    weights.getOverrideConfidence(), List.of(rule.matchedKeyword()), rule.reason());
            logger.info("Functional override for '{}': chapter {} ({})", text, rule.forceChapter(), rule.matchedKeyword());
            return new ChapterPredictionResult(List.of(forced), rule, null, false);
        }

        List<AmbiguityCheck> checks = checkAmbiguousTerms(text);
        AmbiguityCheck ambiguity = checks.stream().filter(AmbiguityCheck::ambiguous).findFirst().orElse(null);
        Set<String> resolvedChapters = new LinkedHashSet<>();
        checks.stream()
                .filter(check -> !check.ambiguous() && check.resolvedChapter() != null)
                .forEach(check -> resolvedChapters.add(check.resolvedChapter()));

        List<ScoredChapter> scored = new ArrayList<>();
        for (ClassificationRules.ChapterRule rule : chapterRules.chapters()) {
            ScoredChapter chapter = score(rule, text, resolvedChapters.contains(rule.chapter()));
            if (chapter.score() > 0) {
                scored.add(chapter);
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredChapter::score).reversed()
                .thenComparing(s -> s.rule().chapter()));

        List<ChapterPrediction> predictions = normalizeScores(scored);
        boolean closeCall = predictions.size() >= 2
                && predictions.get(0).confidence() - predictions.get(1).confidence() < weights.getAmbiguityMargin();

        if (!predictions.isEmpty()) {
            logger.info("Chapter predictions for '{}': {}", text,
                    predictions.stream().map(p -> p.chapter() + "=" + String.format("%.2f", p.confidence())).toList());
        }
        if (ambiguity != null) {
            logger.info("Ambiguous term '{}' in query '{}'", ambiguity.term(), text);
        }
        return new ChapterPredictionResult(predictions, null, ambiguity, closeCall);
    }

    private ScoredChapter score(ClassificationRules.ChapterRule rule, String text, boolean resolvedByIndicator) {
        List<String> matched = new ArrayList<>();
        int includes = 0;
        int phrases = 0;
        for (String keyword : rule.include()) {
            String lower = keyword.toLowerCase();
            if (KeywordPatterns.matchesWithPlural(text, lower)) {
                includes++;
                matched.add(keyword);
                if (KeywordPatterns.isPhrase(lower)) {
                    phrases++;
                }
            }
        }
        int excludes = 0;
        for (String keyword : rule.exclude()) {
            if (KeywordPatterns.matchesWithPlural(text, keyword.toLowerCase())) {
                excludes++;
            }
        }
        if (resolvedByIndicator) {
            includes++;
        }
        double priorityFactor = rule.priority() / weights.getPriorityDivisor();
        double score = weights.getIncludeWeight() * includes * priorityFactor
                - weights.getExcludePenalty() * excludes
                + weights.getPhraseBonus() * phrases;
        return new ScoredChapter(rule, score, matched, resolvedByIndicator);
    }

    private List<ChapterPrediction> normalizeScores(List<ScoredChapter> scored) {
        double total = scored.stream().mapToDouble(ScoredChapter::score).sum();
        if (scored.isEmpty() || total <= 0) {
            return List.of();
        }
        double top = scored.get(0).score() / total;
        double rescale = top > weights.getMaxConfidence() ? weights.getMaxConfidence() / top : 1.0;
        List<ChapterPrediction> predictions = new ArrayList<>();
        for (ScoredChapter chapter : scored) {
            if (predictions.size() >= weights.getMaxPredictions()) {
                break;
            }
            double confidence = chapter.score() / total * rescale;
            String reason = chapter.matched().isEmpty()
                    ? "Resolved by disambiguation indicator"
                    : "Matched keywords: " + String.join(", ", chapter.matched())
                    + (chapter.indicator() ? " (disambiguation indicator)" : "");
            predictions.add(new ChapterPrediction(chapter.rule().chapter(), chapter.rule().name(), confidence,
                    chapter.matched(), reason));
        }
        return predictions;
    }

    /**
     * Score adjustment for a candidate code given the prediction for its query.
     */
    public double chapterBoost(String code, ChapterPredictionResult prediction) {
        if (prediction == null || code == null) {
            return 0;
        }
        String digits = code.replaceAll("[^0-9]", "");
        String chapter = digits.length() >= 2 ? digits.substring(0, 2) : digits;
        if (prediction.hasOverride()) {
            return prediction.functionalOverride().forceChapter().equals(chapter)
                    ? weights.getOverrideBoost()
                    : weights.getOverridePenalty();
        }
        List<ChapterPrediction> predictions = prediction.predictions();
        if (predictions.isEmpty()) {
            return 0;
        }
        for (int rank = 0; rank < predictions.size(); rank++) {
            ChapterPrediction p = predictions.get(rank);
            if (p.chapter().equals(chapter)) {
                return Math.max(0, weights.getRankBoostBase() - weights.getRankBoostStep() * rank) * p.confidence();
            }
        }
        return weights.getUnpredictedPenalty();
    }

    public String chapterName(String chapter) {
        ClassificationRules.ChapterRule rule = chaptersByCode.get(chapter);
        return rule != null ? rule.name() : "Chapter " + chapter;
    }

    private static String normalize(String query) {
        return query == null ? "" : query.toLowerCase().trim();
    }

    private record CompiledIndicator(Pattern pattern, String chapter) {
    }

    private record ScoredChapter(ClassificationRules.ChapterRule rule, double score, List<String> matched, boolean indicator) {
    }
}
