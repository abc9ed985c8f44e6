package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.SpecificityAnalysis;
import com.tradecodes.classifier.model.SpecificityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores how detailed a product description is. Detailed descriptions relax the
 * confidence and gap thresholds used for direct classification.
 */
@Service
public class InputSpecificityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(InputSpecificityAnalyzer.class);
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");

    private final ClassificationRules.SpecificitySignals signals;
    private final ClassifierProperties.Decision decision;
    private final Pattern unitPattern;
    private final List<Pattern> colorPatterns;

    public InputSpecificityAnalyzer(ClassificationRules rules, ClassifierProperties properties) {
        this.signals = rules.specificitySignals();
        this.decision = properties.getDecision();
        this.unitPattern = Pattern.compile(signals.unitPattern(), Pattern.CASE_INSENSITIVE);
        this.colorPatterns = signals.colorKeywords().stream()
                .map(color -> Pattern.compile("\\b" + Pattern.quote(color) + "\\b"))
                .toList();
    }

    public SpecificityAnalysis analyze(String query) {
        String normalized = query == null ? "" : query.toLowerCase().trim();
        List<String> indicators = new ArrayList<>();
        double score = 0;

        long wordCount = normalized.isEmpty() ? 0 : Arrays.stream(normalized.split("\\s+"))
                .filter(w -> w.length() > 1)
                .count();
        score += Math.min(wordCount * 0.1, 0.4);
        if (wordCount >= 3) {
            indicators.add(wordCount + " words");
        }

        String variety = firstContained(normalized, signals.varietyKeywords());
        if (variety != null) {
            score += 0.25;
            indicators.add("variety: " + variety);
        }

        int processingFound = 0;
        for (String keyword : signals.processingKeywords()) {
            if (normalized.contains(keyword)) {
                processingFound++;
                if (processingFound == 1) {
                    score += 0.15;
                    indicators.add("processing: " + keyword);
                } else {
                    score += 0.05;
                    break;
                }
            }
        }

        String size = firstContained(normalized, signals.sizeKeywords());
        if (size != null) {
            score += 0.1;
            indicators.add("size: " + size);
        }

        Matcher unit = unitPattern.matcher(normalized);
        boolean hasUnit = unit.find();
        if (hasUnit) {
            score += 0.15;
            indicators.add("unit: " + unit.group());
        } else if (NUMBER.matcher(normalized).find()) {
            score += 0.08;
            indicators.add("has numbers");
        }

        for (int i = 0; i < colorPatterns.size(); i++) {
            if (colorPatterns.get(i).matcher(normalized).find()) {
                score += 0.08;
                indicators.add("color: " + signals.colorKeywords().get(i));
                break;
            }
        }

        String material = firstContained(normalized, signals.materialKeywords());
        if (material != null) {
            score += 0.05;
            indicators.add("material: " + material);
        }

        String brand = firstContained(normalized, signals.brandKeywords());
        if (brand != null) {
            score += 0.2;
            indicators.add("brand: " + brand);
        }

        score = Math.min(score, 1.0);
        SpecificityLevel level = score >= 0.5 ? SpecificityLevel.HIGH
                : score >= 0.25 ? SpecificityLevel.MEDIUM
                : SpecificityLevel.LOW;

        double baseGap = decision.getConfidenceGapThreshold();
        double baseConfidence = decision.getHighConfidenceThreshold();
        double adjustedGap = Math.max(0.02, baseGap - score * 0.06);
        double adjustedConfidence = Math.max(0.47, baseConfidence - score * 0.08);

        logger.debug("Specificity for '{}': {} ({}) {}", normalized, String.format("%.2f", score), level, indicators);
        return new SpecificityAnalysis(score, level, indicators, adjustedConfidence, adjustedGap);
    }

    private static String firstContained(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }
}
