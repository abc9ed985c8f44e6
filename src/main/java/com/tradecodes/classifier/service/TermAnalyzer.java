package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.model.TermAnalysis;
import com.tradecodes.classifier.model.TermCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a query into product, variety, processing, material, packaging and descriptive terms.
 * Pure and deterministic: the same query always yields the same analysis.
 */
@Service
public class TermAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TermAnalyzer.class);
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern NON_TOKEN = Pattern.compile("[^a-z0-9-]");

    private final ClassificationRules.TermDictionary dictionary;
    private final List<CompiledCompound> compounds;
    private final Pattern measurementPattern;
    private final Pattern colorPattern;

    public TermAnalyzer(ClassificationRules rules) {
        this.dictionary = rules.termDictionary();
        this.compounds = dictionary.compoundTerms().stream()
                .sorted(Comparator.comparingInt(ClassificationRules.CompoundTerm::priority).reversed())
                .map(term -> new CompiledCompound(term.phrase().toLowerCase(),
                        TermCategory.fromLabel(term.category()),
                        Pattern.compile("\\b" + Pattern.quote(term.phrase().toLowerCase()) + "\\b")))
                .toList();
        this.measurementPattern = Pattern.compile(dictionary.measurementPattern(), Pattern.CASE_INSENSITIVE);
        this.colorPattern = Pattern.compile(dictionary.colorPattern(), Pattern.CASE_INSENSITIVE);
    }

    public TermAnalysis analyze(String query) {
        String original = query == null ? "" : query;
        String working = original.toLowerCase().trim();
        Map<TermCategory, Set<String>> found = new EnumMap<>(TermCategory.class);
        for (TermCategory category : TermCategory.values()) {
            found.put(category, new LinkedHashSet<>());
        }

        for (CompiledCompound compound : compounds) {
            Matcher matcher = compound.pattern().matcher(working);
            if (matcher.find()) {
                found.get(compound.category()).add(compound.phrase());
                working = matcher.replaceAll(" ");
            }
        }

        working = extract(measurementPattern, working, found.get(TermCategory.PACKAGING));
        working = extract(colorPattern, working, found.get(TermCategory.DESCRIPTIVE));

        for (String raw : working.split("\\s+")) {
            String token = NON_TOKEN.matcher(raw).replaceAll("");
            if (token.length() <= 1 || dictionary.stopWords().contains(token)) {
                continue;
            }
            found.get(categorize(token)).add(token);
        }

        int totalWords = countWords(original);
        int unknown = found.get(TermCategory.UNKNOWN).size();
        double confidence = totalWords == 0 ? 0.0 : Math.max(0.0, Math.min(1.0, (totalWords - unknown) / (double) totalWords));

        Map<TermCategory, List<String>> terms = new EnumMap<>(TermCategory.class);
        found.forEach((category, values) -> terms.put(category, List.copyOf(values)));

        String primaryQuery = join(terms, TermCategory.VARIETY, TermCategory.PRODUCT, TermCategory.PROCESSING);
        String withoutPackaging = join(terms, TermCategory.VARIETY, TermCategory.PRODUCT, TermCategory.PROCESSING,
                TermCategory.MATERIAL, TermCategory.DESCRIPTIVE, TermCategory.UNKNOWN);

        TermAnalysis analysis = new TermAnalysis(original, terms, primaryQuery, withoutPackaging, confidence);
        logger.debug("Term analysis for '{}': primary='{}', withoutPackaging='{}', confidence={}",
                original, primaryQuery, withoutPackaging, String.format("%.2f", confidence));
        return analysis;
    }

    private TermCategory categorize(String token) {
        if (dictionary.productTerms().contains(token)) {
            return TermCategory.PRODUCT;
        }
        if (dictionary.varietyTerms().contains(token)) {
            return TermCategory.VARIETY;
        }
        if (dictionary.processingTerms().contains(token)) {
            return TermCategory.PROCESSING;
        }
        if (dictionary.materialTerms().contains(token)) {
            return TermCategory.MATERIAL;
        }
        if (dictionary.packagingTerms().contains(token)) {
            return TermCategory.PACKAGING;
        }
        if (dictionary.descriptiveTerms().contains(token)) {
            return TermCategory.DESCRIPTIVE;
        }
        if (NUMBER.matcher(token).matches()) {
            return TermCategory.PACKAGING;
        }
        return TermCategory.UNKNOWN;
    }

    private String extract(Pattern pattern, String text, Set<String> sink) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder remaining = new StringBuilder();
        while (matcher.find()) {
            sink.add(matcher.group().trim().toLowerCase());
            matcher.appendReplacement(remaining, " ");
        }
        matcher.appendTail(remaining);
        return remaining.toString();
    }

    private int countWords(String text) {
        int count = 0;
        for (String raw : text.toLowerCase().trim().split("\\s+")) {
            String token = NON_TOKEN.matcher(raw).replaceAll("");
            if (token.length() > 1 && !dictionary.stopWords().contains(token)) {
                count++;
            }
        }
        return count;
    }

    private static String join(Map<TermCategory, List<String>> terms, TermCategory... categories) {
        List<String> parts = new ArrayList<>();
        for (TermCategory category : categories) {
            parts.addAll(terms.get(category));
        }
        return String.join(" ", parts).trim();
    }

    private record CompiledCompound(String phrase, TermCategory category, Pattern pattern) {
    }
}
