package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassificationRules;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.Differential;
import com.tradecodes.classifier.model.DifferentialOption;
import com.tradecodes.classifier.model.DifferentialType;
import com.tradecodes.classifier.model.DistinctionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the attributes that actually separate a shortlist of codes, reading them from the
 * code descriptions: price tiers, numeric specifications, category terms, varieties, sibling codes
 * and free discriminating terms.
 */
@Service
public class DifferentialAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DifferentialAnalyzer.class);

    private static final Pattern WORD_SPLIT = Pattern.compile("[\\s,;:\\-()]+");
    private static final Pattern LEAF_CODE = Pattern.compile("^\\d{4}\\.\\d{2}\\.\\d{2}$");

    private static final List<PricePattern> PRICE_PATTERNS = List.of(
            new PricePattern(Pattern.compile("not exceeding (?:rs\\.?|rupees?)\\s*(\\d{1,18})(?!\\d)", Pattern.CASE_INSENSITIVE), "max_price"),
            new PricePattern(Pattern.compile("exceeding (?:rs\\.?|rupees?)\\s*(\\d{1,18})(?!\\d)", Pattern.CASE_INSENSITIVE), "min_price"),
            new PricePattern(Pattern.compile("(?:rs\\.?|rupees?)\\s*(\\d{1,18})(?!\\d)\\s*(?:or less|and below)", Pattern.CASE_INSENSITIVE), "max_price"),
            new PricePattern(Pattern.compile("above (?:rs\\.?|rupees?)\\s*(\\d{1,18})(?!\\d)", Pattern.CASE_INSENSITIVE), "min_price"),
            new PricePattern(Pattern.compile("retail (?:sale )?price", Pattern.CASE_INSENSITIVE), "retail_price"));

    private static final List<SpecPattern> SPEC_PATTERNS = List.of(
            new SpecPattern(Pattern.compile("(\\d+)\\s*(?:W|watt|watts)\\b", Pattern.CASE_INSENSITIVE), "W", "wattage"),
            new SpecPattern(Pattern.compile("(\\d+)\\s*(?:V|volt|volts)\\b", Pattern.CASE_INSENSITIVE), "V", "voltage"),
            new SpecPattern(Pattern.compile("(\\d+)\\s*(?:cc|ml|litre|liter|L)\\b", Pattern.CASE_INSENSITIVE), "capacity", "capacity"),
            new SpecPattern(Pattern.compile("(\\d+)\\s*(?:kg|g|gram|grams|ton|tonnes?)\\b", Pattern.CASE_INSENSITIVE), "weight", "weight"),
            new SpecPattern(Pattern.compile("(\\d+)\\s*(?:mm|cm|m|inch|inches)\\b", Pattern.CASE_INSENSITIVE), "dimension", "dimension"),
            new SpecPattern(Pattern.compile("(\\d+)\\s*(?:kW|HP|hp|horsepower)\\b", Pattern.CASE_INSENSITIVE), "power", "power"));

    /** Category detectors in the order they run, with their question text. */
    private static final Map<String, String> CATEGORY_QUESTIONS = orderedMap(
            "material", "What material is the product made of?",
            "form", "What is the form or state of the product?",
            "processing", "What is the processing level?",
            "use", "What is the intended use or purpose?",
            "gender", "Who is the target user?",
            "packaging", "What type of packaging?",
            "grade", "What is the quality grade?");

    private static final Map<String, String> GROUP_NAMES = orderedMap(
            "material", "Material",
            "form", "Form/State",
            "processing", "Processing",
            "use", "Use/Purpose",
            "gender", "Target User",
            "packaging", "Packaging",
            "grade", "Grade/Quality");

    private final Map<String, Set<String>> categoryTerms;
    private final Set<String> varieties;
    private final Set<String> stopwords;
    private final Map<String, String> siblingFeatureNames;

    public DifferentialAnalyzer(ClassificationRules rules) {
        ClassificationRules.DifferentialTerms terms = rules.differentialTerms();
        this.categoryTerms = terms.categories();
        this.varieties = terms.varieties();
        this.stopwords = terms.stopwords();
        this.siblingFeatureNames = terms.siblingFeatureNames() == null ? Map.of() : terms.siblingFeatureNames();
    }

    /**
     * Differentials separating the candidates, most important first. Fewer than two candidates yield none.
     *
     * @param candidates         shortlisted codes
     * @param productDescription the user's description, used to drop already-answered attributes
     */
    public List<Differential> analyze(List<Candidate> candidates, String productDescription) {
        if (candidates == null || candidates.size() < 2) {
            return List.of();
        }
        String description = productDescription == null ? "" : productDescription.toLowerCase(Locale.ROOT);

        List<Differential> found = new ArrayList<>();
        found.addAll(detectPrice(candidates));
        found.addAll(detectSpecification(candidates));
        for (Map.Entry<String, String> category : CATEGORY_QUESTIONS.entrySet()) {
            found.addAll(detectCategory(candidates, category.getKey(), category.getValue()));
        }
        found.addAll(detectVariety(candidates));
        found.addAll(detectSiblings(candidates, description));
        found.addAll(detectTerms(candidates));

        List<Differential> sound = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (Differential differential : found) {
            Differential checked = enforceSoundness(differential);
            if (checked == null) {
                continue;
            }
            String id = checked.id();
            for (int n = 2; !ids.add(id); n++) {
                id = checked.id() + "_" + n;
            }
            sound.add(id.equals(checked.id()) ? checked : new Differential(id, checked.feature(), checked.type(),
                    checked.distinctionType(), checked.options(), checked.importance(), checked.affectedCodes(),
                    checked.questionText()));
        }
        sound.sort(Comparator.comparingInt(Differential::importance).reversed());

        List<Differential> result = filterAlreadyCovered(sound, description);
        logger.info("Differential analysis: {} differentials from {} candidates", result.size(), candidates.size());
        return result;
    }

    /**
     * Drops options repeating an earlier option's code set and empty options; rejects the differential
     * when fewer than two options or two codes remain.
     */
    static Differential enforceSoundness(Differential differential) {
        List<DifferentialOption> kept = new ArrayList<>();
        Set<Set<String>> seenCodeSets = new HashSet<>();
        for (DifferentialOption option : differential.options()) {
            Set<String> codes = new HashSet<>(option.matchingCodes());
            if (codes.isEmpty() || !seenCodeSets.add(codes)) {
                continue;
            }
            kept.add(option);
        }
        if (kept.size() < 2) {
            return null;
        }
        Differential rebuilt = differential.withOptions(kept);
        return rebuilt.affectedCodes().size() < 2 ? null : rebuilt;
    }

    /**
     * Removes differentials where exactly one option is already named in the description.
     */
    List<Differential> filterAlreadyCovered(List<Differential> differentials, String description) {
        List<Differential> kept = new ArrayList<>();
        for (Differential differential : differentials) {
            List<DifferentialOption> covered = differential.options().stream()
                    .filter(o -> description.contains(o.value().toLowerCase(Locale.ROOT)))
                    .toList();
            if (covered.size() == 1) {
                logger.debug("Differential '{}' already covered by description ({})",
                        differential.feature(), covered.get(0).value());
                continue;
            }
            kept.add(differential);
        }
        return kept;
    }

    private List<Differential> detectPrice(List<Candidate> candidates) {
        Map<String, PriceGroup> groups = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            String desc = candidate.description().toLowerCase(Locale.ROOT);
            for (PricePattern price : PRICE_PATTERNS) {
                Matcher m = price.pattern().matcher(desc);
                if (m.find()) {
                    long threshold = m.groupCount() >= 1 && m.group(1) != null ? Long.parseLong(m.group(1)) : 0;
                    groups.computeIfAbsent(price.type() + "_" + threshold, k -> new PriceGroup(price.type(), threshold))
                            .codes().add(candidate.code());
                    // "not exceeding Rs 20" must not also count as "exceeding Rs 20"
                    break;
                }
            }
        }
        if (groups.isEmpty()) {
            return List.of();
        }
        List<DifferentialOption> options = new ArrayList<>();
        Set<String> priced = new HashSet<>();
        for (Map.Entry<String, PriceGroup> entry : groups.entrySet()) {
            PriceGroup group = entry.getValue();
            options.add(new DifferentialOption(entry.getKey(), group.displayText(), List.copyOf(group.codes())));
            priced.addAll(group.codes());
        }
        List<String> unpriced = candidates.stream().map(Candidate::code).filter(c -> !priced.contains(c)).toList();
        if (!unpriced.isEmpty()) {
            options.add(new DifferentialOption("other_price", "Other/Standard price", unpriced));
        }
        if (options.size() < 2) {
            return List.of();
        }
        Differential differential = Differential.of("price", "Price Category", DifferentialType.PRICE, options, 0,
                "What is the retail price per unit?");
        return List.of(withImportance(differential, differential.affectedCodes().size()));
    }

    private List<Differential> detectSpecification(List<Candidate> candidates) {
        List<Differential> differentials = new ArrayList<>();
        for (SpecPattern spec : SPEC_PATTERNS) {
            Map<String, List<String>> groups = new LinkedHashMap<>();
            for (Candidate candidate : candidates) {
                Matcher m = spec.pattern().matcher(candidate.description());
                if (m.find()) {
                    groups.computeIfAbsent(m.group(1) + spec.unit(), k -> new ArrayList<>()).add(candidate.code());
                }
            }
            if (groups.size() < 2) {
                continue;
            }
            List<DifferentialOption> options = new ArrayList<>();
            groups.forEach((value, codes) -> options.add(new DifferentialOption(value, value, codes)));
            Differential differential = Differential.of("spec_" + spec.type(), capitalize(spec.type()) + " Specification",
                    DifferentialType.SPECIFICATION, DistinctionType.NUMERIC, options, 0,
                    "What is the " + spec.type() + " specification?");
            differentials.add(withImportance(differential, differential.affectedCodes().size()));
        }
        return differentials;
    }

    private List<Differential> detectCategory(List<Candidate> candidates, String category, String question) {
        Set<String> terms = categoryTerms.getOrDefault(category, Set.of());
        if (terms.isEmpty()) {
            return List.of();
        }
        Map<String, Set<String>> groups = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            String desc = candidate.description().toLowerCase(Locale.ROOT);
            for (String word : WORD_SPLIT.split(desc)) {
                String clean = word.replaceAll("[^a-z]", "");
                if (terms.contains(clean) || terms.contains(word)) {
                    String term = clean.isEmpty() ? word : clean;
                    groups.computeIfAbsent(term, k -> new LinkedHashSet<>()).add(candidate.code());
                }
            }
            for (String term : terms) {
                if (term.contains(" ") && desc.contains(term)) {
                    groups.computeIfAbsent(term, k -> new LinkedHashSet<>()).add(candidate.code());
                }
            }
        }
        if (groups.size() < 2) {
            return List.of();
        }
        List<DifferentialOption> options = new ArrayList<>();
        groups.forEach((term, codes) -> options.add(new DifferentialOption(term, capitalize(term), List.copyOf(codes))));
        Differential differential = Differential.of(category, capitalize(category),
                DifferentialType.valueOf(category.toUpperCase(Locale.ROOT)), options, 0, question);
        return List.of(withImportance(differential, differential.affectedCodes().size()));
    }

    private List<Differential> detectVariety(List<Candidate> candidates) {
        Map<String, Set<String>> groups = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            for (String word : WORD_SPLIT.split(candidate.description().toLowerCase(Locale.ROOT))) {
                String clean = word.replaceAll("[^a-z]", "");
                if (varieties.contains(clean)) {
                    groups.computeIfAbsent(clean, k -> new LinkedHashSet<>()).add(candidate.code());
                }
            }
        }
        if (groups.size() < 2) {
            return List.of();
        }
        List<DifferentialOption> options = new ArrayList<>();
        groups.forEach((variety, codes) -> options.add(new DifferentialOption(variety, capitalize(variety), List.copyOf(codes))));
        Differential differential = Differential.of("variety", "Variety/Cultivar", DifferentialType.SPECIES,
                DistinctionType.MULTI, options, 0, "What is the specific variety or cultivar?");
        return List.of(withImportance(differential, differential.affectedCodes().size() * 2));
    }

    /**
     * Tariff lines under one subheading whose descriptions are themselves the distinguishing labels,
     * e.g. named mango varieties under 0804.50.
     */
    private List<Differential> detectSiblings(List<Candidate> candidates, String description) {
        Map<String, List<Candidate>> byParent = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            if (LEAF_CODE.matcher(candidate.code()).matches()) {
                byParent.computeIfAbsent(candidate.code().substring(0, 7), k -> new ArrayList<>()).add(candidate);
            }
        }
        List<String> productWords = Arrays.stream(description.split("\\s+")).filter(w -> w.length() > 2).toList();

        List<Differential> differentials = new ArrayList<>();
        for (Map.Entry<String, List<Candidate>> entry : byParent.entrySet()) {
            List<Candidate> siblings = entry.getValue();
            if (siblings.size() < 2) {
                continue;
            }
            String siblingText = String.join(" ", siblings.stream().map(s -> s.description().toLowerCase(Locale.ROOT)).toList());
            boolean relevant = productWords.stream().anyMatch(siblingText::contains)
                    || Arrays.stream(description.split("\\s+")).anyMatch(w -> w.length() > 3 && siblingText.contains(w));
            if (!relevant) {
                logger.debug("Skipping sibling group {}: not related to '{}'", entry.getKey(), description);
                continue;
            }
            double avgLength = siblings.stream().mapToInt(s -> s.description().length()).average().orElse(0);
            if (avgLength > 80 && siblings.stream().noneMatch(DifferentialAnalyzer::isResidualCode)) {
                continue;
            }
            List<Candidate> kept = siblings.stream().filter(s -> isRelevantSibling(s, description, productWords)).toList();
            if (kept.size() < 2) {
                continue;
            }
            List<DifferentialOption> options = new ArrayList<>();
            for (Candidate sibling : kept) {
                String display = sibling.description();
                int marker = display.lastIndexOf("---");
                if (marker != -1) {
                    display = display.substring(marker + 3).trim();
                }
                options.add(new DifferentialOption(
                        sibling.description().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_"),
                        capitalize(display),
                        List.of(sibling.code())));
            }
            String feature = siblingFeatureName(description);
            Differential differential = Differential.of("sibling_" + entry.getKey(), feature, DifferentialType.SPECIES,
                    DistinctionType.MULTI, options, 0, "Which specific " + feature.toLowerCase(Locale.ROOT) + " is this?");
            differentials.add(withImportance(differential, kept.size() * 3));
        }
        return differentials;
    }

    private static boolean isResidualCode(Candidate c) {
        return c.description().equalsIgnoreCase("other")
                || c.code().endsWith(".90") || c.code().endsWith(".29") || c.code().endsWith(".99");
    }

    private static boolean isRelevantSibling(Candidate sibling, String description, List<String> productWords) {
        if (isResidualCode(sibling)) {
            return true;
        }
        String desc = sibling.description().toLowerCase(Locale.ROOT);
        if (desc.length() < 30 && !desc.contains("fresh") && !desc.contains("dried")) {
            return true;
        }
        return productWords.stream().anyMatch(desc::contains)
                || Arrays.stream(desc.split("\\s+")).anyMatch(w -> w.length() > 3 && description.contains(w));
    }

    private String siblingFeatureName(String description) {
        for (Map.Entry<String, String> entry : siblingFeatureNames.entrySet()) {
            if (description.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return "Type/Variety";
    }

    /**
     * Terms present in 10-90% of the candidates (and at least two of them), grouped into sets of
     * terms that cover mostly different codes.
     */
    private List<Differential> detectTerms(List<Candidate> candidates) {
        Map<String, Set<String>> frequency = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            for (String term : significantTerms(candidate.description())) {
                frequency.computeIfAbsent(term, k -> new LinkedHashSet<>()).add(candidate.code());
            }
        }
        List<TermCoverage> discriminating = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : frequency.entrySet()) {
            double coverage = entry.getValue().size() / (double) candidates.size();
            if (coverage >= 0.1 && coverage <= 0.9 && entry.getValue().size() >= 2) {
                discriminating.add(new TermCoverage(entry.getKey(), List.copyOf(entry.getValue()), coverage));
            }
        }
        discriminating.sort(Comparator.comparingDouble(t -> Math.abs(t.coverage() - 0.5)));

        List<Differential> differentials = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (TermCoverage item : discriminating) {
            if (used.contains(item.term())) {
                continue;
            }
            Set<String> itemCodes = new HashSet<>(item.codes());
            List<TermCoverage> complementary = discriminating.stream()
                    .filter(other -> !used.contains(other.term()) && !other.term().equals(item.term()))
                    .filter(other -> {
                        long overlap = other.codes().stream().filter(itemCodes::contains).count();
                        return overlap / (double) Math.min(item.codes().size(), other.codes().size()) < 0.5;
                    })
                    .limit(3)
                    .toList();
            if (complementary.isEmpty()) {
                continue;
            }
            List<TermCoverage> group = new ArrayList<>();
            group.add(item);
            group.addAll(complementary);
            group.forEach(t -> used.add(t.term()));

            String name = groupName(group.stream().map(TermCoverage::term).toList());
            List<DifferentialOption> options = group.stream()
                    .map(t -> new DifferentialOption(t.term(), capitalize(t.term()), t.codes()))
                    .toList();
            Differential differential = Differential.of("term_" + name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_"),
                    name, DifferentialType.TERM, options, 0,
                    "What type of " + name.toLowerCase(Locale.ROOT) + " is this?");
            differentials.add(withImportance(differential, differential.affectedCodes().size()));
        }
        return differentials;
    }

    private List<String> significantTerms(String description) {
        Set<String> terms = new LinkedHashSet<>();
        for (String word : WORD_SPLIT.split(description.toLowerCase(Locale.ROOT))) {
            String clean = word.replaceAll("[^a-z]", "");
            if (clean.length() >= 3 && !stopwords.contains(clean)) {
                terms.add(clean);
            }
        }
        return List.copyOf(terms);
    }

    private String groupName(List<String> terms) {
        for (Map.Entry<String, String> entry : GROUP_NAMES.entrySet()) {
            Set<String> categorySet = categoryTerms.getOrDefault(entry.getKey(), Set.of());
            if (terms.stream().anyMatch(categorySet::contains)) {
                return entry.getValue();
            }
        }
        return terms.isEmpty() ? "Type" : capitalize(terms.get(0));
    }

    private static Differential withImportance(Differential d, int importance) {
        return new Differential(d.id(), d.feature(), d.type(), d.distinctionType(), d.options(), importance,
                d.affectedCodes(), d.questionText());
    }

    private static String capitalize(String s) {
        return s == null || s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static Map<String, String> orderedMap(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private record PricePattern(Pattern pattern, String type) {
    }

    private record SpecPattern(Pattern pattern, String unit, String type) {
    }

    private record TermCoverage(String term, List<String> codes, double coverage) {
    }

    private record PriceGroup(String type, long threshold, Set<String> codes) {

        PriceGroup(String type, long threshold) {
            this(type, threshold, new LinkedHashSet<>());
        }

        String displayText() {
            if ("max_price".equals(type)) {
                return "Rs " + threshold + " or less";
            }
            if ("min_price".equals(type)) {
                return "More than Rs " + threshold;
            }
            return "Sold at retail sale price";
        }
    }
}
