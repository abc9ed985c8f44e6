package com.tradecodes.classifier.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecodes.classifier.config.ClassificationRulesConfig;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CandidateSource;
import com.tradecodes.classifier.model.Differential;
import com.tradecodes.classifier.model.DifferentialOption;
import com.tradecodes.classifier.model.DifferentialType;
import com.tradecodes.classifier.model.MatchType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DifferentialAnalyzerTest {

    private DifferentialAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DifferentialAnalyzer(ClassificationRulesConfig.load(new ObjectMapper()));
    }

    @Test
    void siblingVarietiesBecomeOneSpeciesDifferential() {
        List<Candidate> candidates = List.of(
                candidate("0804.50.21", "Mangoes: Alphonso (Hapus)"),
                candidate("0804.50.22", "Mangoes: Banganapalli"),
                candidate("0804.50.23", "Mangoes: Chausa"));

        List<Differential> differentials = analyzer.analyze(candidates, "fresh mango");

        assertThat(differentials).isNotEmpty();
        Differential siblings = differentials.get(0);
        assertThat(siblings.id()).isEqualTo("sibling_0804.50");
        assertThat(siblings.type()).isEqualTo(DifferentialType.SPECIES);
        assertThat(siblings.options()).hasSize(3);
        assertThat(siblings.options()).allSatisfy(option -> assertThat(option.matchingCodes()).hasSize(1));
        assertSound(differentials);
    }

    @Test
    void varietyNamesSharingACodeCollapseIntoOneOption() {
        List<Candidate> candidates = List.of(
                candidate("0804.50.21", "Mangoes: Alphonso (Hapus)"),
                candidate("0804.50.22", "Mangoes: Banganapalli"),
                candidate("0804.50.23", "Mangoes: Chausa"));

        Differential variety = analyzer.analyze(candidates, "fresh mango").stream()
                .filter(d -> d.id().equals("variety"))
                .findFirst()
                .orElseThrow();

        assertThat(variety.options()).extracting(DifferentialOption::value)
                .containsExactly("alphonso", "banganapalli", "chausa");
    }

    @Test
    void attributeAlreadyNamedInDescriptionIsDropped() {
        List<Candidate> candidates = List.of(
                candidate("0804.50.21", "Mangoes: Alphonso (Hapus)"),
                candidate("0804.50.22", "Mangoes: Banganapalli"),
                candidate("0804.50.23", "Mangoes: Chausa"));

        List<Differential> differentials = analyzer.analyze(candidates, "alphonso mango");

        assertThat(differentials).extracting(Differential::id).doesNotContain("variety");
    }

    @Test
    void priceTiersKeepNotExceedingApartFromExceeding() {
        List<Candidate> candidates = List.of(
                candidate("6402.99.10", "Footwear of retail price not exceeding Rs 500 per pair"),
                candidate("6402.99.20", "Footwear of retail price exceeding Rs 500 per pair"),
                candidate("6402.99.90", "Other footwear"));

        List<Differential> differentials = analyzer.analyze(candidates, "rubber slippers");

        Differential price = differentials.stream().filter(d -> d.id().equals("price")).findFirst().orElseThrow();
        assertThat(price.options()).extracting(DifferentialOption::value)
                .containsExactly("max_price_500", "min_price_500", "other_price");
        assertThat(price.options().get(0).matchingCodes()).containsExactly("6402.99.10");
        assertThat(price.options().get(1).matchingCodes()).containsExactly("6402.99.20");
        assertSound(differentials);
    }

    @Test
    void priceThresholdsBeyondIntRangeDoNotBreakAnalysis() {
        List<Candidate> candidates = List.of(
                candidate("7113.19.10", "Jewellery of retail price not exceeding Rs 5000000000 per piece"),
                candidate("7113.19.20", "Jewellery of retail price exceeding Rs 5000000000 per piece"),
                candidate("7113.19.90", "Jewellery of retail price not exceeding Rs 99999999999999999999999 per piece"));

        List<Differential> differentials = analyzer.analyze(candidates, "gold necklace");

        Differential price = differentials.stream().filter(d -> d.id().equals("price")).findFirst().orElseThrow();
        assertThat(price.options()).extracting(DifferentialOption::value)
                .contains("max_price_5000000000", "min_price_5000000000");
        assertThat(price.options()).extracting(DifferentialOption::displayText)
                .contains("Rs 5000000000 or less", "More than Rs 5000000000");
        assertSound(differentials);
    }

    @Test
    void soundnessDropsDuplicateAndEmptyOptions() {
        Differential raw = Differential.of("material", "Material", DifferentialType.MATERIAL, List.of(
                new DifferentialOption("cotton", "Cotton", List.of("6109.10.00")),
                new DifferentialOption("organic cotton", "Organic cotton", List.of("6109.10.00")),
                new DifferentialOption("wool", "Wool", List.of()),
                new DifferentialOption("synthetic", "Synthetic", List.of("6109.90.00"))), 2, "What material?");

        Differential sound = DifferentialAnalyzer.enforceSoundness(raw);

        assertThat(sound).isNotNull();
        assertThat(sound.options()).extracting(DifferentialOption::value).containsExactly("cotton", "synthetic");
        assertThat(sound.affectedCodes()).containsExactlyInAnyOrder("6109.10.00", "6109.90.00");
    }

    @Test
    void differentialWithOneDistinctCodeSetIsRejected() {
        Differential raw = Differential.of("form", "Form", DifferentialType.FORM, List.of(
                new DifferentialOption("fresh", "Fresh", List.of("0804.50.10", "0804.50.20")),
                new DifferentialOption("chilled", "Chilled", List.of("0804.50.20", "0804.50.10"))), 2, "What form?");

        assertThat(DifferentialAnalyzer.enforceSoundness(raw)).isNull();
    }

    @Test
    void fewerThanTwoCandidatesYieldNothing() {
        assertThat(analyzer.analyze(List.of(candidate("0901.11.10", "Arabica plantation")), "coffee")).isEmpty();
    }

    private static void assertSound(List<Differential> differentials) {
        for (Differential differential : differentials) {
            Set<String> union = new LinkedHashSet<>();
            Set<Set<String>> codeSets = new HashSet<>();
            for (DifferentialOption option : differential.options()) {
                union.addAll(option.matchingCodes());
                assertThat(codeSets.add(new HashSet<>(option.matchingCodes())))
                        .as("duplicate code set in %s", differential.id())
                        .isTrue();
            }
            assertThat(new HashSet<>(differential.affectedCodes())).isEqualTo(union);
        }
    }

    private static Candidate candidate(String code, String description) {
        return new Candidate(code, description, 5.0, 0.5, MatchType.SEMANTIC,
                CandidateSource.SEMANTIC, List.of(), List.of(), List.of());
    }
}
