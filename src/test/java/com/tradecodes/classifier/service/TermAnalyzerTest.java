package com.tradecodes.classifier.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecodes.classifier.config.ClassificationRulesConfig;
import com.tradecodes.classifier.model.TermAnalysis;
import com.tradecodes.classifier.model.TermCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TermAnalyzerTest {

    private TermAnalyzer termAnalyzer;

    @BeforeEach
    void setUp() {
        termAnalyzer = new TermAnalyzer(ClassificationRulesConfig.load(new ObjectMapper()));
    }

    @Test
    void compoundPhraseIsMatchedBeforeSingleWords() {
        TermAnalysis analysis = termAnalyzer.analyze("arabica coffee beans 1kg bag");

        assertThat(analysis.termsOf(TermCategory.PRODUCT)).containsExactly("coffee beans");
        assertThat(analysis.termsOf(TermCategory.VARIETY)).containsExactly("arabica");
        assertThat(analysis.termsOf(TermCategory.PACKAGING)).containsExactlyInAnyOrder("1kg", "bag");
        assertThat(analysis.primaryQuery()).isEqualTo("arabica coffee beans");
        assertThat(analysis.fullQueryWithoutPackaging()).isEqualTo("arabica coffee beans");
        assertThat(analysis.confidence()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void colorsAreDescriptiveAndKeptOutOfPrimaryQuery() {
        TermAnalysis analysis = termAnalyzer.analyze("roasted coffee in red bag");

        assertThat(analysis.termsOf(TermCategory.DESCRIPTIVE)).containsExactly("red");
        assertThat(analysis.termsOf(TermCategory.PACKAGING)).containsExactly("bag");
        assertThat(analysis.primaryQuery()).isEqualTo("coffee roasted");
        assertThat(analysis.fullQueryWithoutPackaging()).isEqualTo("coffee roasted red");
        assertThat(analysis.hasPackaging()).isTrue();
    }

    @Test
    void unknownWordsLowerConfidenceButStayInSearchText() {
        TermAnalysis analysis = termAnalyzer.analyze("gizmo widget");

        assertThat(analysis.termsOf(TermCategory.UNKNOWN)).containsExactly("gizmo", "widget");
        assertThat(analysis.confidence()).isZero();
        assertThat(analysis.fullQueryWithoutPackaging()).isEqualTo("gizmo widget");
        assertThat(analysis.primaryQuery()).isEmpty();
    }

    @Test
    void analysisIsDeterministic() {
        String query = "premium cotton shirts for men 2 pcs";

        assertThat(termAnalyzer.analyze(query)).isEqualTo(termAnalyzer.analyze(query));
    }

    @Test
    void blankQueryYieldsEmptyAnalysis() {
        TermAnalysis analysis = termAnalyzer.analyze("   ");

        assertThat(analysis.primaryQuery()).isEmpty();
        assertThat(analysis.confidence()).isZero();
    }
}
