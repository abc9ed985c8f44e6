package com.tradecodes.classifier.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationContextTest {

    @Test
    void answersExtendTheSearchQuery() {
        ConversationContext context = new ConversationContext("conv-1", "  hex bolts ");
        context.replacePendingQuestions(List.of(SmartQuestion.hierarchy("chapter_1", "Which category?", List.of())));

        context.recordAnswer(new AnsweredQuestion("chapter_1", "zinc plated", "zinc plated", false));
        context.recordAnswer(new AnsweredQuestion("heading_1", "7318", "zinc plated", true));

        assertThat(context.searchQuery()).isEqualTo("hex bolts zinc plated");
        assertThat(context.getPendingQuestions()).isEmpty();
        assertThat(context.isAnswered("chapter_1")).isTrue();
        assertThat(context.isAnswered("heading_2")).isFalse();
    }

    @Test
    void codeFiltersMatchOnDigitPrefixes() {
        ConversationContext context = new ConversationContext("conv-1", "coffee");
        assertThat(context.matchesFilters("2101.11.10")).isTrue();

        context.narrowTo(Set.of("0901", "21"));

        assertThat(context.matchesFilters("0901.21.10")).isTrue();
        assertThat(context.matchesFilters("2101.11.10")).isTrue();
        assertThat(context.matchesFilters("0902.10.00")).isFalse();
    }

    @Test
    void emptyNarrowingKeepsExistingFilters() {
        ConversationContext context = new ConversationContext("conv-1", "coffee");
        context.narrowTo(Set.of("09"));

        context.narrowTo(Set.of());

        assertThat(context.getCodeFilters()).containsExactly("09");
    }
}
