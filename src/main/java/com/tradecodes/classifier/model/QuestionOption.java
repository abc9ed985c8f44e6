package com.tradecodes.classifier.model;

import java.util.List;

/**
 * One selectable answer. {@code code} is what the client sends back; {@code codesIncluded}
 * lists the candidate codes the answer keeps.
 */
public record QuestionOption(String code, String label, String description, List<String> codesIncluded) {

    public QuestionOption {
        codesIncluded = codesIncluded == null ? List.of() : List.copyOf(codesIncluded);
    }
}
