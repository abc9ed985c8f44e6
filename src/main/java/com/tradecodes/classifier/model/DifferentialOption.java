package com.tradecodes.classifier.model;

import java.util.List;

public record DifferentialOption(String value, String displayText, List<String> matchingCodes) {

    public DifferentialOption {
        matchingCodes = matchingCodes == null ? List.of() : List.copyOf(matchingCodes);
    }
}
