package com.tradecodes.classifier.model;

public enum MatchType {
    EXACT,
    PARTIAL,
    FUZZY,
    SEMANTIC,
    KEYWORD,
    EXACT_SEMANTIC,
    FUZZY_SEMANTIC
}
