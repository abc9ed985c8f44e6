package com.tradecodes.classifier.model;

/**
 * Retrieval channel a candidate came from.
 */
public enum CandidateSource {
    LEXICAL,
    SEMANTIC,
    COMBINED
}
