package com.tradecodes.classifier.model;

/**
 * Code suggested by the completion service, with its self-reported 0..1 confidence.
 */
public record CompletionVerdict(String code, double confidence, String reasoning) {
}
