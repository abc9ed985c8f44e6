package com.tradecodes.classifier.model;

/**
 * A rule that forces a chapter because of what the product does, whatever it is made of.
 */
public record FunctionalOverride(String forceChapter, String matchedKeyword, String reason) {
}
