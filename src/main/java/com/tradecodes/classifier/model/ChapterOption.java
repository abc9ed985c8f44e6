package com.tradecodes.classifier.model;

public record ChapterOption(String label, String chapter) {
}
