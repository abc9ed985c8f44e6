package com.tradecodes.classifier.model;

public enum QuestionPriority {
    CRITICAL,
    IMPORTANT,
    CLARIFYING,
    OPTIONAL
}
