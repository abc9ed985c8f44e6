package com.tradecodes.classifier.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
}
