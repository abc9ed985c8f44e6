package com.tradecodes.classifier.model;

public enum SpecificityLevel {
    HIGH,
    MEDIUM,
    LOW
}
