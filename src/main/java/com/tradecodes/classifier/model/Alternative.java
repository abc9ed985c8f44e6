package com.tradecodes.classifier.model;

public record Alternative(String code, String description, int confidence) {
}
