package com.tradecodes.classifier.model;

public enum TermCategory {
    PRODUCT,
    VARIETY,
    PROCESSING,
    MATERIAL,
    PACKAGING,
    DESCRIPTIVE,
    UNKNOWN;

    public static TermCategory fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        for (TermCategory category : values()) {
            if (category.name().equalsIgnoreCase(label.trim())) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
