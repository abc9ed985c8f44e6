package com.tradecodes.classifier.model;

/**
 * Dialogue category of a question. The order of the hierarchy levels is identity first,
 * then state and use, then the refining categories.
 */
public enum QuestionCategory {
    IDENTITY(1),
    STATE(2),
    USE(2),
    QUALITY(3),
    SPECIFICATION(3),
    PACKAGING(3),
    TARGET(3),
    OTHER(4);

    private final int hierarchyLevel;

    QuestionCategory(int hierarchyLevel) {
        this.hierarchyLevel = hierarchyLevel;
    }

    public int hierarchyLevel() {
        return hierarchyLevel;
    }
}
