package com.tradecodes.classifier.model;

/**
 * Attribute family a differential distinguishes on.
 */
public enum DifferentialType {
    PRICE,
    SPECIFICATION,
    MATERIAL,
    FORM,
    PROCESSING,
    USE,
    GENDER,
    PACKAGING,
    GRADE,
    SPECIES,
    TERM
}
