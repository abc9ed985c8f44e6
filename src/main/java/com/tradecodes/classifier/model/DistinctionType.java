package com.tradecodes.classifier.model;

public enum DistinctionType {
    BINARY,
    MULTI,
    NUMERIC,
    OPEN
}
