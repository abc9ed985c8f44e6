package com.tradecodes.classifier.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An attribute that separates two or more shortlisted codes.
 * <p>
 * {@code affectedCodes} is always the union of the options' matching codes.
 */
public record Differential(String id,
                           String feature,
                           DifferentialType type,
                           DistinctionType distinctionType,
                           List<DifferentialOption> options,
                           int importance,
                           List<String> affectedCodes,
                           String questionText) {

    public Differential {
        options = options == null ? List.of() : List.copyOf(options);
        affectedCodes = affectedCodes == null ? List.of() : List.copyOf(affectedCodes);
    }

    /**
     * Builds a differential whose affected codes are derived from its options.
     */
    public static Differential of(String id,
                                  String feature,
                                  DifferentialType type,
                                  List<DifferentialOption> options,
                                  int importance,
                                  String questionText) {
        DistinctionType distinction = options.size() == 2 ? DistinctionType.BINARY : DistinctionType.MULTI;
        return of(id, feature, type, distinction, options, importance, questionText);
    }

    public static Differential of(String id,
                                  String feature,
                                  DifferentialType type,
                                  DistinctionType distinctionType,
                                  List<DifferentialOption> options,
                                  int importance,
                                  String questionText) {
        Set<String> union = new LinkedHashSet<>();
        options.forEach(option -> union.addAll(option.matchingCodes()));
        return new Differential(id, feature, type, distinctionType, options, importance, List.copyOf(union), questionText);
    }

    public Differential withOptions(List<DifferentialOption> newOptions) {
        DistinctionType distinction = distinctionType == DistinctionType.BINARY || distinctionType == DistinctionType.MULTI
                ? (newOptions.size() == 2 ? DistinctionType.BINARY : DistinctionType.MULTI)
                : distinctionType;
        return of(id, feature, type, distinction, newOptions, importance, questionText);
    }
}
