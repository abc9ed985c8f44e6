package com.tradecodes.classifier.model;

import java.util.List;

/**
 * Catalog row as seen by the lexical channel.
 */
public record CatalogEntry(String code,
                           String description,
                           List<String> keywords,
                           List<String> commonProducts,
                           List<String> synonyms) {

    public CatalogEntry {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        commonProducts = commonProducts == null ? List.of() : List.copyOf(commonProducts);
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }
}
