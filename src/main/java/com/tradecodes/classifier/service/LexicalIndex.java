package com.tradecodes.classifier.service;

import com.tradecodes.classifier.model.CatalogEntry;

import java.util.Collection;
import java.util.List;

/**
 * Term-based access to the code catalog.
 */
public interface LexicalIndex {

    /**
     * Catalog entries whose indexed terms or description may match any of the terms.
     */
    List<CatalogEntry> lookup(List<String> terms, int limit);

    /**
     * Entries in the given chapters whose description contains one of the terms.
     */
    List<CatalogEntry> searchDescriptions(List<String> terms, Collection<String> chapters, int limit);
}
