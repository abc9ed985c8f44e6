package com.tradecodes.classifier.repository;

import com.tradecodes.classifier.model.TariffCode;
import com.tradecodes.classifier.model.VectorMatch;

import java.util.Collection;
import java.util.List;

public interface TariffCodeRepositoryCustom {

    /**
     * Cosine nearest neighbours of the embedding, optionally restricted to two-digit chapters.
     * Rows below {@code minSimilarity} are not returned.
     */
    List<VectorMatch> findNearest(float[] embedding, Collection<String> chapters, double minSimilarity, int limit);

    /**
     * Codes whose description, keywords, common products or synonyms mention any of the terms.
     */
    List<TariffCode> findByTerms(List<String> terms, int limit);

    List<TariffCode> findByDescriptionInChapters(List<String> terms, Collection<String> chapters, int limit);
}
