package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.VectorMatch;
import com.tradecodes.classifier.repository.TariffCodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * pgvector-backed nearest neighbour search over {@code hs_codes.embedding}.
 */
@Service
public class PgVectorSearchStore implements VectorSearchStore {

    private static final Logger logger = LoggerFactory.getLogger(PgVectorSearchStore.class);

    private final TariffCodeRepository tariffCodeRepository;
    private final double minSimilarity;

    public PgVectorSearchStore(TariffCodeRepository tariffCodeRepository, ClassifierProperties properties) {
        this.tariffCodeRepository = tariffCodeRepository;
        this.minSimilarity = properties.getRetrieval().getVectorMinSimilarity();
    }

    @Override
    @Transactional(readOnly = true)
    public List<VectorMatch> search(float[] vector, Collection<String> chapterScope, int limit) {
        if (vector == null || vector.length == 0) {
            throw new RetrievalFailureException("Empty query vector");
        }
        try {
            List<VectorMatch> matches = tariffCodeRepository.findNearest(vector, chapterScope, minSimilarity, limit);
            logger.debug("Vector search (scope={}) returned {} rows", chapterScope, matches.size());
            return matches;
        } catch (RuntimeException e) {
            throw new RetrievalFailureException("Vector search failed: " + e.getMessage(), e);
        }
    }
}
