package com.tradecodes.classifier.service;

import com.tradecodes.classifier.model.VectorMatch;

import java.util.Collection;
import java.util.List;

/**
 * Nearest-neighbour lookup over stored code description embeddings.
 */
public interface VectorSearchStore {

    /**
     * @param vector       query embedding
     * @param chapterScope chapters to search in, empty for a global search
     * @param limit        maximum rows
     * @return matches ordered by descending similarity
     * @throws RetrievalFailureException when the store cannot be queried
     */
    List<VectorMatch> search(float[] vector, Collection<String> chapterScope, int limit);
}
