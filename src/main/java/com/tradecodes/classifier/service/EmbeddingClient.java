package com.tradecodes.classifier.service;

/**
 * Turns text into a fixed-length vector.
 */
public interface EmbeddingClient {

    /**
     * @throws RetrievalFailureException when the embedding cannot be produced
     */
    float[] embed(String text);
}
