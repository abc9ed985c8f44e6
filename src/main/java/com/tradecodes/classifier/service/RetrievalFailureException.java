package com.tradecodes.classifier.service;

public class RetrievalFailureException extends RuntimeException {
    /**
     * Creates an exception describing a failed embedding or search call.
     */
    public RetrievalFailureException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public RetrievalFailureException(String m, Throwable c) { super(m, c); }
}
