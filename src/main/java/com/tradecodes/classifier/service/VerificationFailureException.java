package com.tradecodes.classifier.service;

public class VerificationFailureException extends RuntimeException {
    /**
     * Creates an exception for a completion response that could not be used.
     */
    public VerificationFailureException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public VerificationFailureException(String m, Throwable c) { super(m, c); }
}
