package com.tradecodes.classifier.service;

/**
 * Raised when Bedrock keeps throttling after the adapter's own backoff is exhausted.
 */
public class ThrottledException extends RuntimeException {

    private final int attempts;

    public ThrottledException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * @return number of calls made before giving up
     */
    public int getAttempts() {
        return attempts;
    }
}
