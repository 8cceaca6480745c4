package com.loopPhones.exception;

/**
 * Raised by a pluggable predictor that cannot produce a result. The analysis
 * orchestrator catches it and falls back to the heuristic implementation.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
