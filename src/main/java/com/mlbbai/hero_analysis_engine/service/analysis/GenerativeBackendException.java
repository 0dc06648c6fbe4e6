package com.mlbbai.hero_analysis_engine.service.analysis;

/**
 * Raised when the generative backend fails or returns output that cannot be used:
 * transport errors, timeouts, empty content and unparseable JSON alike.
 * Always absorbed by the analysis service's retry and fallback.
 */
public class GenerativeBackendException extends RuntimeException {

    public GenerativeBackendException(String message) {
        super(message);
    }

    public GenerativeBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
