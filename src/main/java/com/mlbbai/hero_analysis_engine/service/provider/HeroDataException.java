package com.mlbbai.hero_analysis_engine.service.provider;

/**
 * Failure while acquiring or normalizing hero statistics.
 * Raised inside the refresh path and absorbed by the scheduler as a failed refresh.
 */
public class HeroDataException extends RuntimeException {

    public enum Reason {
        FETCH_TIMEOUT,
        FETCH_NETWORK_ERROR,
        SHAPE_MISMATCH,
        EMPTY_RESULT
    }

    private final Reason reason;

    public HeroDataException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public HeroDataException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
