package com.todochat.pipeline.error;

/**
 * How much of an unexpected failure is revealed in a 500 body.
 */
public enum ErrorDetailLevel {

    /** Exception type and message in {@code detail}. For development only. */
    FULL,

    /** Generic message only. */
    MINIMAL;

    /** FULL for "development" (the default when blank), MINIMAL for anything else. */
    public static ErrorDetailLevel forEnvironment(String environment) {
        if (environment == null || environment.isBlank() || "development".equalsIgnoreCase(environment.trim())) {
            return FULL;
        }
        return MINIMAL;
    }
}
