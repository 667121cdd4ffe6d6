package com.ai.tutor.exception;

/**
 * The generative engine could not be reached, timed out or answered with a
 * non-success status. On the interactive path this surfaces to the caller as
 * a retryable error; background jobs log it and move on.
 */
public class GenerativeEngineException extends RuntimeException {

    private final String provider;

    public GenerativeEngineException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public GenerativeEngineException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
