package com.ai.tutor.exception;

/**
 * The embedding model failed to load. Fatal for the process: the failure is
 * remembered and rethrown to every later caller, the load is never retried.
 */
public class EmbeddingModelException extends RuntimeException {

    public EmbeddingModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
