package com.ai.tutor.exception;

/**
 * A vector about to be written does not have the configured embedding dimension,
 * which happens when chunks from different models would be mixed in one store.
 */
public class EmbeddingDimensionException extends IllegalStateException {

    private final int expected;
    private final int actual;

    public EmbeddingDimensionException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
