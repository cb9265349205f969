package com.example.healthrag;

/**
 * Two vectors of different length were combined, or a vector does not have the configured dimension.
 */
public class DimensionMismatchException extends RetrievalException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("vector dimension mismatch: expected " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() { return expected; }
    public int getActual() { return actual; }
}
