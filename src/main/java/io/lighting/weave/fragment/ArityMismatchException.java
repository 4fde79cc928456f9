package io.lighting.weave.fragment;

public class ArityMismatchException extends IllegalArgumentException {
    private final int expected;
    private final int actual;

    public ArityMismatchException(String message, int expected, int actual) {
        super(message + ": expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
