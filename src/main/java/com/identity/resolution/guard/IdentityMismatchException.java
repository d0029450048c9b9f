package com.identity.resolution.guard;

/**
 * Runtime exception thrown when the process is not running as the required account.
 */
public class IdentityMismatchException extends RuntimeException {

    private final String expected;
    private final String actual;

    public IdentityMismatchException(String expected, String actual) {
        super("Process must run as '" + expected + "' but runs as '" + actual + "'");
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
