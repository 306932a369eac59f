package org.transitscope.host.fixture;

/**
 * Exception thrown when a host fixture file cannot be read or does not have the expected
 * shape.
 */
public class FixtureLoadException extends Exception {
    public FixtureLoadException(String message) {
        super(message);
    }

    public FixtureLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
