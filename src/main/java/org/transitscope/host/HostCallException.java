package org.transitscope.host;

/**
 * Wraps a failure raised by the host while executing one of its functions.
 * <p>
 * Never escapes {@link EntityAccessor}; it exists so the accessor can report which
 * function failed with which arguments.
 */
public class HostCallException extends Exception {

    private final String function;

    public HostCallException(String function, Throwable cause) {
        super("Host function '" + function + "' failed: " + cause.getMessage(), cause);
        this.function = function;
    }

    public String getFunction() {
        return function;
    }
}
