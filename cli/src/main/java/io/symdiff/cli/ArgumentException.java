package io.symdiff.cli;

/**
 * Thrown for unusable command lines: unknown or repeated options, missing values, conflicting
 * operations and malformed {@code name=value} bindings. Reported with exit code 2.
 */
public class ArgumentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ArgumentException(String message) {
        super(message);
    }

    public ArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
