package io.symdiff.cli.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, an unparseable
 * environment override or a value outside its allowed set. The message is suitable for direct
 * display to the user.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
