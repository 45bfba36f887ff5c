package io.eventmatch.core.config;

/**
 * Thrown when evaluator options cannot be loaded: missing file, invalid YAML, or an invalid
 * value. The message names the offending file or key.
 */
public class OptionsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OptionsLoadException(String message) {
        super(message);
    }

    public OptionsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
