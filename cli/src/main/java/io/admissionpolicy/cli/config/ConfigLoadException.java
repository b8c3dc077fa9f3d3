package io.admissionpolicy.cli.config;

/**
 * Thrown when the validator configuration cannot be loaded: missing file,
 * invalid YAML, or an out-of-range setting. The message is printed as is.
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
