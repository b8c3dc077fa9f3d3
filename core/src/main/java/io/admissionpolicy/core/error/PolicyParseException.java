package io.admissionpolicy.core.error;

/**
 * Thrown when a policy document cannot be read, is not valid YAML/JSON, has fields of the wrong
 * type, or contains unknown keys in a rule block.
 */
public final class PolicyParseException extends PolicyException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public PolicyParseException(String message, String policyName, String source) {
        super(message, policyName, Phase.PARSE);
        this.source = source;
    }

    public PolicyParseException(String message, Throwable cause, String policyName, String source) {
        super(message, cause, policyName, Phase.PARSE);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
