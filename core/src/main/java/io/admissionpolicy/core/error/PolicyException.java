package io.admissionpolicy.core.error;

/**
 * Abstract base for all policy exceptions. Never thrown directly; use the concrete subclasses.
 */
public abstract class PolicyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        VALIDATION
    }

    private final String policyName;
    private final Phase phase;

    protected PolicyException(String message, String policyName, Phase phase) {
        super(message);
        this.policyName = policyName;
        this.phase = phase;
    }

    protected PolicyException(String message, Throwable cause, String policyName, Phase phase) {
        super(message, cause);
        this.policyName = policyName;
        this.phase = phase;
    }

    /** The policy that triggered the error, or {@code null} if not yet identified. */
    public String policyName() {
        return policyName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
