package io.admissionpolicy.core.error;

import io.admissionpolicy.core.validation.Violation;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a parsed policy fails structural validation. Carries every violation found, in
 * reporting order; the message joins their messages with {@code "; "}.
 */
public final class PolicyValidationException extends PolicyException {

    private static final long serialVersionUID = 1L;

    private final transient List<Violation> violations;
    private final String source;

    public PolicyValidationException(List<Violation> violations, String policyName, String source) {
        super(joinMessages(violations), policyName, Phase.VALIDATION);
        this.violations = List.copyOf(violations);
        this.source = source;
    }

    public List<Violation> violations() {
        return violations;
    }

    /** The file path or resource identifier of the rejected policy, or {@code null}. */
    public String source() {
        return source;
    }

    private static String joinMessages(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations must not be empty");
        }
        return violations.stream().map(Violation::message).collect(Collectors.joining("; "));
    }
}
