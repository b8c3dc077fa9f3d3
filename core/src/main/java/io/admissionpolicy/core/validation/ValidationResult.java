package io.admissionpolicy.core.validation;

import io.admissionpolicy.core.error.PolicyValidationException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating a policy: either valid, or an ordered non-empty list of violations.
 * Immutable, thread-safe.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    private final List<Violation> violations;

    private ValidationResult(List<Violation> violations) {
        this.violations = violations;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    /**
     * Creates a result from the collected violations; an empty list yields {@link #valid()}.
     */
    public static ValidationResult of(List<Violation> violations) {
        Objects.requireNonNull(violations, "violations must not be null");
        return violations.isEmpty() ? VALID : new ValidationResult(List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<Violation> violations() {
        return violations;
    }

    public List<String> messages() {
        return violations.stream().map(Violation::message).collect(Collectors.toList());
    }

    public boolean has(ViolationKind kind) {
        return violations.stream().anyMatch(v -> v.kind() == kind);
    }

    /**
     * Throws {@link PolicyValidationException} if this result has violations.
     *
     * @param policyName policy name for error context
     * @param source     file or resource identifier for error context, may be null
     */
    public void orThrow(String policyName, String source) {
        if (!isValid()) {
            throw new PolicyValidationException(violations, policyName, source);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValidationResult other && violations.equals(other.violations);
    }

    @Override
    public int hashCode() {
        return violations.hashCode();
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[VALID]" : "ValidationResult[INVALID, violations=" + violations + "]";
    }
}
