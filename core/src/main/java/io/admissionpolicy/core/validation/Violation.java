package io.admissionpolicy.core.validation;

import java.util.Objects;

/**
 * One structural problem found in a policy.
 *
 * @param kind    violation category
 * @param message human-readable description
 * @param path    slash-delimited location inside a pattern tree (e.g. {@code /spec/containers/}),
 *                or {@code null} when the violation is not about a pattern
 * @param rule    name of the rule the violation belongs to, or {@code null} for policy-level
 *                violations
 */
public record Violation(ViolationKind kind, String message, String path, String rule) {

    public Violation {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Violation of(ViolationKind kind, String message) {
        return new Violation(kind, message, null, null);
    }

    public static Violation at(ViolationKind kind, String path, String message) {
        return new Violation(kind, message, path, null);
    }

    /** Returns a copy attributed to the given rule. */
    public Violation inRule(String ruleName) {
        return new Violation(kind, message, path, ruleName);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (rule != null) {
            sb.append(" [rule=").append(rule).append(']');
        }
        if (path != null) {
            sb.append(" [path=").append(path).append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}
