package io.admissionpolicy.core.model;

import io.admissionpolicy.core.tree.Value;
import java.util.List;

/**
 * The {@code validate} block of a rule.
 *
 * @param message    message reported when a resource fails the pattern
 * @param pattern    single pattern tree, {@code null} when absent
 * @param anyPattern alternative pattern trees, empty when absent
 */
public record Validation(String message, Value pattern, List<Value> anyPattern) {

    public Validation {
        anyPattern = anyPattern != null ? List.copyOf(anyPattern) : List.of();
    }

    public static Validation empty() {
        return new Validation(null, null, null);
    }

    public static Validation ofPattern(Value pattern) {
        return new Validation(null, pattern, null);
    }

    public static Validation ofAnyPattern(List<Value> anyPattern) {
        return new Validation(null, null, anyPattern);
    }

    public boolean hasPattern() {
        return pattern != null;
    }

    public boolean hasAnyPattern() {
        return !anyPattern.isEmpty();
    }

    public boolean isSet() {
        return (message != null && !message.isEmpty()) || hasPattern() || hasAnyPattern();
    }
}
