package io.admissionpolicy.core.selector;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A compiled selector requirement. Values are kept sorted so that equal selectors compile to equal
 * requirements.
 *
 * @param key      label key
 * @param operator set operator
 * @param values   operand values, empty for {@code Exists}/{@code DoesNotExist}
 */
public record Requirement(String key, Operator operator, SortedSet<String> values) {

    public Requirement {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        values = Collections.unmodifiableSortedSet(values != null ? new TreeSet<>(values) : new TreeSet<>());
    }

    @Override
    public String toString() {
        return switch (operator) {
            case IN -> key + " in (" + String.join(",", values) + ")";
            case NOT_IN -> key + " notin (" + String.join(",", values) + ")";
            case EXISTS -> key;
            case DOES_NOT_EXIST -> "!" + key;
        };
    }
}
