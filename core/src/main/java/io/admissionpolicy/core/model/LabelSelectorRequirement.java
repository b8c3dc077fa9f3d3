package io.admissionpolicy.core.model;

import java.util.List;

/**
 * One {@code matchExpressions} entry. The operator is kept as written; it is checked when the
 * selector is compiled.
 *
 * @param key      label key
 * @param operator {@code In}, {@code NotIn}, {@code Exists} or {@code DoesNotExist}
 * @param values   operand values
 */
public record LabelSelectorRequirement(String key, String operator, List<String> values) {

    public LabelSelectorRequirement {
        values = values != null ? List.copyOf(values) : List.of();
    }
}
