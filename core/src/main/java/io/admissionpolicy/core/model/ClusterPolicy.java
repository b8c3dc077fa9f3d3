package io.admissionpolicy.core.model;

import java.util.List;

/**
 * A parsed cluster policy: an ordered list of admission rules.
 * Immutable, thread-safe: created by {@code PolicyParser} or directly in code.
 *
 * @param name                    {@code metadata.name}
 * @param validationFailureAction {@code enforce} or {@code audit}; descriptive only
 * @param background              whether the policy also applies to existing resources
 * @param rules                   rules in document order
 */
public record ClusterPolicy(String name, String validationFailureAction, boolean background, List<Rule> rules) {

    public static final String DEFAULT_FAILURE_ACTION = "enforce";

    public ClusterPolicy {
        validationFailureAction = validationFailureAction != null ? validationFailureAction : DEFAULT_FAILURE_ACTION;
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    /** Creates a policy with default failure action and background processing enabled. */
    public static ClusterPolicy of(String name, List<Rule> rules) {
        return new ClusterPolicy(name, DEFAULT_FAILURE_ACTION, true, rules);
    }
}
