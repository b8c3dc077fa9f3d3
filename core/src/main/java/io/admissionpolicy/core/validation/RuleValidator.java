package io.admissionpolicy.core.validation;

import io.admissionpolicy.core.model.Rule;
import io.admissionpolicy.core.model.Validation;
import java.util.Optional;

/** Rule-level field checks: action type exclusivity and pattern/anyPattern exclusivity. */
public final class RuleValidator {

    private RuleValidator() {}

    /** Exactly one of mutate, validate and generate must be set. */
    public static Optional<Violation> validateRuleType(Rule rule) {
        int defined = 0;
        if (rule.hasMutate()) {
            defined++;
        }
        if (rule.hasValidate()) {
            defined++;
        }
        if (rule.hasGenerate()) {
            defined++;
        }
        if (defined == 0) {
            return Optional.of(
                    Violation.of(ViolationKind.NO_RULE_TYPE_DEFINED, "no rule defined in '" + rule.name() + "'"));
        }
        if (defined > 1) {
            return Optional.of(Violation.of(
                    ViolationKind.MULTIPLE_RULE_TYPES_DEFINED,
                    "multiple types of rule defined in rule '" + rule.name()
                            + "', only one type of rule is allowed per rule"));
        }
        return Optional.empty();
    }

    /** A set validate block must carry exactly one of pattern and anyPattern. */
    public static Optional<Violation> validateOverlayPattern(Rule rule) {
        Validation validation = rule.validation();
        if (!validation.isSet()) {
            return Optional.empty();
        }
        if (!validation.hasPattern() && !validation.hasAnyPattern()) {
            return Optional.of(Violation.of(
                    ViolationKind.MISSING_PATTERN, "neither pattern nor anyPattern found in rule '" + rule.name() + "'"));
        }
        if (validation.hasPattern() && validation.hasAnyPattern()) {
            return Optional.of(Violation.of(
                    ViolationKind.CONFLICTING_PATTERN_FIELDS,
                    "either pattern or anyPattern is allowed in rule '" + rule.name() + "'"));
        }
        return Optional.empty();
    }
}
