package io.admissionpolicy.core.validation;

import io.admissionpolicy.core.model.ClusterPolicy;
import io.admissionpolicy.core.model.Patch;
import io.admissionpolicy.core.model.Rule;
import io.admissionpolicy.core.model.Validation;
import io.admissionpolicy.core.tree.Value;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a whole {@link ClusterPolicy} and reports every problem it can find in one pass.
 *
 * <p>
 * Per rule, all checks run and their violations are concatenated in a fixed order: rule type,
 * match resources, exclude resources, pattern/anyPattern exclusivity, existence anchors on
 * {@code pattern} then on each {@code anyPattern} entry, mutation patches, generation source.
 * Rule-name uniqueness is checked afterwards and stops at the first duplicate. Each anchor walk
 * stops at its first violation, so a rule with several {@code anyPattern} entries can report one
 * anchor violation per entry.
 *
 * <p>
 * Thread-safe: holds no mutable state; the same policy always yields an equal result.
 */
public final class PolicyValidator {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyValidator.class);

    private final ExistingAnchorValidator anchorValidator;

    public PolicyValidator() {
        this(new ExistingAnchorValidator());
    }

    public PolicyValidator(ExistingAnchorValidator anchorValidator) {
        this.anchorValidator = Objects.requireNonNull(anchorValidator, "anchorValidator must not be null");
    }

    /**
     * Validates every rule of the policy and the uniqueness of rule names.
     *
     * @param policy the policy to check
     * @return the combined result, valid when no violation was found
     */
    public ValidationResult validate(ClusterPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        List<Violation> violations = new ArrayList<>();
        for (Rule rule : policy.rules()) {
            violations.addAll(validateRule(rule));
        }
        validateUniqueRuleNames(policy).ifPresent(violations::add);

        LOG.debug(
                "Policy validated: name={}, rules={}, violations={}",
                policy.name(),
                policy.rules().size(),
                violations.size());
        return ValidationResult.of(violations);
    }

    /** Runs every rule-level check and returns all violations, attributed to the rule. */
    public List<Violation> validateRule(Rule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        List<Optional<Violation>> checks = new ArrayList<>();
        checks.add(RuleValidator.validateRuleType(rule));
        checks.add(ResourceDescriptionValidator.validate(rule.match()));
        checks.add(ResourceDescriptionValidator.validate(rule.exclude()));
        checks.add(RuleValidator.validateOverlayPattern(rule));

        List<Violation> violations = new ArrayList<>();
        checks.forEach(check -> check.ifPresent(violations::add));
        violations.addAll(validateExistingAnchors(rule));

        if (rule.hasMutate()) {
            for (Patch patch : rule.mutation().patches()) {
                PatchValidator.validate(patch).ifPresent(violations::add);
            }
        }
        if (rule.hasGenerate()) {
            GenerationValidator.validate(rule.generation()).ifPresent(violations::add);
        }

        if (!violations.isEmpty()) {
            LOG.debug("Rule '{}' has {} violation(s)", rule.name(), violations.size());
        }
        return violations.stream().map(v -> v.inRule(rule.name())).toList();
    }

    /** Walks {@code pattern} and each {@code anyPattern} entry; one result per tree. */
    public List<Violation> validateExistingAnchors(Rule rule) {
        Validation validation = rule.validation();
        List<Violation> violations = new ArrayList<>();
        if (validation.hasPattern()) {
            anchorValidator.validate(validation.pattern()).ifPresent(violations::add);
        }
        for (Value pattern : validation.anyPattern()) {
            anchorValidator.validate(pattern).ifPresent(violations::add);
        }
        return violations;
    }

    /** Rule names must be unique; reports only the first repeated name. */
    public Optional<Violation> validateUniqueRuleNames(ClusterPolicy policy) {
        Set<String> seen = new HashSet<>();
        for (Rule rule : policy.rules()) {
            if (!seen.add(rule.name())) {
                return Optional.of(
                        Violation.of(ViolationKind.DUPLICATE_RULE_NAME, "duplicate rule name: '" + rule.name() + "'"));
            }
        }
        return Optional.empty();
    }
}
