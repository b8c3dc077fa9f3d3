package io.admissionpolicy.core.spec;

import io.admissionpolicy.core.error.PolicyParseException;
import io.admissionpolicy.core.error.PolicyValidationException;
import io.admissionpolicy.core.model.ClusterPolicy;
import io.admissionpolicy.core.validation.PolicyValidator;
import io.admissionpolicy.core.validation.ValidationResult;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a policy document and certifies it before handing it to a runtime.
 *
 * <p>
 * Thread-safe if the parser and validator are (both are).
 */
public final class PolicyLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyLoader.class);

    private final PolicyParser parser;
    private final PolicyValidator validator;

    public PolicyLoader() {
        this(new PolicyParser(), new PolicyValidator());
    }

    public PolicyLoader(PolicyParser parser, PolicyValidator validator) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Loads and validates the policy at {@code path}.
     *
     * @param path path to the policy document
     * @return the accepted policy
     * @throws PolicyParseException      if the document cannot be parsed
     * @throws PolicyValidationException if the policy has structural violations
     */
    public ClusterPolicy load(Path path) {
        Checked checked = check(path);
        checked.result().orThrow(checked.policy().name(), path.toString());
        return checked.policy();
    }

    /**
     * Parses and validates without throwing on violations.
     *
     * @param path path to the policy document
     * @return the parsed policy together with its validation result
     * @throws PolicyParseException if the document cannot be parsed
     */
    public Checked check(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        ClusterPolicy policy = parser.parse(path);
        return new Checked(policy, validate(policy, path.toString()));
    }

    /**
     * Parses and validates policy text without throwing on violations.
     *
     * @param content YAML or JSON text
     * @param source  identifier used in logs and error messages
     */
    public Checked check(String content, String source) {
        ClusterPolicy policy = parser.parse(content, source);
        return new Checked(policy, validate(policy, source));
    }

    private ValidationResult validate(ClusterPolicy policy, String source) {
        ValidationResult result = validator.validate(policy);
        if (result.isValid()) {
            LOG.info("Policy loaded: name={}, rules={}, source={}", policy.name(), policy.rules().size(), source);
        } else {
            LOG.warn(
                    "Policy rejected: name={}, violations={}, source={}",
                    policy.name(),
                    result.violations().size(),
                    source);
        }
        return result;
    }

    /**
     * A parsed policy with its validation result.
     *
     * @param policy the parsed policy
     * @param result the validation outcome
     */
    public record Checked(ClusterPolicy policy, ValidationResult result) {}
}
