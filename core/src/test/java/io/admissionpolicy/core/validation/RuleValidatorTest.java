package io.admissionpolicy.core.validation;

import static io.admissionpolicy.core.testkit.TestTrees.tree;
import static org.assertj.core.api.Assertions.assertThat;

import io.admissionpolicy.core.model.CloneFrom;
import io.admissionpolicy.core.model.Generation;
import io.admissionpolicy.core.model.Mutation;
import io.admissionpolicy.core.model.Patch;
import io.admissionpolicy.core.model.ResourceDescription;
import io.admissionpolicy.core.model.Rule;
import io.admissionpolicy.core.model.Validation;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RuleValidator")
class RuleValidatorTest {

    private static final ResourceDescription PODS = ResourceDescription.ofKinds("Pod");
    private static final Mutation MUTATION = Mutation.ofPatches(new Patch("/metadata/labels/team", "add", tree("\"a\"")));
    private static final Validation VALIDATION = Validation.ofPattern(tree("{\"metadata\": {\"name\": \"?*\"}}"));
    private static final Generation GENERATION = new Generation("ConfigMap", "cm", null, new CloneFrom("default", "cm"));

    @Nested
    @DisplayName("rule type")
    class RuleType {

        @Test
        @DisplayName("no action is an error")
        void noAction() {
            Rule rule = new Rule("empty", PODS, null, null, null, null);

            Optional<Violation> violation = RuleValidator.validateRuleType(rule);

            assertThat(violation).isPresent();
            assertThat(violation.get().kind()).isEqualTo(ViolationKind.NO_RULE_TYPE_DEFINED);
            assertThat(violation.get().message()).isEqualTo("no rule defined in 'empty'");
        }

        @Test
        @DisplayName("each single action passes")
        void singleAction() {
            assertThat(RuleValidator.validateRuleType(Rule.mutate("m", PODS, MUTATION))).isEmpty();
            assertThat(RuleValidator.validateRuleType(Rule.validate("v", PODS, VALIDATION))).isEmpty();
            assertThat(RuleValidator.validateRuleType(Rule.generate("g", PODS, GENERATION))).isEmpty();
        }

        @Test
        @DisplayName("two actions are an error")
        void twoActions() {
            Rule rule = new Rule("both", PODS, null, MUTATION, VALIDATION, null);

            Optional<Violation> violation = RuleValidator.validateRuleType(rule);

            assertThat(violation).isPresent();
            assertThat(violation.get().kind()).isEqualTo(ViolationKind.MULTIPLE_RULE_TYPES_DEFINED);
            assertThat(violation.get().message())
                    .isEqualTo("multiple types of rule defined in rule 'both', only one type of rule is allowed per rule");
        }

        @Test
        @DisplayName("three actions are an error")
        void threeActions() {
            Rule rule = new Rule("all", PODS, null, MUTATION, VALIDATION, GENERATION);

            assertThat(RuleValidator.validateRuleType(rule))
                    .map(Violation::kind)
                    .contains(ViolationKind.MULTIPLE_RULE_TYPES_DEFINED);
        }

        @Test
        @DisplayName("a validate block with only a message counts as set")
        void messageOnlyValidation() {
            Rule rule = Rule.validate("msg", PODS, new Validation("must be labelled", null, null));

            assertThat(rule.hasValidate()).isTrue();
            assertThat(RuleValidator.validateRuleType(rule)).isEmpty();
        }
    }

    @Nested
    @DisplayName("overlay pattern")
    class OverlayPattern {

        @Test
        @DisplayName("unset validation passes")
        void unsetPasses() {
            assertThat(RuleValidator.validateOverlayPattern(Rule.mutate("m", PODS, MUTATION))).isEmpty();
        }

        @Test
        @DisplayName("message without any pattern is a missing pattern")
        void missingPattern() {
            Rule rule = Rule.validate("r1", PODS, new Validation("labels required", null, null));

            Optional<Violation> violation = RuleValidator.validateOverlayPattern(rule);

            assertThat(violation).isPresent();
            assertThat(violation.get().kind()).isEqualTo(ViolationKind.MISSING_PATTERN);
            assertThat(violation.get().message()).isEqualTo("neither pattern nor anyPattern found in rule 'r1'");
        }

        @Test
        @DisplayName("pattern and anyPattern together conflict")
        void conflictingPatterns() {
            Rule rule = Rule.validate(
                    "r1", PODS, new Validation(null, tree("{\"a\": 1}"), List.of(tree("{\"b\": 2}"))));

            Optional<Violation> violation = RuleValidator.validateOverlayPattern(rule);

            assertThat(violation).isPresent();
            assertThat(violation.get().kind()).isEqualTo(ViolationKind.CONFLICTING_PATTERN_FIELDS);
            assertThat(violation.get().message()).isEqualTo("either pattern or anyPattern is allowed in rule 'r1'");
        }

        @Test
        @DisplayName("pattern alone or anyPattern alone pass")
        void singlePatternPasses() {
            assertThat(RuleValidator.validateOverlayPattern(Rule.validate("p", PODS, VALIDATION))).isEmpty();
            assertThat(RuleValidator.validateOverlayPattern(
                            Rule.validate("a", PODS, Validation.ofAnyPattern(List.of(tree("{\"a\": 1}"))))))
                    .isEmpty();
        }
    }
}
