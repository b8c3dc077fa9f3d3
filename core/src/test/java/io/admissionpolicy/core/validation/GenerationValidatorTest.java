package io.admissionpolicy.core.validation;

import static io.admissionpolicy.core.testkit.TestTrees.tree;
import static org.assertj.core.api.Assertions.assertThat;

import io.admissionpolicy.core.model.CloneFrom;
import io.admissionpolicy.core.model.Generation;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GenerationValidator")
class GenerationValidatorTest {

    @Test
    @DisplayName("neither data nor clone is a missing source")
    void missingSource() {
        Optional<Violation> violation =
                GenerationValidator.validate(new Generation("NetworkPolicy", "deny-all", null, null));

        assertThat(violation).isPresent();
        assertThat(violation.get().kind()).isEqualTo(ViolationKind.MISSING_GENERATION_SOURCE);
        assertThat(violation.get().message()).isEqualTo("neither data nor clone (source) of NetworkPolicy is specified");
    }

    @Test
    @DisplayName("both data and clone conflict")
    void conflictingSource() {
        Generation generation = new Generation(
                "ConfigMap", "zk", tree("{\"data\": {\"k\": \"v\"}}"), new CloneFrom("default", "config-template"));

        Optional<Violation> violation = GenerationValidator.validate(generation);

        assertThat(violation).isPresent();
        assertThat(violation.get().kind()).isEqualTo(ViolationKind.CONFLICTING_GENERATION_SOURCE);
        assertThat(violation.get().message()).isEqualTo("both data and clone (source) of ConfigMap are specified");
    }

    @Test
    @DisplayName("data alone passes")
    void dataOnly() {
        assertThat(GenerationValidator.validate(new Generation("ConfigMap", "zk", tree("{\"a\": 1}"), null)))
                .isEmpty();
    }

    @Test
    @DisplayName("clone alone passes, even with only a name")
    void cloneOnly() {
        assertThat(GenerationValidator.validate(new Generation("Secret", "regcred", null, new CloneFrom(null, "regcred"))))
                .isEmpty();
    }

    @Test
    @DisplayName("a clone with blank fields counts as absent")
    void blankCloneIsAbsent() {
        assertThat(GenerationValidator.validate(new Generation("Secret", "s", null, new CloneFrom("", ""))))
                .map(Violation::kind)
                .contains(ViolationKind.MISSING_GENERATION_SOURCE);
    }
}
