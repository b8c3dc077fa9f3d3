package io.admissionpolicy.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.admissionpolicy.core.model.LabelSelector;
import io.admissionpolicy.core.model.LabelSelectorRequirement;
import io.admissionpolicy.core.model.ResourceDescription;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResourceDescriptionValidator")
class ResourceDescriptionValidatorTest {

    @Test
    @DisplayName("fully empty description is valid")
    void emptyIsValid() {
        assertThat(ResourceDescriptionValidator.validate(ResourceDescription.empty())).isEmpty();
    }

    @Test
    @DisplayName("kinds only is valid")
    void kindsOnly() {
        assertThat(ResourceDescriptionValidator.validate(ResourceDescription.ofKinds("Pod", "Deployment")))
                .isEmpty();
    }

    @Test
    @DisplayName("empty kinds with another field set is a missing kind")
    void missingKind() {
        var description = new ResourceDescription(Set.of(), "nginx-*", null, null);

        Optional<Violation> violation = ResourceDescriptionValidator.validate(description);

        assertThat(violation).isPresent();
        assertThat(violation.get().kind()).isEqualTo(ViolationKind.MISSING_RESOURCE_KIND);
        assertThat(violation.get().message()).isEqualTo("field Kind is not specified");
    }

    @Test
    @DisplayName("an explicit empty kinds list on its own is a missing kind")
    void explicitEmptyKindsOnly() {
        var description = new ResourceDescription(Set.of(), null, null, null);

        assertThat(description.isEmpty()).isFalse();
        assertThat(ResourceDescriptionValidator.validate(description))
                .map(Violation::kind)
                .contains(ViolationKind.MISSING_RESOURCE_KIND);
    }

    @Test
    @DisplayName("namespaces without kinds is a missing kind")
    void namespacesWithoutKinds() {
        var description = new ResourceDescription(null, null, List.of("default"), null);

        assertThat(ResourceDescriptionValidator.validate(description))
                .map(Violation::kind)
                .contains(ViolationKind.MISSING_RESOURCE_KIND);
    }

    @Test
    @DisplayName("a selector without labels or expressions has no requirements")
    void emptySelector() {
        var description = new ResourceDescription(Set.of("Pod"), null, null, new LabelSelector(Map.of(), List.of()));

        Optional<Violation> violation = ResourceDescriptionValidator.validate(description);

        assertThat(violation).isPresent();
        assertThat(violation.get().kind()).isEqualTo(ViolationKind.EMPTY_SELECTOR_REQUIREMENTS);
        assertThat(violation.get().message()).isEqualTo("the requirements are not specified in selector");
    }

    @Test
    @DisplayName("a selector with matchLabels is valid")
    void selectorWithLabels() {
        var description = new ResourceDescription(
                Set.of("Pod"), null, null, LabelSelector.matchLabels(Map.of("app", "nginx")));

        assertThat(ResourceDescriptionValidator.validate(description)).isEmpty();
    }

    @Test
    @DisplayName("a selector with an unknown operator is invalid")
    void invalidSelector() {
        var selector = new LabelSelector(
                null, List.of(new LabelSelectorRequirement("app", "Contains", List.of("nginx"))));
        var description = new ResourceDescription(Set.of("Pod"), null, null, selector);

        Optional<Violation> violation = ResourceDescriptionValidator.validate(description);

        assertThat(violation).isPresent();
        assertThat(violation.get().kind()).isEqualTo(ViolationKind.INVALID_SELECTOR);
        assertThat(violation.get().message()).contains("Contains");
    }

    @Test
    @DisplayName("kinds are checked before the selector")
    void kindsCheckedFirst() {
        var description = new ResourceDescription(null, null, null, new LabelSelector(null, null));

        assertThat(ResourceDescriptionValidator.validate(description))
                .map(Violation::kind)
                .contains(ViolationKind.MISSING_RESOURCE_KIND);
    }
}
