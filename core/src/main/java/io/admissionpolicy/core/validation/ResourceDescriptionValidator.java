package io.admissionpolicy.core.validation;

import io.admissionpolicy.core.error.InvalidSelectorException;
import io.admissionpolicy.core.model.ResourceDescription;
import io.admissionpolicy.core.selector.LabelSelectors;
import io.admissionpolicy.core.selector.Requirement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates a {@code match.resources}/{@code exclude.resources} block. An empty description is
 * valid; otherwise {@code kinds} must be non-empty and a present selector must compile into at
 * least one requirement. A block holding only {@code kinds: []} is not empty.
 */
public final class ResourceDescriptionValidator {

    private ResourceDescriptionValidator() {}

    public static Optional<Violation> validate(ResourceDescription description) {
        Objects.requireNonNull(description, "description must not be null");
        if (description.isEmpty()) {
            return Optional.empty();
        }
        if (!description.hasKinds()) {
            return Optional.of(Violation.of(ViolationKind.MISSING_RESOURCE_KIND, "field Kind is not specified"));
        }
        if (description.selector() != null) {
            List<Requirement> requirements;
            try {
                requirements = LabelSelectors.requirements(description.selector());
            } catch (InvalidSelectorException e) {
                return Optional.of(Violation.of(ViolationKind.INVALID_SELECTOR, e.getMessage()));
            }
            if (requirements.isEmpty()) {
                return Optional.of(Violation.of(
                        ViolationKind.EMPTY_SELECTOR_REQUIREMENTS, "the requirements are not specified in selector"));
            }
        }
        return Optional.empty();
    }
}
