package io.admissionpolicy.core.validation;

import io.admissionpolicy.core.model.Generation;
import java.util.Optional;

/** Checks that a generate block names exactly one source: inline data or a clone reference. */
public final class GenerationValidator {

    private GenerationValidator() {}

    public static Optional<Violation> validate(Generation generation) {
        if (!generation.hasData() && !generation.hasClone()) {
            return Optional.of(Violation.of(
                    ViolationKind.MISSING_GENERATION_SOURCE,
                    "neither data nor clone (source) of " + generation.kind() + " is specified"));
        }
        if (generation.hasData() && generation.hasClone()) {
            return Optional.of(Violation.of(
                    ViolationKind.CONFLICTING_GENERATION_SOURCE,
                    "both data and clone (source) of " + generation.kind() + " are specified"));
        }
        return Optional.empty();
    }
}
