package io.admissionpolicy.core.validation;

import io.admissionpolicy.core.model.Patch;
import java.util.Optional;

/** Checks that a JSON patch has a path, a supported operation, and a value where one is needed. */
public final class PatchValidator {

    private PatchValidator() {}

    public static Optional<Violation> validate(Patch patch) {
        if (patch.path() == null || patch.path().isEmpty()) {
            return Optional.of(
                    Violation.of(ViolationKind.MISSING_PATCH_PATH, "JSONPatch field 'path' is mandatory"));
        }
        String operation = patch.operation();
        if (Patch.ADD.equals(operation) || Patch.REPLACE.equals(operation)) {
            if (patch.value() == null) {
                return Optional.of(Violation.of(
                        ViolationKind.MISSING_PATCH_VALUE,
                        "JSONPatch field 'value' is mandatory for operation '" + operation + "'"));
            }
            return Optional.empty();
        }
        if (Patch.REMOVE.equals(operation)) {
            return Optional.empty();
        }
        return Optional.of(Violation.of(
                ViolationKind.UNSUPPORTED_PATCH_OPERATION, "unsupported JSONPatch operation '" + operation + "'"));
    }
}
