package io.admissionpolicy.cli.report;

import io.admissionpolicy.core.spec.PolicyLoader;
import io.admissionpolicy.core.validation.Violation;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of checking one policy file.
 *
 * @param file       the checked file
 * @param policyName {@code metadata.name}, or {@code null} if the file could not be parsed
 * @param violations structural violations, empty when valid or unparsed
 * @param error      parse/read failure message, or {@code null}
 */
public record FileReport(Path file, String policyName, List<Violation> violations, String error) {

    public FileReport {
        Objects.requireNonNull(file, "file must not be null");
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    /** Report for a file that parsed; valid iff the result has no violations. */
    public static FileReport checked(Path file, PolicyLoader.Checked checked) {
        return new FileReport(
                file, checked.policy().name(), checked.result().violations(), null);
    }

    /** Report for a file that could not be read or parsed. */
    public static FileReport failed(Path file, String policyName, String error) {
        return new FileReport(file, policyName, List.of(), Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isValid() {
        return error == null && violations.isEmpty();
    }

    public boolean isFailed() {
        return error != null;
    }
}
