package io.admissionpolicy.cli;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code policy-validator} command.
 *
 * <p>
 * Delegates to {@link PolicyValidatorApp#run(String[])} and exits with its
 * status code. An unexpected failure is logged and exits with
 * {@link PolicyValidatorApp#EXIT_INVALID}.
 */
public final class PolicyValidatorMain {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyValidatorMain.class);

    private PolicyValidatorMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args {@code [--config file] [--format text|json] paths...}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new PolicyValidatorApp(System.out, System.err, System::getenv, Path.of("")).run(args);
        } catch (Exception e) {
            LOG.error("Validation failed: {}", e.getMessage(), e);
            status = PolicyValidatorApp.EXIT_INVALID;
        }
        System.exit(status);
    }
}
