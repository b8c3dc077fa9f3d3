package io.admissionpolicy.cli;

import io.admissionpolicy.cli.config.ConfigLoadException;
import io.admissionpolicy.cli.config.ConfigLoader;
import io.admissionpolicy.cli.config.ValidatorConfig;
import io.admissionpolicy.cli.logging.LogbackConfigurator;
import io.admissionpolicy.cli.report.FileReport;
import io.admissionpolicy.cli.report.ReportWriter;
import io.admissionpolicy.cli.scan.PolicyFileScanner;
import io.admissionpolicy.core.error.PolicyParseException;
import io.admissionpolicy.core.spec.PolicyLoader;
import io.admissionpolicy.core.spec.PolicyParser;
import io.admissionpolicy.core.validation.ExistingAnchorValidator;
import io.admissionpolicy.core.validation.PolicyValidator;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code policy-validator} command: resolves configuration, sets up
 * logging, scans the given paths, validates every policy file on a fixed
 * thread pool and prints one report in sorted path order.
 *
 * <p>
 * Exit codes: {@value #EXIT_OK} when every policy is valid,
 * {@value #EXIT_INVALID} when any policy is invalid or unreadable,
 * {@value #EXIT_USAGE} on usage or configuration errors.
 */
public final class PolicyValidatorApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(PolicyValidatorApp.class);

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final Path workingDir;

    public PolicyValidatorApp(PrintStream out, PrintStream err, Function<String, String> envLookup, Path workingDir) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir must not be null");
    }

    /**
     * Runs the command.
     *
     * @param args command-line arguments
     * @return the process exit code
     */
    public int run(String[] args) {
        CommandLine commandLine;
        ValidatorConfig config;
        try {
            commandLine = CommandLine.parse(args);
            if (commandLine.help()) {
                out.println(CommandLine.USAGE);
                return EXIT_OK;
            }
            config = ConfigLoader.resolve(commandLine.configPath(), workingDir, envLookup);
            if (commandLine.format() != null) {
                config = config.toBuilder().reportFormat(commandLine.format()).build();
            }
        } catch (IllegalArgumentException | ConfigLoadException e) {
            err.println("policy-validator: " + e.getMessage());
            err.println(CommandLine.USAGE);
            return EXIT_USAGE;
        }

        LogbackConfigurator.configure(config);
        LOG.info(
                "Validator started: maxDepth={}, parallelism={}, report={}",
                config.maxDepth(),
                config.parallelism(),
                config.reportFormat());

        List<Path> files;
        try {
            files = new PolicyFileScanner(config.extensions()).scan(commandLine.paths());
        } catch (IOException e) {
            LOG.error("Failed to scan policy paths: {}", e.getMessage(), e);
            err.println("policy-validator: failed to scan policy paths: " + e.getMessage());
            return EXIT_INVALID;
        }

        List<FileReport> reports = validateAll(files, config);
        ReportWriter.forFormat(config.reportFormat()).write(reports, out);

        long failed = reports.stream().filter(r -> !r.isValid()).count();
        LOG.info("Validation finished: files={}, failed={}", reports.size(), failed);
        return failed == 0 ? EXIT_OK : EXIT_INVALID;
    }

    /** Validates {@code files} concurrently; reports come back in the order of {@code files}. */
    List<FileReport> validateAll(List<Path> files, ValidatorConfig config) {
        if (files.isEmpty()) {
            return List.of();
        }
        PolicyLoader loader = new PolicyLoader(
                new PolicyParser(), new PolicyValidator(new ExistingAnchorValidator(config.maxDepth())));
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.parallelism(), files.size()));
        try {
            List<Future<FileReport>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(pool.submit(() -> check(loader, file)));
            }
            List<FileReport> reports = new ArrayList<>(futures.size());
            for (Future<FileReport> future : futures) {
                reports.add(future.get());
            }
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while validating policies", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Policy validation failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private static FileReport check(PolicyLoader loader, Path file) {
        try {
            return FileReport.checked(file, loader.check(file));
        } catch (PolicyParseException e) {
            LOG.warn("Policy unreadable: source={}, error={}", file, e.getMessage());
            return FileReport.failed(file, e.policyName(), e.getMessage());
        }
    }
}
