package io.admissionpolicy.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command-line arguments.
 *
 * @param configPath explicit {@code --config} file, or {@code null}
 * @param format     {@code --format} override, or {@code null}
 * @param paths      policy files and directories to check
 * @param help       whether {@code --help} was given
 */
public record CommandLine(Path configPath, String format, List<Path> paths, boolean help) {

    static final String USAGE =
            "Usage: policy-validator [--config <file>] [--format text|json] <file-or-directory>...";

    public CommandLine {
        paths = List.copyOf(paths);
    }

    /**
     * Parses {@code args}.
     *
     * @throws IllegalArgumentException on an unknown option, a missing option
     *                                  value, or when no path is given
     */
    public static CommandLine parse(String[] args) {
        Path configPath = null;
        String format = null;
        boolean help = false;
        List<Path> paths = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPath = Path.of(requireValue(args, i++, arg));
                case "--format" -> format = requireValue(args, i++, arg);
                case "-h", "--help" -> help = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    paths.add(Path.of(arg));
                }
            }
        }
        if (!help && paths.isEmpty()) {
            throw new IllegalArgumentException("No policy files or directories given");
        }
        return new CommandLine(configPath, format, paths, help);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index + 1];
    }
}
