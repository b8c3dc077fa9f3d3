package io.admissionpolicy.cli.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands command-line arguments into the sorted set of policy files to check.
 *
 * <p>
 * Directories are walked recursively and contribute regular files whose name
 * ends with one of the configured suffixes (case-insensitive). Files named
 * explicitly are always kept, whatever their suffix, and so are paths that do
 * not exist: those surface later as unreadable policies.
 */
public final class PolicyFileScanner {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyFileScanner.class);

    private final List<String> extensions;

    public PolicyFileScanner(List<String> extensions) {
        this.extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions must not be null"));
    }

    /**
     * @param roots files and directories given on the command line
     * @return distinct paths in natural {@link Path} order
     * @throws IOException if a directory cannot be walked
     */
    public List<Path> scan(List<Path> roots) throws IOException {
        TreeSet<Path> files = new TreeSet<>();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                try (Stream<Path> walk = Files.walk(root)) {
                    walk.filter(Files::isRegularFile).filter(this::hasPolicyExtension).forEach(files::add);
                }
            } else {
                files.add(root);
            }
        }
        LOG.debug("Scanned {} root(s), found {} policy file(s)", roots.size(), files.size());
        return List.copyOf(files);
    }

    boolean hasPolicyExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }
}
