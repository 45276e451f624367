package dev.nuclr.spherify.engine;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the engine executable before a batch starts.
 * Search order:
 * <ol>
 *   <li>The configured value itself, when it names an existing file
 *       (absolute path or a path with a directory part)</li>
 *   <li>Entries in the {@code PATH} environment variable, trying the
 *       Windows executable suffixes where applicable</li>
 * </ol>
 * A miss is only a hint: the launch attempt of each task stays authoritative
 * and fails with {@link EngineNotFoundException}.
 */
@Slf4j
public final class EngineLocator {

    private static final List<String> WINDOWS_SUFFIXES = List.of(".exe", ".cmd", ".bat");

    private final String pathEnv;
    private final boolean windows;

    public EngineLocator() {
        this(System.getenv("PATH"), isWindows());
    }

    /** Package-private: fixed environment for tests. */
    EngineLocator(String pathEnv, boolean windows) {
        this.pathEnv = pathEnv;
        this.windows = windows;
    }

    /** Returns the resolved executable, or empty if it cannot be found. */
    public Optional<Path> locate(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        Path direct;
        try {
            direct = Path.of(binary);
        } catch (InvalidPathException e) {
            log.debug("'{}' is not a valid path: {}", binary, e.getMessage());
            return Optional.empty();
        }

        if (direct.isAbsolute() || direct.getParent() != null) {
            return isExecutableFile(direct) ? Optional.of(direct) : Optional.empty();
        }

        if (pathEnv == null) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String name : candidateNames(binary)) {
                Path candidate = Path.of(dir.trim(), name);
                if (isExecutableFile(candidate)) {
                    log.debug("Resolved engine '{}' to {}", binary, candidate);
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> candidateNames(String binary) {
        List<String> names = new ArrayList<>();
        names.add(binary);
        if (windows && !binary.contains(".")) {
            for (String suffix : WINDOWS_SUFFIXES) {
                names.add(binary + suffix);
            }
        }
        return names;
    }

    private static boolean isExecutableFile(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("win");
    }
}
