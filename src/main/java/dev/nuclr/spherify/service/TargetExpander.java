package dev.nuclr.spherify.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Flattens input targets into file candidates. A directory contributes its
 * direct entries, sorted by name; directories inside it are skipped to avoid
 * unbounded recursion. Anything that is not a directory is passed through
 * unchecked and fails later at load time if it is not a readable image.
 */
public final class TargetExpander {

    private final RunLog runLog;

    public TargetExpander(RunLog runLog) {
        this.runLog = runLog;
    }

    public List<Path> expand(List<Path> targets) {
        List<Path> candidates = new ArrayList<>();
        for (Path target : targets) {
            if (!Files.isDirectory(target)) {
                candidates.add(target);
                continue;
            }
            try (Stream<Path> entries = Files.list(target)) {
                entries.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .filter(p -> {
                            if (Files.isDirectory(p)) {
                                runLog.progress("Skipping sub-directory `{}`", p);
                                return false;
                            }
                            return true;
                        })
                        .forEach(candidates::add);
            } catch (IOException e) {
                runLog.warn("Cannot list directory `{}`: {}; skipping...", target, e.getMessage());
            }
        }
        return candidates;
    }
}
