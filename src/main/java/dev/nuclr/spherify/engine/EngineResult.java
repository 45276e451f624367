package dev.nuclr.spherify.engine;

import java.nio.charset.StandardCharsets;

/**
 * Immutable result of one engine exchange.
 *
 * @param exitCode  OS exit code (0 = success)
 * @param stdout    raw bytes written to standard output
 * @param stderr    raw bytes written to standard error
 * @param elapsedMs wall-clock milliseconds from process start to exit
 */
public record EngineResult(int exitCode, byte[] stdout, byte[] stderr, long elapsedMs) {

    public EngineResult {
        stdout = stdout == null ? new byte[0] : stdout;
        stderr = stderr == null ? new byte[0] : stderr;
    }

    /** Returns {@code true} if the exit code is 0. */
    public boolean success() {
        return exitCode == 0;
    }

    /** Any stderr output marks the exchange as failed, whatever the exit code. */
    public boolean hasStderr() {
        return stderr.length > 0;
    }

    public String stderrText() {
        return new String(stderr, StandardCharsets.UTF_8);
    }

    /** Returns the first non-blank line of stderr, or an empty string. */
    public String firstStderrLine() {
        return stderrText().lines()
                .filter(l -> !l.isBlank())
                .findFirst()
                .orElse("");
    }
}
