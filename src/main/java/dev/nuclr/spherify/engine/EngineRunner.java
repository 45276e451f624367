package dev.nuclr.spherify.engine;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over one exchange with the engine process: spawn it, feed
 * {@code input} on stdin, capture stdout and stderr.
 *
 * <p>{@link BlockingEngineRunner} completes the exchange before returning;
 * {@link AsyncEngineRunner} returns at once and completes the future when the
 * process exits. Swap in a test double via {@code MockEngineRunner}.
 */
public interface EngineRunner {

    /**
     * Runs the given command and exchanges bytes with it.
     *
     * @param command full argument list (no shell expansion)
     * @param input   bytes written to the process's stdin, then closed
     * @param timeout maximum wall-clock time to wait; {@link Duration#ZERO} waits forever
     * @return future completed with the captured streams, or exceptionally with
     *         {@link EngineNotFoundException}, {@link EngineTimeoutException} or
     *         another {@link java.io.IOException}
     */
    CompletableFuture<EngineResult> run(List<String> command, byte[] input, Duration timeout);
}
