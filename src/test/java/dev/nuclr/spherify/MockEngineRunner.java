package dev.nuclr.spherify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;

import dev.nuclr.spherify.engine.EngineNotFoundException;
import dev.nuclr.spherify.engine.EngineResult;
import dev.nuclr.spherify.engine.EngineRunner;

/**
 * Test double for {@link EngineRunner}.
 *
 * <p>Behaviour:
 * <ul>
 *   <li>By default the engine is the identity transform: stdin is echoed to
 *       stdout with empty stderr and exit code 0.</li>
 *   <li>Calls matching {@link #failWhen(BiPredicate)} still echo stdout but
 *       also write {@link #FAILURE_MESSAGE} to stderr and exit with 1.</li>
 *   <li>{@link #setNotFound(boolean)} fails every call as if the executable
 *       were missing.</li>
 * </ul>
 * Futures are completed before {@code run} returns.
 */
public class MockEngineRunner implements EngineRunner {

    public static final String FAILURE_MESSAGE = "mock engine failure\n";

    // -- Configurable behaviour -----------------------------------------------

    private BiPredicate<List<String>, byte[]> failWhen = (cmd, input) -> false;

    private boolean notFound = false;

    private int exitCode = 0;

    // -- Introspection --------------------------------------------------------

    private final List<List<String>> recordedCommands = new ArrayList<>();
    private final List<byte[]> recordedInputs = new ArrayList<>();

    // -- EngineRunner ---------------------------------------------------------

    @Override
    public synchronized CompletableFuture<EngineResult> run(List<String> command, byte[] input, Duration timeout) {
        recordedCommands.add(List.copyOf(command));
        recordedInputs.add(input.clone());

        if (notFound) {
            return CompletableFuture.failedFuture(new EngineNotFoundException(
                    command.get(0), new IOException("No such file or directory")));
        }
        if (failWhen.test(command, input)) {
            return CompletableFuture.completedFuture(new EngineResult(
                    1, input.clone(), FAILURE_MESSAGE.getBytes(StandardCharsets.UTF_8), 1L));
        }
        return CompletableFuture.completedFuture(new EngineResult(exitCode, input.clone(), new byte[0], 1L));
    }

    // -- Setters / getters for test assertions --------------------------------

    public void failWhen(BiPredicate<List<String>, byte[]> failWhen) {
        this.failWhen = failWhen;
    }

    public void setNotFound(boolean notFound) {
        this.notFound = notFound;
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public synchronized int getCallCount() {
        return recordedCommands.size();
    }

    public synchronized List<List<String>> getRecordedCommands() {
        return Collections.unmodifiableList(new ArrayList<>(recordedCommands));
    }

    public synchronized List<byte[]> getRecordedInputs() {
        return Collections.unmodifiableList(new ArrayList<>(recordedInputs));
    }
}
