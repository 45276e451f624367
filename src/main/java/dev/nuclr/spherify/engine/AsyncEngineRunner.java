package dev.nuclr.spherify.engine;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.zaxxer.nuprocess.NuAbstractProcessHandler;
import com.zaxxer.nuprocess.NuProcess;
import com.zaxxer.nuprocess.NuProcessBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Non-blocking {@link EngineRunner} on top of NuProcess: the pipes of every
 * running engine are serviced by NuProcess's event-loop threads (epoll or
 * kqueue), so many exchanges can be in flight without a thread per process.
 *
 * <p>Futures complete on the common pool, never on the event loop, so work
 * chained onto them cannot stall other processes' I/O.
 */
@Slf4j
public final class AsyncEngineRunner implements EngineRunner {

    @Override
    public CompletableFuture<EngineResult> run(List<String> command, byte[] input, Duration timeout) {
        log.debug("Running: {}", command);
        Exchange exchange = new Exchange(command.get(0));
        NuProcessBuilder builder = new NuProcessBuilder(command);
        builder.setProcessListener(exchange);
        NuProcess process = builder.start();
        if (process == null) {
            exchange.launchFailed();
        } else {
            exchange.feed(process, input);
        }

        CompletableFuture<EngineResult> done = exchange.result;
        if (!timeout.isZero()) {
            done = done.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return done.handleAsync((result, error) -> {
            exchange.destroyIfRunning();
            if (error == null) {
                log.debug("Engine exited with {} after {} ms", result.exitCode(), result.elapsedMs());
                return result;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof TimeoutException) {
                throw new CompletionException(new EngineTimeoutException(timeout));
            }
            throw new CompletionException(ProcessExchange.asIOException(cause));
        });
    }

    /**
     * Collects one process's output from NuProcess callbacks. The result is
     * published once the exit status is known and both output pipes are closed.
     */
    private static final class Exchange extends NuAbstractProcessHandler {

        private final String binary;
        private final long startMs = System.currentTimeMillis();
        private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        final CompletableFuture<EngineResult> result = new CompletableFuture<>();

        private NuProcess process;
        private boolean stdoutClosed;
        private boolean stderrClosed;
        private Integer exitCode;

        Exchange(String binary) {
            this.binary = binary;
        }

        @Override
        public synchronized void onStart(NuProcess nuProcess) {
            this.process = nuProcess;
        }

        void feed(NuProcess nuProcess, byte[] input) {
            try {
                if (input.length > 0) {
                    nuProcess.writeStdin(ByteBuffer.wrap(input));
                }
                nuProcess.closeStdin(false);
            } catch (IllegalStateException e) {
                // The engine may exit before stdin is queued; its stderr tells why.
                log.debug("Engine closed stdin early: {}", e.getMessage());
            }
        }

        @Override
        public synchronized void onStdout(ByteBuffer buffer, boolean closed) {
            drain(buffer, stdout);
            stdoutClosed |= closed;
            publishIfDone();
        }

        @Override
        public synchronized void onStderr(ByteBuffer buffer, boolean closed) {
            drain(buffer, stderr);
            stderrClosed |= closed;
            publishIfDone();
        }

        @Override
        public synchronized void onExit(int statusCode) {
            if (statusCode == Integer.MIN_VALUE) {
                launchFailed();
                return;
            }
            exitCode = statusCode;
            publishIfDone();
        }

        void launchFailed() {
            result.completeExceptionally(new EngineNotFoundException(binary, "the process could not be started"));
        }

        synchronized void destroyIfRunning() {
            if (process != null && process.isRunning()) {
                process.destroy(true);
            }
        }

        private void publishIfDone() {
            if (exitCode != null && stdoutClosed && stderrClosed) {
                result.complete(new EngineResult(
                        exitCode,
                        stdout.toByteArray(),
                        stderr.toByteArray(),
                        System.currentTimeMillis() - startMs));
            }
        }

        private static void drain(ByteBuffer buffer, ByteArrayOutputStream sink) {
            int n = buffer.remaining();
            if (n > 0) {
                byte[] chunk = new byte[n];
                buffer.get(chunk);
                sink.write(chunk, 0, n);
            }
        }
    }
}
