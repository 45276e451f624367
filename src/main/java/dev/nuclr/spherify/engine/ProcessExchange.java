package dev.nuclr.spherify.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;

/**
 * One running engine process with its three pipes pumped concurrently on a
 * shared daemon pool, so stdin, stdout and stderr never wait behind a full
 * buffer of each other. Used by {@link BlockingEngineRunner}, which has at
 * most one process alive at a time.
 */
@Slf4j
final class ProcessExchange {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /** Stream pumps only; pipe I/O blocks, so these threads never run engine logic. */
    static final ExecutorService IO_POOL = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "engine-io-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final Process process;
    private final long startMs;
    private final CompletableFuture<Void> stdin;
    private final CompletableFuture<byte[]> stdout;
    private final CompletableFuture<byte[]> stderr;

    private ProcessExchange(Process process, byte[] input, long startMs) {
        this.process = process;
        this.startMs = startMs;
        this.stdin = CompletableFuture.runAsync(() -> write(process.getOutputStream(), input), IO_POOL);
        this.stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), IO_POOL);
        this.stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), IO_POOL);
    }

    /**
     * Spawns the process and starts pumping {@code input} into it.
     *
     * @throws EngineNotFoundException if the executable cannot be launched
     */
    static ProcessExchange start(List<String> command, byte[] input) throws EngineNotFoundException {
        log.debug("Running: {}", command);
        long startMs = System.currentTimeMillis();
        Process proc;
        try {
            proc = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new EngineNotFoundException(command.get(0), e);
        }
        return new ProcessExchange(proc, input, startMs);
    }

    Process process() {
        return process;
    }

    /** Completes once the process has exited and every pipe is drained. */
    CompletableFuture<EngineResult> completion() {
        return CompletableFuture.allOf(process.onExit(), stdin, stdout, stderr)
                .thenApply(v -> new EngineResult(
                        process.exitValue(),
                        stdout.join(),
                        stderr.join(),
                        System.currentTimeMillis() - startMs));
    }

    /** Blocks until {@link #completion()} is done; call only after the process exited. */
    EngineResult await() throws IOException, InterruptedException {
        try {
            return completion().get();
        } catch (ExecutionException e) {
            throw asIOException(e.getCause());
        }
    }

    void destroyIfAlive() {
        if (process.isAlive()) {
            process.destroyForcibly();
        }
    }

    static IOException asIOException(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException
                || cause instanceof UncheckedIOException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof IOException io ? io : new IOException(cause.getMessage(), cause);
    }

    private static void write(OutputStream out, byte[] input) {
        try (out) {
            out.write(input);
        } catch (IOException e) {
            // The engine may exit without consuming stdin; its stderr tells why.
            log.debug("Engine closed stdin early: {}", e.getMessage());
        }
    }

    private static byte[] drain(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
