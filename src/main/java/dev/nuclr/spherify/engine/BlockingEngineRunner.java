package dev.nuclr.spherify.engine;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link EngineRunner} that performs the whole exchange on the calling thread
 * and hands back an already-completed future. No shell is involved; the
 * command is passed directly to the OS.
 */
@Slf4j
public final class BlockingEngineRunner implements EngineRunner {

    @Override
    public CompletableFuture<EngineResult> run(List<String> command, byte[] input, Duration timeout) {
        try {
            return CompletableFuture.completedFuture(exchange(command, input, timeout));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(e);
        }
    }

    private EngineResult exchange(List<String> command, byte[] input, Duration timeout)
            throws IOException, InterruptedException {
        ProcessExchange exchange = ProcessExchange.start(command, input);
        try {
            if (timeout.isZero()) {
                exchange.process().waitFor();
            } else if (!exchange.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new EngineTimeoutException(timeout);
            }
            EngineResult result = exchange.await();
            log.debug("Engine exited with {} after {} ms", result.exitCode(), result.elapsedMs());
            return result;
        } finally {
            exchange.destroyIfAlive();
        }
    }
}
