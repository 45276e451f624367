package dev.nuclr.spherify.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class AsyncEngineRunnerTest {

    private static final int IN_FLIGHT = 40;

    /** Threads the JDK or a pump pool would dedicate to a single child process. */
    private static long perProcessThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .map(Thread::getName)
                .filter(n -> n.startsWith("process reaper") || n.startsWith("engine-io-"))
                .count();
    }

    @Test
    void manyExchangesInFlightDoNotTakeAThreadEach() {
        AsyncEngineRunner runner = new AsyncEngineRunner();
        List<String> cmd = List.of("sh", "-c", "cat >/dev/null; sleep 1; printf done");
        long before = perProcessThreads();

        List<CompletableFuture<EngineResult>> running = new ArrayList<>();
        for (int i = 0; i < IN_FLIGHT; i++) {
            running.add(runner.run(cmd, new byte[64 * 1024], Duration.ofSeconds(30)));
        }
        long during = perProcessThreads();

        for (CompletableFuture<EngineResult> f : running) {
            assertEquals("done", new String(f.join().stdout()));
        }
        assertTrue(during <= before, "reaper or pump threads grew from " + before + " to " + during);
    }
}
