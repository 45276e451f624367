package dev.nuclr.spherify.engine;

import java.io.IOException;
import java.time.Duration;

/**
 * The engine process did not finish within the configured timeout and was killed.
 */
public class EngineTimeoutException extends IOException {

    private static final long serialVersionUID = 1L;

    public EngineTimeoutException(Duration timeout) {
        super("Engine process timed out after " + timeout.toSeconds() + "s");
    }
}
