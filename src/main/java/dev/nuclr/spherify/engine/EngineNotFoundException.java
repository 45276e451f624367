package dev.nuclr.spherify.engine;

import java.io.IOException;

/**
 * The engine process could not be launched, usually because the executable
 * does not exist or is not on the {@code PATH}.
 */
public class EngineNotFoundException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String binary;

    public EngineNotFoundException(String binary, Throwable cause) {
        super("Could not launch engine '" + binary + "': " + cause.getMessage(), cause);
        this.binary = binary;
    }

    public EngineNotFoundException(String binary, String reason) {
        super("Could not launch engine '" + binary + "': " + reason);
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }
}
