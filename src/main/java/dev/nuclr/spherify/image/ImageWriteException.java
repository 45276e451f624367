package dev.nuclr.spherify.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A result image could not be written to its destination.
 */
public class ImageWriteException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public ImageWriteException(Path path, String message) {
        super("Could not write " + path + ": " + message);
        this.path = path;
    }

    public ImageWriteException(Path path, Throwable cause) {
        super("Could not write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
