package dev.nuclr.spherify.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An input file could not be turned into an {@link RgbaImage}.
 * Never fatal for a batch: the target is skipped.
 */
public class ImageLoadException extends IOException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Missing file or no read permission. */
        UNREADABLE,
        /** No decoder recognised the content. */
        UNRECOGNIZED
    }

    private final Kind kind;
    private final transient Path path;

    public ImageLoadException(Kind kind, Path path, String message) {
        super(message);
        this.kind = kind;
        this.path = path;
    }

    public ImageLoadException(Kind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public Kind getKind() {
        return kind;
    }

    public Path getPath() {
        return path;
    }
}
