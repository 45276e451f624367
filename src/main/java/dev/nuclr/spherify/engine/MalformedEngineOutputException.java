package dev.nuclr.spherify.engine;

import java.io.IOException;

/**
 * The engine's stdout does not hold a raster of the expected size, or the
 * expected size does not fit in a Java array.
 */
public class MalformedEngineOutputException extends IOException {

    private static final long serialVersionUID = 1L;

    private final long expectedLength;
    private final int actualLength;

    public MalformedEngineOutputException(long expectedLength, int actualLength) {
        super("Engine returned " + actualLength + " bytes, expected " + expectedLength);
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public long getExpectedLength() {
        return expectedLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
