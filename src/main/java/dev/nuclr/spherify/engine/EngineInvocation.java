package dev.nuclr.spherify.engine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable argument set for one engine call. The image size is taken from
 * the loaded image; every other field is batch-wide configuration.
 *
 * @param width           source image width in pixels
 * @param height          source image height in pixels
 * @param center          sphere center
 * @param radius          sphere radius
 * @param samplingDensity samples per output pixel
 * @param snapshotWidth   requested output width in pixels
 * @param snapshotHeight  requested output height in pixels
 * @param script          engine entry script, or {@code null} when the binary is self-contained
 * @param binary          engine executable name or path
 */
public record EngineInvocation(
        int width,
        int height,
        SphereCenter center,
        double radius,
        int samplingDensity,
        int snapshotWidth,
        int snapshotHeight,
        Path script,
        String binary) {

    public EngineInvocation {
        Objects.requireNonNull(center, "center");
        Objects.requireNonNull(binary, "binary");
        requirePositive(width, "width");
        requirePositive(height, "height");
        requirePositive(samplingDensity, "samplingDensity");
        requirePositive(snapshotWidth, "snapshotWidth");
        requirePositive(snapshotHeight, "snapshotHeight");
    }

    /** Number of bytes the engine expects on stdin. */
    public int inputLength() {
        return Math.multiplyExact(Math.multiplyExact(width, height), EngineProtocol.BYTES_PER_PIXEL);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }
}
