package dev.nuclr.spherify.image;

import java.util.Objects;

/**
 * In-memory raster normalised to 8-bit RGBA, row-major, four bytes per pixel.
 * Owned by the task that loaded it; the pixel array is not copied on access.
 *
 * @param width  width in pixels
 * @param height height in pixels
 * @param pixels {@code width * height * 4} bytes
 */
public record RgbaImage(int width, int height, byte[] pixels) {

    public static final int BYTES_PER_PIXEL = 4;

    public RgbaImage {
        Objects.requireNonNull(pixels, "pixels");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
        long expected = (long) width * height * BYTES_PER_PIXEL;
        if (pixels.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "%dx%d RGBA image needs %d bytes, got %d", width, height, expected, pixels.length));
        }
    }

    public int byteLength() {
        return pixels.length;
    }

    @Override
    public String toString() {
        return "RgbaImage[" + width + "x" + height + "]";
    }
}
