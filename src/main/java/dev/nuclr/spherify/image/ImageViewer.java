package dev.nuclr.spherify.image;

/**
 * Hands an image to something that shows it. The call returns once the image
 * is handed over, without waiting for the viewer to close, and never reports
 * failure.
 */
@FunctionalInterface
public interface ImageViewer {

    void show(RgbaImage image, String title);
}
