package dev.nuclr.spherify.service;

import java.nio.file.Path;
import java.util.Objects;

import dev.nuclr.spherify.image.RgbaImage;

/**
 * Result for one resolved input file: either an image, or the reason there is none.
 *
 * @param source    the input file
 * @param image     the reconstructed image, or {@code null} when the target was skipped
 * @param failure   why there is no image, or {@code null} on success
 * @param detail    human-readable failure detail, or {@code null}
 * @param savedTo   where the image was written, or {@code null}
 * @param saveError why a requested save failed, or {@code null}
 */
public record Outcome(
        Path source,
        RgbaImage image,
        FailureReason failure,
        String detail,
        Path savedTo,
        String saveError) {

    public Outcome {
        Objects.requireNonNull(source, "source");
        if ((image == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of image and failure must be set");
        }
    }

    public static Outcome success(Path source, RgbaImage image) {
        return new Outcome(source, Objects.requireNonNull(image, "image"), null, null, null, null);
    }

    public static Outcome failed(Path source, FailureReason reason, String detail) {
        return new Outcome(source, null, Objects.requireNonNull(reason, "reason"), detail, null, null);
    }

    public Outcome withSavedTo(Path path) {
        return new Outcome(source, image, failure, detail, path, null);
    }

    public Outcome withSaveError(String error) {
        return new Outcome(source, image, failure, detail, null, error);
    }

    public boolean isPresent() {
        return image != null;
    }

    public boolean saveFailed() {
        return saveError != null;
    }
}
