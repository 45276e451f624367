package dev.nuclr.spherify.service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

import dev.nuclr.spherify.config.SpherifyConfig;
import dev.nuclr.spherify.engine.SphereCenter;
import lombok.Builder;

/**
 * Batch-wide configuration, fixed for the whole run.
 *
 * @param saveDirectory    where results are written, or {@code null} to not save
 * @param outputPrefix     prepended to the input file name for saved results
 * @param display          show every result once the batch completes
 * @param center           sphere center
 * @param radius           sphere radius
 * @param samplingDensity  samples per output pixel
 * @param snapshotWidth    requested output width
 * @param snapshotHeight   requested output height
 * @param engineBinary     engine executable name or path
 * @param engineScript     engine entry script, or {@code null}
 * @param timeout          per-task engine timeout; {@link Duration#ZERO} for none
 * @param strictExitStatus fail on a non-zero engine exit status even with empty stderr
 * @param reconstruction   dimensions the engine output is decoded with
 * @param mode             concurrent or sequential dispatch
 * @param verbose          log progress at INFO
 */
@Builder(toBuilder = true)
public record BatchSettings(
        Path saveDirectory,
        String outputPrefix,
        boolean display,
        SphereCenter center,
        double radius,
        int samplingDensity,
        int snapshotWidth,
        int snapshotHeight,
        String engineBinary,
        Path engineScript,
        Duration timeout,
        boolean strictExitStatus,
        ReconstructionSize reconstruction,
        ExecutionMode mode,
        boolean verbose) {

    public BatchSettings {
        outputPrefix   = outputPrefix == null ? "" : outputPrefix;
        center         = center == null ? SphereCenter.ORIGIN : center;
        timeout        = timeout == null ? Duration.ZERO : timeout;
        reconstruction = reconstruction == null ? ReconstructionSize.SNAPSHOT : reconstruction;
        mode           = mode == null ? ExecutionMode.CONCURRENT : mode;
        Objects.requireNonNull(engineBinary, "engineBinary");
        if (samplingDensity <= 0) {
            throw new IllegalArgumentException("samplingDensity must be positive, was " + samplingDensity);
        }
        if (snapshotWidth <= 0 || snapshotHeight <= 0) {
            throw new IllegalArgumentException(
                    "Snapshot size must be positive: " + snapshotWidth + "x" + snapshotHeight);
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    /** A builder pre-filled from configuration defaults, displaying results concurrently. */
    public static BatchSettingsBuilder defaults(SpherifyConfig config) {
        return builder()
                .outputPrefix(config.getOutputPrefix())
                .display(true)
                .center(config.getCenter())
                .radius(config.getRadius())
                .samplingDensity(config.getSamplingDensity())
                .snapshotWidth(config.getSnapshotWidth())
                .snapshotHeight(config.getSnapshotHeight())
                .engineBinary(config.getEngineBinary())
                .engineScript(config.getEngineScript() == null ? null : Path.of(config.getEngineScript()))
                .timeout(Duration.ofSeconds(config.getEngineTimeoutSeconds()))
                .strictExitStatus(config.isStrictExitStatus())
                .reconstruction(config.getReconstruction())
                .mode(ExecutionMode.CONCURRENT);
    }
}
