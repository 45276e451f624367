package dev.nuclr.spherify.service;

import java.nio.file.Path;

import dev.nuclr.spherify.image.ImageGateway;
import dev.nuclr.spherify.image.ImageViewer;
import dev.nuclr.spherify.image.ImageWriteException;

/**
 * Persists and displays finished results. Saving happens inside each task as
 * soon as its image is rebuilt; displaying happens once, after the whole
 * batch has completed.
 */
public final class ResultSink {

    private final ImageGateway gateway;
    private final ImageViewer viewer;
    private final Path saveDirectory;
    private final String prefix;
    private final OutputNaming naming;
    private final RunLog runLog;

    public ResultSink(ImageGateway gateway, ImageViewer viewer, Path saveDirectory,
                      String prefix, OutputNaming naming, RunLog runLog) {
        this.gateway = gateway;
        this.viewer = viewer;
        this.saveDirectory = saveDirectory;
        this.prefix = prefix;
        this.naming = naming;
        this.runLog = runLog;
    }

    public boolean savesResults() {
        return saveDirectory != null;
    }

    /** Destination for the result of {@code source}; last write wins on collisions. */
    public Path destinationFor(Path source) {
        return saveDirectory.resolve(naming.fileName(prefix, source));
    }

    /**
     * Writes a present image to the save directory, if one is configured.
     * A write failure is logged and recorded on the returned outcome; it
     * never undoes results already saved for other targets.
     */
    public Outcome persist(Outcome outcome) {
        if (!outcome.isPresent() || !savesResults()) {
            return outcome;
        }
        Path out = destinationFor(outcome.source());
        runLog.progress("Saving image to `{}`...", out);
        try {
            gateway.save(outcome.image(), out);
        } catch (ImageWriteException e) {
            runLog.error("{}", e.getMessage());
            return outcome.withSaveError(e.getMessage());
        }
        runLog.progress("Image saved successfully to `{}`", out);
        return outcome.withSavedTo(out);
    }

    /** Hands every present image of the batch to the viewer, one window each. */
    public void displayAll(BatchReport report) {
        for (Outcome outcome : report.outcomes()) {
            if (outcome.isPresent()) {
                viewer.show(outcome.image(), String.valueOf(outcome.source().getFileName()));
            }
        }
    }
}
