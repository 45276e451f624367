package dev.nuclr.spherify.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import dev.nuclr.spherify.engine.EngineInvocation;
import dev.nuclr.spherify.engine.EngineLocator;
import dev.nuclr.spherify.engine.EngineNotFoundException;
import dev.nuclr.spherify.engine.EngineProtocol;
import dev.nuclr.spherify.engine.EngineResult;
import dev.nuclr.spherify.engine.EngineRunner;
import dev.nuclr.spherify.engine.EngineTimeoutException;
import dev.nuclr.spherify.engine.MalformedEngineOutputException;
import dev.nuclr.spherify.image.DesktopImageViewer;
import dev.nuclr.spherify.image.ImageGateway;
import dev.nuclr.spherify.image.ImageLoadException;
import dev.nuclr.spherify.image.ImageViewer;
import dev.nuclr.spherify.image.RgbaImage;

/**
 * Drives every input file through load, engine exchange, reconstruction and
 * save, and collects one {@link Outcome} per file.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Construct with {@link BatchSettings} and the collaborators (or let the
 *       convenience constructor pick them from the settings).</li>
 *   <li>Call {@link #preflight()} before any processing; it asks for
 *       confirmation when results would be neither saved nor displayed.</li>
 *   <li>Call {@link #run(List)} once per batch.</li>
 * </ol>
 *
 * <p>Per-target failures (unreadable or unrecognised input, engine stderr,
 * launch failure, timeout, malformed output) end up as absent outcomes and
 * never stop sibling targets. Anything else propagates.
 */
public final class BatchEngine {

    private final BatchSettings settings;
    private final EngineRunner runner;
    private final ImageGateway gateway;
    private final ResultSink sink;
    private final Confirmation confirmation;
    private final RunLog runLog;

    public BatchEngine(BatchSettings settings, Confirmation confirmation) {
        this(settings, settings.mode().newRunner(), new ImageGateway(), null, confirmation);
    }

    /**
     * @param viewer display capability; {@code null} uses the platform desktop viewer
     */
    public BatchEngine(BatchSettings settings, EngineRunner runner, ImageGateway gateway,
                       ImageViewer viewer, Confirmation confirmation) {
        this.settings = settings;
        this.runner = runner;
        this.gateway = gateway;
        this.confirmation = confirmation;
        this.runLog = RunLog.forClass(BatchEngine.class, settings.verbose());
        this.sink = new ResultSink(
                gateway,
                viewer != null ? viewer : new DesktopImageViewer(gateway),
                settings.saveDirectory(),
                settings.outputPrefix(),
                OutputNaming.PREFIXED,
                runLog);
    }

    // -------------------------------------------------------------------------
    // Pre-flight

    /**
     * Checks configuration before any file is touched.
     *
     * @throws AbortedException if results would be neither displayed nor saved
     *         and the user does not confirm
     */
    public void preflight() throws AbortedException {
        if (!settings.display() && settings.saveDirectory() == null) {
            runLog.warn("The results will be neither displayed nor saved.");
            if (!confirmation.confirm("Are you sure this is what you want?")) {
                throw new AbortedException("Neither displaying nor saving results");
            }
        }
        Optional<Path> engine = new EngineLocator().locate(settings.engineBinary());
        if (engine.isEmpty()) {
            runLog.warn("Engine executable `{}` not found; every image will likely fail",
                    settings.engineBinary());
        } else {
            runLog.progress("Using engine `{}`", engine.get());
        }
        missingEngineScript().ifPresent(script -> runLog.warn(
                "Engine script `{}` not found (looked at {}); set --engine-script or engine.script, "
                        + "or leave engine.script empty for a self-contained engine",
                script, script.toAbsolutePath()));
    }

    /** The configured engine script, if one is set and is not a file. */
    Optional<Path> missingEngineScript() {
        Path script = settings.engineScript();
        return script != null && !Files.isRegularFile(script) ? Optional.of(script) : Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Batch

    /**
     * Processes every file the targets resolve to and, if enabled, displays
     * the results once all are done.
     *
     * @return one outcome per resolved file, in input order
     */
    public BatchReport run(List<Path> targets) {
        long startNs = System.nanoTime();
        List<Path> files = new TargetExpander(runLog).expand(targets);
        runLog.progress("Processing {} file(s) in {} mode", files.size(), settings.mode());

        List<Outcome> outcomes = settings.mode() == ExecutionMode.SEQUENTIAL
                ? runSequential(files)
                : runConcurrent(files);

        BatchReport report = new BatchReport(outcomes, Duration.ofNanos(System.nanoTime() - startNs));
        runLog.progress("Finished: {} succeeded, {} skipped", report.successes().size(), report.failures().size());
        if (settings.display()) {
            sink.displayAll(report);
        }
        return report;
    }

    private List<Outcome> runSequential(List<Path> files) {
        List<Outcome> outcomes = new ArrayList<>(files.size());
        for (Path file : files) {
            outcomes.add(await(start(file)));
        }
        return outcomes;
    }

    private List<Outcome> runConcurrent(List<Path> files) {
        List<CompletableFuture<Outcome>> tasks = new ArrayList<>(files.size());
        for (Path file : files) {
            tasks.add(start(file));
        }
        List<Outcome> outcomes = new ArrayList<>(tasks.size());
        for (CompletableFuture<Outcome> task : tasks) {
            outcomes.add(await(task));
        }
        return outcomes;
    }

    private static Outcome await(CompletableFuture<Outcome> task) {
        try {
            return task.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Unexpected task failure", cause);
        }
    }

    // -------------------------------------------------------------------------
    // Task

    /**
     * Loads the file and launches its engine exchange. Decoding happens here
     * on the dispatching thread; the returned future completes when the
     * engine has answered and the result is rebuilt and saved.
     */
    CompletableFuture<Outcome> start(Path file) {
        RgbaImage image;
        try {
            image = gateway.load(file);
        } catch (ImageLoadException e) {
            return CompletableFuture.completedFuture(skipLoad(file, e));
        }
        runLog.progress("Image of size {} x {} pixels loaded from `{}`", image.width(), image.height(), file);

        EngineInvocation inv = new EngineInvocation(
                image.width(),
                image.height(),
                settings.center(),
                settings.radius(),
                settings.samplingDensity(),
                settings.snapshotWidth(),
                settings.snapshotHeight(),
                settings.engineScript(),
                settings.engineBinary());
        List<String> command = EngineProtocol.command(inv);
        byte[] input = EngineProtocol.checkInput(inv, gateway.toBytes(image));
        runLog.progress("Launching subprocess: `{}`", String.join(" ", command));

        return runner.run(command, input, settings.timeout())
                .handle((result, error) -> error != null
                        ? skipEngine(file, error)
                        : finish(file, inv, result));
    }

    private Outcome finish(Path file, EngineInvocation inv, EngineResult result) {
        if (result.hasStderr()) {
            runLog.error("Engine exited with an error for `{}`:\n{}", file, result.stderrText());
            return Outcome.failed(file, FailureReason.ENGINE_STDERR, result.firstStderrLine());
        }
        if (settings.strictExitStatus() && !result.success()) {
            runLog.error("Engine exited with status {} for `{}`", result.exitCode(), file);
            return Outcome.failed(file, FailureReason.ENGINE_EXIT_STATUS, "exit status " + result.exitCode());
        }
        runLog.progress("Received {} bytes from engine subprocess", result.stdout().length);

        int width = settings.reconstruction().width(inv);
        int height = settings.reconstruction().height(inv);
        RgbaImage output;
        try {
            output = gateway.fromBytes(EngineProtocol.raster(result, width, height), width, height);
        } catch (MalformedEngineOutputException e) {
            runLog.error("Cannot build a {} x {} image for `{}`: {}", width, height, file, e.getMessage());
            return Outcome.failed(file, FailureReason.MALFORMED_OUTPUT, e.getMessage());
        }
        runLog.progress("Constructed a new {} x {} pixel image", width, height);
        return sink.persist(Outcome.success(file, output));
    }

    private Outcome skipLoad(Path file, ImageLoadException e) {
        if (e.getKind() == ImageLoadException.Kind.UNREADABLE) {
            runLog.error("{}; skipping...", e.getMessage());
            return Outcome.failed(file, FailureReason.UNREADABLE, e.getMessage());
        }
        runLog.warn("{}; skipping...", e.getMessage());
        return Outcome.failed(file, FailureReason.UNRECOGNIZED, e.getMessage());
    }

    private Outcome skipEngine(Path file, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (!(cause instanceof IOException)) {
            throw new CompletionException(cause);
        }
        FailureReason reason;
        if (cause instanceof EngineNotFoundException) {
            reason = FailureReason.ENGINE_NOT_FOUND;
        } else if (cause instanceof EngineTimeoutException) {
            reason = FailureReason.ENGINE_TIMEOUT;
        } else {
            reason = FailureReason.ENGINE_IO;
        }
        runLog.error("Engine failed for `{}`: {}; skipping...", file, cause.getMessage());
        return Outcome.failed(file, reason, cause.getMessage());
    }
}
