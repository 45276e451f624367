package dev.nuclr.spherify;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import dev.nuclr.spherify.config.SpherifyConfig;
import dev.nuclr.spherify.engine.SphereCenter;
import dev.nuclr.spherify.service.AbortedException;
import dev.nuclr.spherify.service.BatchEngine;
import dev.nuclr.spherify.service.BatchReport;
import dev.nuclr.spherify.service.BatchSettings;
import dev.nuclr.spherify.service.Confirmation;
import dev.nuclr.spherify.service.ExecutionMode;
import dev.nuclr.spherify.service.Outcome;
import dev.nuclr.spherify.service.ReconstructionSize;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command-line entry point. Options left unset fall back to
 * {@code spherify.properties}.
 *
 * <p>Exit codes: 0 done (even with skipped images), 1 aborted at the
 * confirmation prompt, 2 invalid usage, 3 a requested save failed.
 */
@Slf4j
@Command(
        name = "spherify",
        description = "Project an image onto a 2-sphere and snapshot the result.",
        version = "spherify 1.0",
        showDefaultValues = true,
        mixinStandardHelpOptions = true
)
public class SpherifyCommand implements Callable<Integer> {

    static final int EXIT_ABORTED = 1;
    static final int EXIT_SAVE_FAILED = 3;

    @Parameters(arity = "1..*", paramLabel = "PATH",
            description = "Image files, or directories whose files (not sub-directories) are used as input.")
    List<Path> inputPaths;

    @Option(names = {"-d", "--save-directory"},
            description = "Save the resulting image(s) there. If omitted, results are only displayed.")
    Path saveDirectory;

    @Option(names = {"-f", "--output-file-prefix"},
            description = "Prefix added to the input file's name to name the saved result.")
    String outputFilePrefix;

    @Option(names = {"-D", "--no-display"},
            description = "Do not display the resulting images at the end.")
    boolean noDisplay;

    @Option(names = {"-c", "--center-point"}, converter = SphereCenterConverter.class, paramLabel = "X,Y,Z",
            description = "Center of the 2-sphere as three comma-separated numbers without spaces, e.g. 0.8,-1,420.69.")
    SphereCenter centerPoint;

    @Option(names = {"-r", "--radius"}, description = "Radius of the 2-sphere.")
    Double radius;

    @Option(names = {"-s", "--sampling-density"}, description = "Number of samples per pixel.")
    Integer samplingDensity;

    @Option(names = {"-W", "--snapshot-width"}, description = "Width of the snapshot in pixels.")
    Integer snapshotWidth;

    @Option(names = {"-H", "--snapshot-height"}, description = "Height of the snapshot in pixels.")
    Integer snapshotHeight;

    @Option(names = {"-J", "--engine-binary"},
            description = "Engine executable, looked up on PATH unless given as a path.")
    String engineBinary;

    @Option(names = "--engine-script",
            description = "Script passed to the engine executable as first argument. The default "
                    + "spherify.jl is resolved against the working directory and is not bundled.")
    Path engineScript;

    @Option(names = "--timeout", paramLabel = "SECONDS",
            description = "Kill an engine process after this many seconds; 0 waits forever.")
    Integer timeoutSeconds;

    @Option(names = "--strict-exit-status",
            description = "Treat a non-zero engine exit status as failure even without stderr output.")
    boolean strictExitStatus;

    @Option(names = "--reconstruction",
            description = "Decode engine output at the SNAPSHOT size or the SOURCE image size.")
    ReconstructionSize reconstruction;

    @Option(names = {"-v", "--verbose"}, description = "Log informative progress output.")
    boolean verbose;

    @Option(names = {"-C", "--consecutive"},
            description = "Process images one after another instead of concurrently. "
                    + "Uses far less memory for many large images.")
    boolean consecutive;

    @Option(names = {"-T", "--get-exec-time"}, description = "Print the total execution time at the end.")
    boolean getExecTime;

    @Spec
    CommandSpec spec;

    private final SpherifyConfig config;
    private final Confirmation confirmation;
    private final PrintStream out;

    public SpherifyCommand() {
        this(new SpherifyConfig(), new ConsoleConfirmation(System.in, System.out), System.out);
    }

    /** Package-private: inject configuration and prompt for tests. */
    SpherifyCommand(SpherifyConfig config, Confirmation confirmation, PrintStream out) {
        this.config = config;
        this.confirmation = confirmation;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SpherifyCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        BatchSettings settings;
        try {
            settings = toSettings();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        BatchEngine engine = new BatchEngine(settings, confirmation);
        try {
            engine.preflight();
        } catch (AbortedException e) {
            out.println("Aborted.");
            return EXIT_ABORTED;
        }

        BatchReport report = engine.run(inputPaths);
        if (getExecTime) {
            out.printf("Execution time: %.1f s%n", report.elapsed().toMillis() / 1000.0);
        }
        if (report.hasSaveFailures()) {
            for (Outcome o : report.saveFailures()) {
                log.error("Result for `{}` was not saved: {}", o.source(), o.saveError());
            }
            return EXIT_SAVE_FAILED;
        }
        return 0;
    }

    /**
     * Merges options over configuration defaults.
     *
     * @throws IllegalArgumentException if the merged values are out of range
     */
    BatchSettings toSettings() {
        BatchSettings.BatchSettingsBuilder b = BatchSettings.defaults(config)
                .saveDirectory(saveDirectory)
                .display(!noDisplay)
                .strictExitStatus(strictExitStatus || config.isStrictExitStatus())
                .mode(consecutive ? ExecutionMode.SEQUENTIAL : ExecutionMode.CONCURRENT)
                .verbose(verbose);
        if (outputFilePrefix != null) b.outputPrefix(outputFilePrefix);
        if (centerPoint != null) b.center(centerPoint);
        if (radius != null) b.radius(radius);
        if (samplingDensity != null) b.samplingDensity(samplingDensity);
        if (snapshotWidth != null) b.snapshotWidth(snapshotWidth);
        if (snapshotHeight != null) b.snapshotHeight(snapshotHeight);
        if (engineBinary != null) b.engineBinary(engineBinary);
        if (engineScript != null) b.engineScript(engineScript);
        if (timeoutSeconds != null) b.timeout(Duration.ofSeconds(timeoutSeconds));
        if (reconstruction != null) b.reconstruction(reconstruction);
        return b.build();
    }

    static final class SphereCenterConverter implements CommandLine.ITypeConverter<SphereCenter> {
        @Override
        public SphereCenter convert(String value) {
            try {
                return SphereCenter.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
