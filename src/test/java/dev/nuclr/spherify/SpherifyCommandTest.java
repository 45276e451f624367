package dev.nuclr.spherify;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import dev.nuclr.spherify.config.SpherifyConfig;
import dev.nuclr.spherify.engine.SphereCenter;
import dev.nuclr.spherify.service.BatchSettings;
import dev.nuclr.spherify.service.Confirmation;
import dev.nuclr.spherify.service.ExecutionMode;
import dev.nuclr.spherify.service.ReconstructionSize;
import picocli.CommandLine;

class SpherifyCommandTest {

    @TempDir
    Path tmp;

    private ByteArrayOutputStream stdout;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
    }

    private SpherifyCommand command(Confirmation confirmation) {
        return new SpherifyCommand(new SpherifyConfig(), confirmation,
                new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private static CommandLine quiet(CommandLine cl) {
        cl.setErr(new PrintWriter(new StringWriter()));
        return cl;
    }

    // -------------------------------------------------------------------------
    // Option mapping

    @Test
    void defaultsComeFromConfiguration() {
        SpherifyCommand cmd = command(Confirmation.ALWAYS);
        new CommandLine(cmd).parseArgs("in.png");

        BatchSettings s = cmd.toSettings();

        assertEquals("julia", s.engineBinary());
        assertEquals(Path.of("spherify.jl"), s.engineScript());
        assertEquals("sph_", s.outputPrefix());
        assertEquals(SphereCenter.ORIGIN, s.center());
        assertEquals(500, s.snapshotWidth());
        assertEquals(Duration.ZERO, s.timeout());
        assertEquals(ExecutionMode.CONCURRENT, s.mode());
        assertTrue(s.display());
        assertNull(s.saveDirectory());
        assertFalse(s.verbose());
    }

    @Test
    void optionsOverrideConfiguration() {
        SpherifyCommand cmd = command(Confirmation.ALWAYS);
        new CommandLine(cmd).parseArgs(
                "-d", "out", "-f", "x_", "-D", "-c", "0.8,-1,420.69", "-r", "2.5", "-s", "4",
                "-W", "320", "-H", "240", "-J", "/opt/julia", "--engine-script", "proj.jl",
                "--timeout", "30", "--strict-exit-status", "--reconstruction", "SOURCE", "-v", "-C",
                "a.png", "dir");

        BatchSettings s = cmd.toSettings();

        assertEquals(Path.of("out"), s.saveDirectory());
        assertEquals("x_", s.outputPrefix());
        assertFalse(s.display());
        assertEquals(new SphereCenter(0.8, -1, 420.69), s.center());
        assertEquals(2.5, s.radius());
        assertEquals(4, s.samplingDensity());
        assertEquals(320, s.snapshotWidth());
        assertEquals(240, s.snapshotHeight());
        assertEquals("/opt/julia", s.engineBinary());
        assertEquals(Path.of("proj.jl"), s.engineScript());
        assertEquals(Duration.ofSeconds(30), s.timeout());
        assertTrue(s.strictExitStatus());
        assertEquals(ReconstructionSize.SOURCE, s.reconstruction());
        assertTrue(s.verbose());
        assertEquals(ExecutionMode.SEQUENTIAL, s.mode());
        assertEquals(2, cmd.inputPaths.size());
    }

    // -------------------------------------------------------------------------
    // Exit codes

    @Test
    void malformedCenterIsAUsageError() {
        int exit = quiet(new CommandLine(command(Confirmation.ALWAYS))).execute("-c", "1,2", "a.png");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
    }

    @Test
    void missingInputIsAUsageError() {
        int exit = quiet(new CommandLine(command(Confirmation.ALWAYS))).execute("-D");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
    }

    @Test
    void nonPositiveSnapshotIsAUsageError() {
        int exit = quiet(new CommandLine(command(Confirmation.ALWAYS))).execute("-W", "0", "-D", "a.png");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
    }

    @Test
    void decliningThePromptAborts() {
        int exit = new CommandLine(command(Confirmation.NEVER)).execute("-D", tmp.resolve("a.png").toString());

        assertEquals(SpherifyCommand.EXIT_ABORTED, exit);
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Aborted."));
    }

    @Test
    void consolePromptAcceptsYesAndRejectsEndOfInput() {
        PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);

        assertTrue(new ConsoleConfirmation(input("maybe\nYes\n"), sink).confirm("Proceed?"));
        assertFalse(new ConsoleConfirmation(input("n\n"), sink).confirm("Proceed?"));
        assertFalse(new ConsoleConfirmation(input(""), sink).confirm("Proceed?"));
    }

    private static ByteArrayInputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    // -------------------------------------------------------------------------
    // End to end with a shell engine

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void savesResultsAndPrintsExecutionTime() throws Exception {
        Path engine = Files.writeString(tmp.resolve("identity.sh"), "#!/bin/sh\nexec cat\n");
        TestImages.writePng(tmp.resolve("a.png"), 8, 8, 1);
        Path out = tmp.resolve("out");

        int exit = new CommandLine(command(Confirmation.NEVER)).execute(
                "-D", "-T", "-d", out.toString(), "-J", "sh", "--engine-script", engine.toString(),
                "-W", "8", "-H", "8", tmp.resolve("a.png").toString());

        assertEquals(0, exit);
        assertTrue(Files.exists(out.resolve("sph_a.png")));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Execution time:"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void failedSaveGivesDistinctExitCode() throws Exception {
        Path engine = Files.writeString(tmp.resolve("identity.sh"), "#!/bin/sh\nexec cat\n");
        TestImages.writePng(tmp.resolve("a.png"), 8, 8, 1);
        Path occupied = Files.writeString(tmp.resolve("occupied"), "not a directory");

        int exit = new CommandLine(command(Confirmation.NEVER)).execute(
                "-D", "-d", occupied.toString(), "-J", "sh", "--engine-script", engine.toString(),
                "--reconstruction", "SOURCE", tmp.resolve("a.png").toString());

        assertEquals(SpherifyCommand.EXIT_SAVE_FAILED, exit);
    }
}
