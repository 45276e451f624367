package dev.nuclr.spherify.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire contract with the external projection engine, independent of how the
 * process is spawned.
 *
 * <p>Command line (positional, order fixed):
 * <pre>
 *   &lt;binary&gt; [&lt;script&gt;] &lt;w&gt;,&lt;h&gt; &lt;cx&gt;,&lt;cy&gt;,&lt;cz&gt; &lt;radius&gt; &lt;density&gt; &lt;snapW&gt;,&lt;snapH&gt;
 * </pre>
 * stdin carries exactly {@code w*h*4} row-major RGBA bytes. stdout carries the
 * output raster in the same layout. Anything on stderr is a failure.
 */
public final class EngineProtocol {

    public static final int BYTES_PER_PIXEL = 4;

    private EngineProtocol() {}

    /** Builds the full argument list for {@link EngineRunner#run}. */
    public static List<String> command(EngineInvocation inv) {
        List<String> cmd = new ArrayList<>();
        cmd.add(inv.binary());
        if (inv.script() != null) {
            cmd.add(inv.script().toString());
        }
        cmd.add(inv.width() + "," + inv.height());
        cmd.add(inv.center().toArgument());
        cmd.add(Double.toString(inv.radius()));
        cmd.add(Integer.toString(inv.samplingDensity()));
        cmd.add(inv.snapshotWidth() + "," + inv.snapshotHeight());
        return cmd;
    }

    /**
     * Checks that {@code input} matches the size declared on the command line.
     *
     * @throws IllegalArgumentException if the lengths differ
     */
    public static byte[] checkInput(EngineInvocation inv, byte[] input) {
        if (input.length != inv.inputLength()) {
            throw new IllegalArgumentException(String.format(
                    "Engine input must be %d bytes for %dx%d, got %d",
                    inv.inputLength(), inv.width(), inv.height(), input.length));
        }
        return input;
    }

    /**
     * Returns the engine's stdout as a raster of {@code width x height} pixels.
     *
     * @throws MalformedEngineOutputException if the byte count does not match,
     *         or if {@code width x height} pixels cannot be held in one array
     */
    public static byte[] raster(EngineResult result, int width, int height)
            throws MalformedEngineOutputException {
        long expected = (long) width * height * BYTES_PER_PIXEL;
        byte[] out = result.stdout();
        if (expected > Integer.MAX_VALUE || out.length != expected) {
            throw new MalformedEngineOutputException(expected, out.length);
        }
        return out;
    }
}
