package dev.nuclr.spherify.config;

import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import dev.nuclr.spherify.engine.SphereCenter;
import dev.nuclr.spherify.service.ReconstructionSize;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Defaults loaded from {@code spherify.properties} on the classpath.
 * All fields are read-only after construction; fall back to safe defaults if the
 * file is absent or a value does not parse. Command-line options override them.
 */
@Slf4j
@Getter
public final class SpherifyConfig {

    private static final String PROPS_RESOURCE = "spherify.properties";

    /** Engine executable name (resolved via {@code PATH}) or path. */
    private final String engineBinary;

    /** Engine entry script passed as first argument, or {@code null} for none. */
    private final String engineScript;

    /** Seconds before an engine process is forcibly killed; 0 waits forever. */
    private final int engineTimeoutSeconds;

    /** Treat a non-zero engine exit status as failure even with empty stderr. */
    private final boolean strictExitStatus;

    private final SphereCenter center;

    private final double radius;

    /** Samples per output pixel. */
    private final int samplingDensity;

    private final int snapshotWidth;

    private final int snapshotHeight;

    /** Prepended to the input file name to name the saved result. */
    private final String outputPrefix;

    /** Which dimensions the engine output is decoded with. */
    private final ReconstructionSize reconstruction;

    public SpherifyConfig() {
        this(loadProps());
    }

    /** Package-private: build from explicit properties in tests. */
    SpherifyConfig(Properties p) {
        String rawBinary = p.getProperty("engine.binary", "").trim();
        engineBinary         = rawBinary.isEmpty() ? "julia" : rawBinary;
        String rawScript     = p.getProperty("engine.script", "spherify.jl").trim();
        engineScript         = rawScript.isEmpty() ? null : rawScript;
        engineTimeoutSeconds = parseNonNegativeInt(p, "engine.timeoutSeconds", 0);
        strictExitStatus     = Boolean.parseBoolean(p.getProperty("engine.strictExitStatus", "false").trim());
        center               = parseCenter(p, "sphere.center", SphereCenter.ORIGIN);
        radius               = parseDouble(p, "sphere.radius", 1.0);
        samplingDensity      = parsePositiveInt(p, "sphere.samplingDensity", 1);
        snapshotWidth        = parsePositiveInt(p, "snapshot.width", 500);
        snapshotHeight       = parsePositiveInt(p, "snapshot.height", 500);
        outputPrefix         = p.getProperty("output.prefix", "sph_").trim();
        reconstruction       = parseReconstruction(p, "output.reconstruction", ReconstructionSize.SNAPSHOT);
    }

    private static Properties loadProps() {
        Properties p = new Properties();
        try (InputStream in = SpherifyConfig.class
                .getClassLoader()
                .getResourceAsStream(PROPS_RESOURCE)) {
            if (in != null) {
                p.load(in);
            } else {
                log.debug("{} not found on classpath, using built-in defaults", PROPS_RESOURCE);
            }
        } catch (Exception e) {
            log.warn("Could not load {}: {}", PROPS_RESOURCE, e.getMessage());
        }
        return p;
    }

    private static int parsePositiveInt(Properties p, String key, int def) {
        int value = parseInt(p, key, def);
        if (value <= 0) {
            log.warn("{} must be positive, using default {}", key, def);
            return def;
        }
        return value;
    }

    private static int parseNonNegativeInt(Properties p, String key, int def) {
        int value = parseInt(p, key, def);
        if (value < 0) {
            log.warn("{} must not be negative, using default {}", key, def);
            return def;
        }
        return value;
    }

    private static int parseInt(Properties p, String key, int def) {
        try {
            return Integer.parseInt(p.getProperty(key, String.valueOf(def)).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}, using default {}", key, def);
            return def;
        }
    }

    private static double parseDouble(Properties p, String key, double def) {
        try {
            return Double.parseDouble(p.getProperty(key, String.valueOf(def)).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}, using default {}", key, def);
            return def;
        }
    }

    private static SphereCenter parseCenter(Properties p, String key, SphereCenter def) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return def;
        }
        try {
            return SphereCenter.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}, using default {}", key, def.toArgument());
            return def;
        }
    }

    private static ReconstructionSize parseReconstruction(Properties p, String key, ReconstructionSize def) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return def;
        }
        try {
            return ReconstructionSize.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}, using default {}", key, def);
            return def;
        }
    }
}
