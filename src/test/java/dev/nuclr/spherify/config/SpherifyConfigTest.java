package dev.nuclr.spherify.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import dev.nuclr.spherify.engine.SphereCenter;
import dev.nuclr.spherify.service.ReconstructionSize;

class SpherifyConfigTest {

    @Test
    void classpathDefaultsAreLoaded() {
        SpherifyConfig config = new SpherifyConfig();

        assertEquals("julia", config.getEngineBinary());
        assertEquals("spherify.jl", config.getEngineScript());
        assertEquals(0, config.getEngineTimeoutSeconds());
        assertFalse(config.isStrictExitStatus());
        assertEquals(SphereCenter.ORIGIN, config.getCenter());
        assertEquals(1.0, config.getRadius());
        assertEquals(1, config.getSamplingDensity());
        assertEquals(500, config.getSnapshotWidth());
        assertEquals(500, config.getSnapshotHeight());
        assertEquals("sph_", config.getOutputPrefix());
        assertEquals(ReconstructionSize.SNAPSHOT, config.getReconstruction());
    }

    @Test
    void emptyPropertiesFallBackToBuiltInDefaults() {
        SpherifyConfig config = new SpherifyConfig(new Properties());

        assertEquals("julia", config.getEngineBinary());
        assertEquals("spherify.jl", config.getEngineScript());
        assertEquals(500, config.getSnapshotWidth());
        assertEquals(ReconstructionSize.SNAPSHOT, config.getReconstruction());
    }

    @Test
    void explicitValuesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty("engine.binary", "/opt/julia/bin/julia");
        p.setProperty("engine.script", "");
        p.setProperty("engine.timeoutSeconds", "120");
        p.setProperty("engine.strictExitStatus", "true");
        p.setProperty("sphere.center", "1,2,3.5");
        p.setProperty("sphere.radius", "0.25");
        p.setProperty("sphere.samplingDensity", "4");
        p.setProperty("snapshot.width", "800");
        p.setProperty("snapshot.height", "600");
        p.setProperty("output.prefix", "out_");
        p.setProperty("output.reconstruction", "source");

        SpherifyConfig config = new SpherifyConfig(p);

        assertEquals("/opt/julia/bin/julia", config.getEngineBinary());
        assertNull(config.getEngineScript(), "Blank script means a self-contained engine binary");
        assertEquals(120, config.getEngineTimeoutSeconds());
        assertTrue(config.isStrictExitStatus());
        assertEquals(new SphereCenter(1, 2, 3.5), config.getCenter());
        assertEquals(0.25, config.getRadius());
        assertEquals(4, config.getSamplingDensity());
        assertEquals(800, config.getSnapshotWidth());
        assertEquals(600, config.getSnapshotHeight());
        assertEquals("out_", config.getOutputPrefix());
        assertEquals(ReconstructionSize.SOURCE, config.getReconstruction());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        Properties p = new Properties();
        p.setProperty("engine.timeoutSeconds", "-5");
        p.setProperty("sphere.center", "1,2");
        p.setProperty("sphere.radius", "big");
        p.setProperty("sphere.samplingDensity", "0");
        p.setProperty("snapshot.width", "wide");
        p.setProperty("output.reconstruction", "THUMBNAIL");

        SpherifyConfig config = new SpherifyConfig(p);

        assertEquals(0, config.getEngineTimeoutSeconds());
        assertEquals(SphereCenter.ORIGIN, config.getCenter());
        assertEquals(1.0, config.getRadius());
        assertEquals(1, config.getSamplingDensity());
        assertEquals(500, config.getSnapshotWidth());
        assertEquals(ReconstructionSize.SNAPSHOT, config.getReconstruction());
    }
}
