package com.skycam.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Properties;
import org.junit.Before;
import org.junit.Test;

public class SkycamConfigTest {

    private SkycamConfig config;

    @Before
    public void setUp() throws IOException {
        config = SkycamConfig.load(SkycamConfigTest.class.getResourceAsStream("/com/skycam/test-camera.properties"));
    }

    @Test
    public void readsCameraModel() {
        CameraModel cam = config.getCameraModel();
        assertEquals(101, cam.width);
        assertEquals(101, cam.height);
        assertEquals(50, cam.zenithX, 0);
        assertEquals(45, cam.radius, 0);
        assertSame(Projection.LINEAR, cam.projection);
        assertEquals(0, cam.minAltitude(), 1e-12);
        assertTrue(cam.matches(101, 101));
        assertFalse(cam.matches(100, 101));
    }

    @Test
    public void readsSexagesimalSite() {
        Observer obs = config.observerAt(Instant.parse("2024-01-01T00:00:00Z"));
        assertEquals(Math.toRadians(28 + 45 / 60.0 + 42 / 3600.0), obs.latitude, 1e-12);
        assertEquals(Math.toRadians(-(17 + 53 / 60.0 + 28 / 3600.0)), obs.longitude, 1e-12);
        assertEquals(2200, obs.elevation, 0);
    }

    @Test
    public void parsesAngles() {
        assertEquals(-17.5, SkycamConfig.parseAngle("k", "-17:30"), 1e-12);
        assertEquals(-0.5, SkycamConfig.parseAngle("k", "-0:30:00"), 1e-12);
        assertEquals(12.25, SkycamConfig.parseAngle("k", "12.25"), 1e-12);
    }

    @Test
    public void readsAnalysisSection() {
        assertEquals(Arrays.asList(1.0), config.getKernelSizes());
        assertEquals("LoG", config.getFunctionName());
        assertEquals(7, config.getVmagLimit(), 0);
        assertEquals(0, config.getVisibleUpperLimit()[0], 0);
        assertEquals(-3, config.getVisibleUpperLimit()[1], 0);
        assertEquals(-8, config.getVisibleLowerLimit()[1], 0);
        assertTrue(config.isCloudMapEnabled());
        assertFalse(config.isRateScanEnabled());
        assertEquals(0.57, config.getAirmassAbsorption(), 0);
        assertEquals(2, config.getThreads());
    }

    @Test
    public void appliesDefaults() {
        SkycamConfig empty = new SkycamConfig(new Properties());
        assertEquals("GTC", empty.getName());
        assertEquals(90, empty.getOpeningAngle(), 0);
        assertEquals("All", empty.getFunctionName());
        assertEquals(6, empty.getVmagLimit(), 0);
        assertEquals(10, empty.getMinAngleToMoon(), 0);
        assertEquals("spherical", empty.getAirmassModelName());
        assertEquals("", empty.getCropX());
        assertEquals(Arrays.asList(1.0), empty.getKernelSizes());
        assertFalse(empty.isBlobSizeEnabled());
    }

    @Test(expected = ConfigException.class)
    public void missingVisibilityLimitIsRejected() {
        new SkycamConfig(new Properties()).getVisibleUpperLimit();
    }

    @Test(expected = ConfigException.class)
    public void missingZenithIsRejected() {
        Properties p = new Properties();
        p.setProperty("image.resolution", "10, 10");
        p.setProperty("image.radius", "5");
        new SkycamConfig(p).getCameraModel();
    }

    @Test(expected = ConfigException.class)
    public void badNumberIsRejected() {
        Properties p = new Properties();
        p.setProperty("analysis.vmaglimit", "bright");
        new SkycamConfig(p).getVmagLimit();
    }
}
