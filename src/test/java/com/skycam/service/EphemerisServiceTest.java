package com.skycam.service;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import com.skycam.model.CelestialObject;
import com.skycam.model.Observer;
import java.time.Instant;
import java.util.List;
import org.junit.Test;

public class EphemerisServiceTest {

    private final EphemerisService ephemeris = new EphemerisService();

    private static Observer laPalma(String time) {
        return new Observer(Math.toRadians(28.76), Math.toRadians(-17.89), 2200, Instant.parse(time));
    }

    @Test
    public void sunDeclinationAtSolstice() {
        CelestialObject sun = ephemeris.sun(laPalma("2024-06-20T20:51:00Z"));
        assertEquals(23.44, Math.toDegrees(sun.dec), 0.05);
    }

    @Test
    public void sunRightAscensionAtEquinox() {
        CelestialObject sun = ephemeris.sun(laPalma("2024-03-20T03:06:00Z"));
        assertEquals(0, Math.sin(sun.ra), 0.01);
        assertEquals(0, Math.toDegrees(sun.dec), 0.05);
    }

    @Test
    public void sunIsHighAtLocalNoonAndLowAtMidnight() {
        CelestialObject noon = ephemeris.sun(laPalma("2024-06-21T13:12:00Z"));
        CelestialObject midnight = ephemeris.sun(laPalma("2024-06-21T01:12:00Z"));
        assertTrue(Math.toDegrees(noon.altitude) > 80);
        assertTrue(Math.toDegrees(midnight.altitude) < -30);
        assertEquals(-10, noon.id);
    }

    @Test
    public void moonPhaseFullAndNew() {
        assertTrue(ephemeris.moonPhase(laPalma("2024-01-25T17:54:00Z")) > 0.97);
        assertTrue(ephemeris.moonPhase(laPalma("2024-01-11T11:57:00Z")) < 0.03);
    }

    @Test
    public void moonStaysNearEcliptic() {
        for (int day = 1; day <= 28; day += 3) {
            CelestialObject moon = ephemeris.moon(laPalma(String.format("2024-02-%02dT00:00:00Z", day)));
            assertTrue(Math.abs(Math.toDegrees(moon.dec)) < 29.5);
            assertEquals(-11, moon.id);
        }
    }

    @Test
    public void planetsHavePlausibleMagnitudes() {
        List<CelestialObject> planets = ephemeris.planets(laPalma("2024-01-01T00:00:00Z"));
        assertEquals(7, planets.size());
        assertEquals("Mercury", planets.get(0).name);
        assertEquals("Neptune", planets.get(6).name);
        assertEquals(-100, planets.get(0).id);
        assertTrue(planets.get(1).magnitude > -4.9 && planets.get(1).magnitude < -3.7);
        assertTrue(planets.get(3).magnitude > -3.0 && planets.get(3).magnitude < -1.5);
        assertTrue(planets.get(4).magnitude > -0.6 && planets.get(4).magnitude < 1.6);
        assertTrue(planets.get(6).magnitude > 7.5 && planets.get(6).magnitude < 8.2);
        for (CelestialObject p : planets) {
            assertTrue(p.name, p.ra >= 0 && p.ra < 2 * Math.PI);
            assertTrue(p.name, Double.isFinite(p.altitude));
        }
    }

    @Test
    public void keplerSolutionSatisfiesEquation() {
        double m = 1.2;
        double e = 0.2;
        double ecc = EphemerisService.solveKepler(m, e);
        assertEquals(m, ecc - e * Math.sin(ecc), 1e-12);
    }
}
