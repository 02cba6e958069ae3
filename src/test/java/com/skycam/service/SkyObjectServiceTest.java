package com.skycam.service;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import com.skycam.model.CameraModel;
import com.skycam.model.Catalog;
import com.skycam.model.CelestialObject;
import com.skycam.model.CropMask;
import com.skycam.model.Observer;
import com.skycam.model.Projection;
import com.skycam.model.SkyObjects;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class SkyObjectServiceTest {

    private static final CameraModel CAMERA = new CameraModel(100, 100, 90, Projection.LINEAR, 0, 201, 201, 90);
    private static final Observer OBSERVER = new Observer(Math.toRadians(28.76), Math.toRadians(-17.89), 2200,
            Instant.parse("2024-03-01T23:00:00Z"));

    private static CelestialObject zenithStar(int id, double mag) {
        return CelestialObject.star(id, "Z" + id, OBSERVER.localSiderealTime(), OBSERVER.latitude, mag);
    }

    private static CelestialObject antiZenithStar(int id) {
        return CelestialObject.star(id, "N" + id, OBSERVER.localSiderealTime() + Math.PI, -OBSERVER.latitude, 1.0);
    }

    private static Catalog catalog(CelestialObject... stars) {
        return new Catalog(Arrays.asList(stars), new ArrayList<>());
    }

    @Test
    public void keepsVisibleStarAtCenter() {
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, 6, 0);
        Catalog catalog = catalog(zenithStar(1, 2.0));
        SkyObjects objects = service.update(catalog, OBSERVER, CropMask.empty(201, 201));

        assertEquals(1, objects.stars.size());
        CelestialObject star = objects.stars.get(0);
        assertEquals(100, star.x, 1e-3);
        assertEquals(100, star.y, 1e-3);
        assertEquals(Math.PI / 2, star.altitude, 1e-6);
        assertTrue(star.angleToMoon >= 0);
        // el catalogo no cambia
        assertTrue(Double.isNaN(catalog.stars.get(0).x));
    }

    @Test
    public void dropsStarsBelowHorizonAndTooFaint() {
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, 6, 0);
        SkyObjects objects = service.update(catalog(antiZenithStar(1), zenithStar(2, 6.5), zenithStar(3, 1.0)),
                OBSERVER, CropMask.empty(201, 201));
        assertEquals(1, objects.stars.size());
        assertEquals(3, objects.stars.get(0).id);
    }

    @Test
    public void dropsStarsTooCloseToMoon() {
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, 6, 180);
        SkyObjects objects = service.update(catalog(zenithStar(1, 1.0)), OBSERVER, CropMask.empty(201, 201));
        assertTrue(objects.stars.isEmpty());
    }

    @Test
    public void dropsCroppedStars() {
        boolean[] all = new boolean[201 * 201];
        Arrays.fill(all, true);
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, 6, 0);
        SkyObjects objects = service.update(catalog(zenithStar(1, 1.0)), OBSERVER, new CropMask(201, 201, all));
        assertTrue(objects.stars.isEmpty());
    }

    @Test
    public void appendsWholeSkyAnchor() {
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, 6, 0);
        SkyObjects objects = service.update(catalog(zenithStar(1, 1.0)), OBSERVER, CropMask.empty(201, 201));
        List<CelestialObject> pois = objects.pointsOfInterest;
        assertEquals(1, pois.size());
        CelestialObject anchor = pois.get(0);
        assertEquals(CelestialObject.Kind.WHOLE_SKY, anchor.kind);
        assertEquals(90, anchor.radius, 0);
        assertEquals(100, anchor.x, 1e-9);
    }

    @Test
    public void computesSunAndMoon() {
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, 6, 0);
        SkyObjects objects = service.update(catalog(zenithStar(1, 1.0)), OBSERVER, CropMask.empty(201, 201));
        assertTrue(Double.isFinite(objects.sun.altitude));
        assertTrue(Double.isFinite(objects.moon.x));
        assertTrue(objects.moonPhase >= 0 && objects.moonPhase <= 1);
    }

    @Test
    public void keepsBrightPlanetAboveHorizon() {
        // Jupiter cerca del meridiano, unos 70 grados de altura
        Observer evening = new Observer(OBSERVER.latitude, OBSERVER.longitude, 2200, Instant.parse("2024-01-01T21:00:00Z"));
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, 6, 0);
        SkyObjects objects = service.update(catalog(zenithStar(1, 1.0)), evening, CropMask.empty(201, 201));

        CelestialObject jupiter = null;
        for (CelestialObject p : objects.planets) {
            assertEquals(CelestialObject.Kind.PLANET, p.kind);
            assertTrue(p.altitude > 0);
            assertTrue(p.magnitude < 6);
            assertTrue(p.x > 0 && p.x < 201 && p.y > 0 && p.y < 201);
            if ("Jupiter".equals(p.name)) jupiter = p;
        }
        assertTrue(jupiter != null);
        assertTrue(jupiter.altitude > Math.toRadians(50));
        assertTrue(jupiter.magnitude < -1.5);
    }

    @Test
    public void dropsPlanetsFainterThanLimit() {
        Observer evening = new Observer(OBSERVER.latitude, OBSERVER.longitude, 2200, Instant.parse("2024-01-01T21:00:00Z"));
        SkyObjectService service = new SkyObjectService(new EphemerisService(), CAMERA, -5, 0);
        SkyObjects objects = service.update(catalog(zenithStar(1, -6.0)), evening, CropMask.empty(201, 201));
        assertTrue(objects.planets.isEmpty());
        assertEquals(1, objects.stars.size());
    }
}
