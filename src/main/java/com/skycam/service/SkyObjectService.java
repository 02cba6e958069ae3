package com.skycam.service;

import com.skycam.model.CameraModel;
import com.skycam.model.Catalog;
import com.skycam.model.CelestialObject;
import com.skycam.model.CropMask;
import com.skycam.model.HorizontalPoint;
import com.skycam.model.Observer;
import com.skycam.model.PixelPoint;
import com.skycam.model.SkyObjects;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Posiciones actuales de todos los objetos y eliminacion de los que la camara no puede ver
// (altitud, magnitud, Luna, recorte). El catalogo no se modifica.
public class SkyObjectService {

    private static final Logger log = LoggerFactory.getLogger(SkyObjectService.class);

    private final EphemerisService ephemeris;
    private final CameraModel camera;
    private final double vmagLimit;
    private final double minAngleToMoon;   // grados

    public SkyObjectService(EphemerisService ephemeris, CameraModel camera, double vmagLimit, double minAngleToMoon) {
        this.ephemeris = ephemeris;
        this.camera = camera;
        this.vmagLimit = vmagLimit;
        this.minAngleToMoon = minAngleToMoon;
    }

    public SkyObjects update(Catalog catalog, Observer observer, CropMask crop) {
        // 1. Efemerides
        log.debug("Calculando Sol, Luna y planetas");
        CelestialObject moon = ephemeris.moon(observer);
        CelestialObject sun = ephemeris.sun(observer);
        double moonPhase = ephemeris.moonPhase(observer);
        List<CelestialObject> planets = ephemeris.planets(observer);

        // 2. Coordenadas horizontales (copias: el catalogo se necesita intacto en la siguiente imagen)
        List<CelestialObject> stars = toHorizontal(catalog.stars, observer);
        List<CelestialObject> pois = toHorizontal(catalog.pointsOfInterest, observer);
        pois.add(CelestialObject.wholeSky(camera.openingAngle));

        // 3. Altitud y magnitud
        double minAlt = camera.minAltitude();
        stars.removeIf(s -> !(s.altitude > minAlt && s.magnitude < vmagLimit));
        planets.removeIf(p -> !(p.altitude > minAlt && p.magnitude < vmagLimit));
        pois.removeIf(p -> !(p.altitude > minAlt));

        // 4. Distancia a la Luna, antes del recorte en pixeles
        log.debug("Calculando angulo a la Luna");
        double moonLimit = Math.toRadians(minAngleToMoon);
        for (List<CelestialObject> list : List.of(stars, planets, pois)) {
            for (CelestialObject o : list) {
                o.angleToMoon = Coordinates.angleBetween(o.altitude, o.azimuth, moon.altitude, moon.azimuth);
            }
        }
        stars.removeIf(s -> !(s.angleToMoon > moonLimit));
        planets.removeIf(p -> !(p.angleToMoon > moonLimit));

        // 5. Pixeles y recorte
        log.debug("Calculando x e y");
        for (List<CelestialObject> list : List.of(stars, planets, pois)) {
            for (CelestialObject o : list) project(o);
        }
        project(moon);
        project(sun);
        stars.removeIf(s -> !isInsideAndUncropped(s, crop));
        planets.removeIf(p -> !isInsideAndUncropped(p, crop));
        pois.removeIf(p -> !isInsideAndUncropped(p, crop));

        return new SkyObjects(stars, planets, pois, sun, moon, moonPhase);
    }

    private List<CelestialObject> toHorizontal(List<CelestialObject> source, Observer observer) {
        List<CelestialObject> out = new ArrayList<>(source.size() + 1);
        for (CelestialObject o : source) {
            CelestialObject c = o.copy();
            HorizontalPoint hp = Coordinates.equatorialToHorizontal(c.ra, c.dec, observer);
            c.azimuth = hp.azimuth;
            c.altitude = hp.altitude;
            out.add(c);
        }
        return out;
    }

    private void project(CelestialObject o) {
        PixelPoint p = Coordinates.horizontalToImage(o.azimuth, o.altitude, camera);
        o.x = p.x;
        o.y = p.y;
    }

    private boolean isInsideAndUncropped(CelestialObject o, CropMask crop) {
        if (!(o.x > 0 && o.x < camera.width && o.y > 0 && o.y < camera.height)) {
            return false;
        }
        return crop == null || !crop.isExcluded((int) o.x, (int) o.y);
    }
}
