package com.skycam.service;

import com.skycam.model.CameraModel;
import com.skycam.model.HorizontalPoint;
import com.skycam.model.Observer;
import com.skycam.model.PixelPoint;

// Transformaciones entre sistemas de coordenadas. Sin estado.
public final class Coordinates {

    private static final double TWO_PI = 2 * Math.PI;

    private Coordinates() {
    }

    // Ascension recta / declinacion (rad) a azimut / altitud para el observador. El azimut
    // se gira pi para la orientacion de la camara (norte = 0, este = pi/2).
    public static HorizontalPoint equatorialToHorizontal(double ra, double dec, Observer observer) {
        double lat = observer.latitude;
        double h = observer.localSiderealTime() - ra;
        double sinAlt = Math.sin(lat) * Math.sin(dec) + Math.cos(lat) * Math.cos(dec) * Math.cos(h);
        double alt = Math.asin(clamp(sinAlt));
        double az = Math.atan2(Math.sin(h), Math.cos(h) * Math.sin(lat) - Math.tan(dec) * Math.cos(lat));
        return new HorizontalPoint(mod2pi(az + Math.PI), alt);
    }

    public static PixelPoint horizontalToImage(double az, double alt, CameraModel cam) {
        double r = cam.theta2r(Math.PI / 2 - alt);
        double x = cam.zenithX + r * Math.cos(az + cam.azimuthOffset);
        double y = cam.zenithY - r * Math.sin(az + cam.azimuthOffset);
        return new PixelPoint(x, y);
    }

    // Inversa de horizontalToImage; valid es falso fuera del circulo de la proyeccion.
    public static HorizontalPoint imageToHorizontal(double x, double y, CameraModel cam) {
        double dx = x - cam.zenithX;
        double dy = cam.zenithY - y;
        double r = Math.hypot(dx, dy);
        if (!cam.projection.isValid(r, cam.radius)) {
            return new HorizontalPoint(Double.NaN, Double.NaN, false);
        }
        double theta = cam.r2theta(r);
        double az = mod2pi(Math.atan2(dy, dx) - cam.azimuthOffset);
        return new HorizontalPoint(az, Math.PI / 2 - theta, true);
    }

    // Distancia angular (haversine) entre dos puntos dados como (latitud, longitud) en rad.
    public static double angularSeparation(double lat1, double lon1, double lat2, double lon2) {
        double sLat = Math.sin((lat1 - lat2) / 2);
        double sLon = Math.sin((lon1 - lon2) / 2);
        return 2 * Math.asin(Math.min(1.0, Math.sqrt(sLat * sLat + Math.cos(lat1) * Math.cos(lat2) * sLon * sLon)));
    }

    // Angulo entre dos direcciones horizontales (ley de cosenos esferica).
    public static double angleBetween(double alt1, double az1, double alt2, double az2) {
        return Math.acos(clamp(Math.sin(alt1) * Math.sin(alt2)
                + Math.cos(alt1) * Math.cos(alt2) * Math.cos(az1 - az2)));
    }

    static double mod2pi(double angle) {
        double a = angle % TWO_PI;
        return a < 0 ? a + TWO_PI : a;
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }
}
