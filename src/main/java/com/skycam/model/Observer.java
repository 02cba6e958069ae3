package com.skycam.model;

import java.time.Instant;

// Observador en un sitio fijo. La posicion no cambia; cada imagen usa su propio instante via
// at(Instant).
public class Observer {

    private static final double J2000 = 2451545.0;

    public final double latitude;   // rad
    public final double longitude;  // rad, este positivo
    public final double elevation;  // m
    public final Instant timestamp;

    public Observer(double latitude, double longitude, double elevation, Instant timestamp) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
        this.timestamp = timestamp;
    }

    public Observer at(Instant t) {
        return new Observer(latitude, longitude, elevation, t);
    }

    public double julianDate() {
        return timestamp.toEpochMilli() / 86_400_000d + 2440587.5d;
    }

    public double centuriesSinceJ2000() {
        return (julianDate() - J2000) / 36525.0;
    }

    // Tiempo sidereo local medio en radianes [0, 2pi).
    public double localSiderealTime() {
        double d = julianDate() - J2000;
        double t = d / 36525.0;
        double gmst = 280.46061837 + 360.98564736629 * d + 0.000387933 * t * t - t * t * t / 38710000.0;
        double lst = (gmst + Math.toDegrees(longitude)) % 360d;
        if (lst < 0d) {
            lst += 360d;
        }
        return Math.toRadians(lst);
    }

    @Override
    public String toString() {
        return String.format("Observer[lat=%.4f, lon=%.4f, elev=%.0fm, t=%s]",
                Math.toDegrees(latitude), Math.toDegrees(longitude), elevation, timestamp);
    }
}
