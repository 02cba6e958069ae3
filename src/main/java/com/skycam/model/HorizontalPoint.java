package com.skycam.model;

public class HorizontalPoint {
    public final double azimuth;   // rad, norte = 0, este = pi/2
    public final double altitude;  // rad
    public final boolean valid;

    public HorizontalPoint(double azimuth, double altitude) {
        this(azimuth, altitude, true);
    }

    public HorizontalPoint(double azimuth, double altitude, boolean valid) {
        this.azimuth = azimuth;
        this.altitude = altitude;
        this.valid = valid;
    }
}
