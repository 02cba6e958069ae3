package com.skycam.model;

public class CelestialPoint {
    public final double ra;    // rad
    public final double dec;   // rad

    public CelestialPoint(double ra, double dec) {
        this.ra = ra;
        this.dec = dec;
    }
}
