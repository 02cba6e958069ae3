package com.skycam.model;

import java.util.List;

public class SkyObjects {
    public final List<CelestialObject> stars;
    public final List<CelestialObject> planets;
    public final List<CelestialObject> pointsOfInterest;
    public final CelestialObject sun;
    public final CelestialObject moon;
    public final double moonPhase;   // fraccion iluminada [0,1]

    public SkyObjects(List<CelestialObject> stars, List<CelestialObject> planets,
                      List<CelestialObject> pointsOfInterest, CelestialObject sun,
                      CelestialObject moon, double moonPhase) {
        this.stars = stars;
        this.planets = planets;
        this.pointsOfInterest = pointsOfInterest;
        this.sun = sun;
        this.moon = moon;
        this.moonPhase = moonPhase;
    }
}
