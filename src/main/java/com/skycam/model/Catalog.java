package com.skycam.model;

import java.util.Collections;
import java.util.List;

// Catalogo cargado una vez por proceso; se comparte solo para lectura.
public class Catalog {
    public final List<CelestialObject> stars;
    public final List<CelestialObject> pointsOfInterest;

    public Catalog(List<CelestialObject> stars, List<CelestialObject> pointsOfInterest) {
        this.stars = Collections.unmodifiableList(stars);
        this.pointsOfInterest = Collections.unmodifiableList(pointsOfInterest);
    }
}
