package com.skycam.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

public class FrameResult {
    public final Instant timestamp;
    public final String hash;
    public final List<CelestialObject> stars;
    public final Map<Double, List<CelestialObject>> starsByKernel;
    public final List<CelestialObject> pointsOfInterest;
    public final List<CelestialObject> planets;   // visibles y dentro de la imagen
    public final double globalStarPercentage;   // -1 = sin estrellas en rango
    public final CloudMap cloudMap;             // null si no se calculo
    public final OptionalDouble globalCoverage;
    public final double brightnessMean;
    public final double brightnessStd;
    public final double sunAltitude;
    public final double moonAltitude;
    public final double moonPhase;
    public final RateScanResult rateScan;       // null si no se pidio

    public FrameResult(Instant timestamp, String hash, List<CelestialObject> stars,
                       Map<Double, List<CelestialObject>> starsByKernel,
                       List<CelestialObject> pointsOfInterest, List<CelestialObject> planets,
                       double globalStarPercentage,
                       CloudMap cloudMap, OptionalDouble globalCoverage,
                       double brightnessMean, double brightnessStd,
                       double sunAltitude, double moonAltitude, double moonPhase,
                       RateScanResult rateScan) {
        this.timestamp = timestamp;
        this.hash = hash;
        this.stars = stars;
        this.starsByKernel = starsByKernel;
        this.pointsOfInterest = pointsOfInterest;
        this.planets = planets;
        this.globalStarPercentage = globalStarPercentage;
        this.cloudMap = cloudMap;
        this.globalCoverage = globalCoverage;
        this.brightnessMean = brightnessMean;
        this.brightnessStd = brightnessStd;
        this.sunAltitude = sunAltitude;
        this.moonAltitude = moonAltitude;
        this.moonPhase = moonPhase;
        this.rateScan = rateScan;
    }
}
