package com.skycam.model;

public class CameraModel {
    public final double zenithX;
    public final double zenithY;
    public final double radius;          // pixeles de 0 a 90 grados
    public final Projection projection;
    public final double azimuthOffset;   // rad
    public final int width;
    public final int height;
    public final double openingAngle;    // grados desde el cenit

    public CameraModel(double zenithX, double zenithY, double radius, Projection projection,
                       double azimuthOffset, int width, int height, double openingAngle) {
        this.zenithX = zenithX;
        this.zenithY = zenithY;
        this.radius = radius;
        this.projection = projection;
        this.azimuthOffset = azimuthOffset;
        this.width = width;
        this.height = height;
        this.openingAngle = openingAngle;
    }

    public double theta2r(double theta) {
        return projection.theta2r(theta, radius);
    }

    public double r2theta(double r) {
        return projection.r2theta(r, radius);
    }

    // Altitud minima (rad) visible segun el angulo de apertura.
    public double minAltitude() {
        return Math.toRadians(90 - openingAngle);
    }

    public boolean matches(int imageWidth, int imageHeight) {
        return imageWidth == width && imageHeight == height;
    }
}
