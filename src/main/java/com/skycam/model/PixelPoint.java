package com.skycam.model;

public class PixelPoint {
    public final double x;
    public final double y;

    public PixelPoint(double x, double y) {
        this.x = x;
        this.y = y;
    }
}
