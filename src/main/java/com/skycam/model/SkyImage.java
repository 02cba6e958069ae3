package com.skycam.model;

import ij.process.FloatProcessor;
import java.time.Instant;

// Imagen decodificada en escala de grises, fila por fila.
public class SkyImage {
    public final int width;
    public final int height;
    public final Instant timestamp;
    private final float[] pixels;

    public SkyImage(int width, int height, float[] pixels, Instant timestamp) {
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Pixel count " + pixels.length + " does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
        this.timestamp = timestamp;
    }

    public float get(int x, int y) {
        return pixels[y * width + x];
    }

    // Copia de trabajo para ImageJ; la imagen original nunca se modifica.
    public FloatProcessor toProcessor() {
        return new FloatProcessor(width, height, pixels.clone());
    }

    public float[] pixelsCopy() {
        return pixels.clone();
    }

    public SkyImage withTimestamp(Instant t) {
        return new SkyImage(width, height, pixels, t);
    }
}
