package com.skycam.model;

// Mascara booleana del tamano de la imagen; true = pixel excluido.
public class CropMask {
    public final int width;
    public final int height;
    private final boolean[] excluded;

    public CropMask(int width, int height, boolean[] excluded) {
        if (excluded.length != width * height) {
            throw new IllegalArgumentException("Mask size does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.excluded = excluded;
    }

    public static CropMask empty(int width, int height) {
        return new CropMask(width, height, new boolean[width * height]);
    }

    public boolean isExcluded(int x, int y) {
        return excluded[y * width + x];
    }

    public boolean isExcluded(int index) {
        return excluded[index];
    }

    public int excludedCount() {
        int n = 0;
        for (boolean b : excluded) if (b) n++;
        return n;
    }

    public CropMask union(CropMask other) {
        if (other.width != width || other.height != height) {
            throw new IllegalArgumentException("Cannot combine masks of different shape");
        }
        boolean[] merged = new boolean[excluded.length];
        for (int i = 0; i < merged.length; i++) merged[i] = excluded[i] || other.excluded[i];
        return new CropMask(width, height, merged);
    }
}
