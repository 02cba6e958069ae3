package com.skycam.model;

import java.util.OptionalDouble;

// Mapa de nubosidad: 1 = nube, 0 = cielo despejado. Guarda tambien el cociente de densidades
// (estrellas visibles / todas) del que se deriva.
public class CloudMap {
    public final int width;
    public final int height;
    private final float[] cloud;
    private final float[] ratio;

    public CloudMap(int width, int height, float[] cloud, float[] ratio) {
        this.width = width;
        this.height = height;
        this.cloud = cloud;
        this.ratio = ratio;
    }

    public float get(int x, int y) {
        return cloud[y * width + x];
    }

    public float ratio(int x, int y) {
        return ratio[y * width + x];
    }

    // Marca como nube los pixeles recortados.
    public CloudMap withMask(CropMask mask) {
        float[] masked = cloud.clone();
        for (int i = 0; i < masked.length; i++) {
            if (mask.isExcluded(i)) masked[i] = 1f;
        }
        return new CloudMap(width, height, masked, ratio);
    }

    // Cobertura media sobre los pixeles no recortados; vacio si no queda ninguno.
    public OptionalDouble meanCoverage(CropMask mask) {
        double sum = 0;
        int n = 0;
        for (int i = 0; i < cloud.length; i++) {
            if (mask != null && mask.isExcluded(i)) continue;
            if (Float.isNaN(cloud[i])) continue;
            sum += cloud[i];
            n++;
        }
        return n > 0 ? OptionalDouble.of(sum / n) : OptionalDouble.empty();
    }
}
