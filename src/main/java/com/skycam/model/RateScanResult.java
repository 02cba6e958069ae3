package com.skycam.model;

// Barrido de umbrales para las tres respuestas (gradiente, Sobel, LoG). Filas: umbral;
// columnas de cada tabla: porcentaje de estrellas, pixeles sobre el umbral, numero de
// clusters, estrellas sobre el umbral.
public class RateScanResult {
    public static final int GRAD = 0;
    public static final int SOBEL = 1;
    public static final int LOG = 2;

    public final double[] thresholds;
    public final double[][][] tables;      // [funcion][umbral][columna]
    public final int[] minThresholdIndex;  // por funcion

    public RateScanResult(double[] thresholds, double[][][] tables, int[] minThresholdIndex) {
        this.thresholds = thresholds;
        this.tables = tables;
        this.minThresholdIndex = minThresholdIndex;
    }

    public double minThreshold(int function) {
        return thresholds[minThresholdIndex[function]];
    }

    public int clusterCount(int function) {
        return (int) tables[function][minThresholdIndex[function]][2];
    }
}
