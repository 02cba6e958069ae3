package com.skycam.service;

import com.skycam.model.CelestialObject;
import com.skycam.model.RateScanResult;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Barrido de umbrales para comparar gradiente, Sobel y LoG: para cada umbral, fraccion de
// estrellas con respuesta por encima, pixeles por encima y numero de clusters.
public class RateScanService {

    private static final Logger log = LoggerFactory.getLogger(RateScanService.class);

    public static final int STEPS = 200;
    public static final double LOG_MIN = -4.5;
    public static final double LOG_MAX = -0.5;

    public static double[] thresholds() {
        double[] t = new double[STEPS];
        for (int i = 0; i < STEPS; i++) {
            t[i] = Math.pow(10, LOG_MIN + (LOG_MAX - LOG_MIN) * i / (STEPS - 1));
        }
        return t;
    }

    // Requiere las rejillas de ResponseFunction.ALL
    public RateScanResult scan(List<CelestialObject> stars, ResponseFunction.Grids grids) {
        if (!grids.hasDiagnostics()) {
            throw new IllegalArgumentException("Rate scan needs the gradient and Sobel grids");
        }
        log.info("Barrido de umbrales ({} pasos, {} estrellas)", STEPS, stars.size());
        double[] thr = thresholds();
        FloatProcessor[] images = {grids.gradient, grids.sobel, grids.response};
        double[][][] tables = new double[3][STEPS][4];
        int[] minIndex = new int[3];

        for (int f = 0; f < 3; f++) {
            for (int i = 0; i < STEPS; i++) {
                int above = 0;
                for (CelestialObject s : stars) {
                    if (response(s, f) > thr[i]) above++;
                }
                double percentage = stars.isEmpty() ? CloudCoverageService.NO_STARS : (double) above / stars.size();
                ByteProcessor binary = binarize(images[f], thr[i]);
                tables[f][i][0] = percentage;
                tables[f][i][1] = countSet(binary);
                tables[f][i][2] = countClusters(binary);
                tables[f][i][3] = above;
            }
            minIndex[f] = lastIndexOfMax(tables[f]);
            log.debug("Funcion {}: umbral minimo {} ({} clusters)", f, thr[minIndex[f]], tables[f][minIndex[f]][2]);
        }
        return new RateScanResult(thr, tables, minIndex);
    }

    private static double response(CelestialObject s, int function) {
        switch (function) {
            case RateScanResult.GRAD: return s.responseGrad;
            case RateScanResult.SOBEL: return s.responseSobel;
            default: return s.response;
        }
    }

    // Ultimo umbral (el mas alto) con el porcentaje maximo.
    static int lastIndexOfMax(double[][] table) {
        int best = 0;
        for (int i = 0; i < table.length; i++) {
            if (table[i][0] >= table[best][0]) best = i;
        }
        return best;
    }

    // 255 donde el valor supera el umbral; NaN nunca lo supera.
    static ByteProcessor binarize(FloatProcessor ip, double threshold) {
        int w = ip.getWidth(), h = ip.getHeight();
        ByteProcessor bp = new ByteProcessor(w, h);
        float[] src = (float[]) ip.getPixels();
        byte[] dst = (byte[]) bp.getPixels();
        for (int i = 0; i < src.length; i++) {
            if (src[i] > threshold) dst[i] = (byte) 255;
        }
        return bp;
    }

    private static int countSet(ByteProcessor bp) {
        byte[] px = (byte[]) bp.getPixels();
        int n = 0;
        for (byte b : px) if (b != 0) n++;
        return n;
    }

    // Clusters 8-conexos del mapa binario.
    static int countClusters(ByteProcessor bp) {
        ByteProcessor copy = (ByteProcessor) bp.duplicate();
        copy.setThreshold(255, 255, ImageProcessor.NO_LUT_UPDATE);
        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE, Measurements.AREA, rt, 0, Double.POSITIVE_INFINITY);
        pa.analyze(new ImagePlus("", copy));
        return rt.getCounter();
    }
}
