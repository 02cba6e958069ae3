package com.skycam.service;

import ij.process.FloatProcessor;
import java.util.ArrayDeque;

// Tamano del blob en el centro de una ventana: todos los vecinos (8-conexos) por encima del
// umbral, y los vecinos de estos.
public final class BlobSizer {

    private BlobSizer() {
    }

    // Ventana impar centrada en el pico; limit 0 = area de la ventana
    public static int getBlobsize(FloatProcessor window, double thresh, int limit) {
        if (thresh <= 0) {
            throw new IllegalArgumentException("Thresh > 0 required");
        }
        int w = window.getWidth();
        int h = window.getHeight();
        if (w % 2 == 0 || h % 2 == 0) {
            throw new IllegalArgumentException("Only odd sized windows are supported: " + w + "x" + h);
        }
        int area = w * h;
        if (limit == 0) limit = area;

        float[] px = (float[]) window.getPixels();
        // ventana completa por encima del umbral
        double min = Double.POSITIVE_INFINITY;
        boolean hasNaN = false;
        for (float v : px) {
            if (Float.isNaN(v)) hasNaN = true;
            else if (v < min) min = v;
        }
        if (!hasNaN && thresh <= min) {
            return Math.min(limit, area);
        }

        float[] work = px.clone();
        for (int i = 0; i < work.length; i++) {
            if (!Float.isFinite(work[i])) work[i] = 0;
        }

        ArrayDeque<int[]> queue = new ArrayDeque<>();
        queue.add(new int[]{w / 2, h / 2});
        int count = 0;
        while (!queue.isEmpty()) {
            int[] p = queue.poll();
            // el propio pixel tambien entra en el recorrido de vecinos
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    int x = p[0] + dx;
                    int y = p[1] + dy;
                    if (x < 0 || x >= w || y < 0 || y >= h) continue;
                    if (work[y * w + x] >= thresh) {
                        count++;
                        work[y * w + x] = 0;
                        queue.add(new int[]{x, y});
                    }
                }
            }
            if (count >= limit) return limit;
        }
        return count;
    }
}
