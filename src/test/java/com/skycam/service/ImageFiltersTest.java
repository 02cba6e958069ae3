package com.skycam.service;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import com.skycam.model.CropMask;
import ij.process.FloatProcessor;
import org.junit.Test;

public class ImageFiltersTest {

    private static FloatProcessor constant(int w, int h, float v) {
        FloatProcessor ip = new FloatProcessor(w, h);
        ip.setValue(v);
        ip.fill();
        return ip;
    }

    @Test
    public void laplaceOfConstantIsZero() {
        FloatProcessor lap = ImageFilters.laplace(constant(9, 9, 5f));
        for (int y = 0; y < 9; y++) {
            for (int x = 0; x < 9; x++) {
                assertEquals(0, lap.getf(x, y), 1e-6);
            }
        }
    }

    @Test
    public void laplaceIsPositiveOnPeak() {
        FloatProcessor ip = new FloatProcessor(9, 9);
        ip.setf(4, 4, 1f);
        FloatProcessor lap = ImageFilters.laplace(ip);
        assertEquals(4, lap.getf(4, 4), 1e-6);
        assertEquals(-1, lap.getf(5, 4), 1e-6);
        assertEquals(0, lap.getf(5, 5), 1e-6);
    }

    @Test
    public void gaussianPreservesFlux() {
        FloatProcessor ip = new FloatProcessor(41, 41);
        ip.setf(20, 20, 100f);
        FloatProcessor blurred = ImageFilters.gaussian(ip, 2);
        double sum = 0;
        for (float v : (float[]) blurred.getPixels()) sum += v;
        assertEquals(100, sum, 0.5);
        assertTrue(blurred.getf(20, 20) < 100);
        assertEquals(100, ip.getf(20, 20), 0);
    }

    @Test
    public void sobelBorderIsZero() {
        FloatProcessor ip = new FloatProcessor(7, 7);
        for (int y = 0; y < 7; y++) for (int x = 0; x < 7; x++) ip.setf(x, y, x);
        FloatProcessor s = ImageFilters.sobel(ip);
        assertEquals(0, s.getf(0, 3), 0);
        assertEquals(0, s.getf(6, 3), 0);
        // rampa horizontal de pendiente 1: |v| = 2, h = 0
        assertEquals(Math.sqrt(2), s.getf(3, 3), 1e-5);
    }

    @Test
    public void squaredGradientWrapsAround() {
        FloatProcessor ip = new FloatProcessor(4, 4);
        ip.setf(0, 0, 2f);
        FloatProcessor g = ImageFilters.squaredGradient(ip);
        // (2-0)^2 desde la fila anterior (ciclica) + (2-0)^2 desde la columna anterior
        assertEquals(8, g.getf(0, 0), 1e-6);
        // bajada: solo cuenta la parte positiva
        assertEquals(0, g.getf(1, 0), 1e-6);
    }

    @Test
    public void clipAndMask() {
        FloatProcessor ip = new FloatProcessor(3, 1, new float[]{-1f, 2f, Float.NaN});
        ImageFilters.clipNegative(ip);
        assertEquals(0, ip.getf(0, 0), 0);
        assertEquals(2, ip.getf(1, 0), 0);
        assertTrue(Float.isNaN(ip.getf(2, 0)));

        ImageFilters.maskNaN(ip, new CropMask(3, 1, new boolean[]{false, true, false}));
        assertTrue(Float.isNaN(ip.getf(1, 0)));
    }

    @Test
    public void fillMaskedUsesMeanOfRest() {
        FloatProcessor ip = new FloatProcessor(4, 1, new float[]{1f, 3f, 100f, Float.NaN});
        FloatProcessor filled = ImageFilters.fillMasked(ip, new CropMask(4, 1, new boolean[]{false, false, true, false}));
        assertEquals(2, filled.getf(2, 0), 1e-6);
        assertEquals(2, filled.getf(3, 0), 1e-6);
        assertEquals(100, ip.getf(2, 0), 0);
    }

    @Test
    public void mirrorIndices() {
        assertEquals(1, ImageFilters.mirror(-1, 5));
        assertEquals(0, ImageFilters.mirror(0, 5));
        assertEquals(3, ImageFilters.mirror(5, 5));
        assertEquals(2, ImageFilters.mirror(6, 5));
        assertEquals(0, ImageFilters.mirror(3, 1));
    }

    @Test
    public void gaussianMirrorKeepsConstant() {
        double[] grid = new double[10 * 6];
        java.util.Arrays.fill(grid, 3.0);
        double[] out = ImageFilters.gaussianMirror(grid, 10, 6, 1.5);
        for (double v : out) assertEquals(3.0, v, 1e-9);
    }

    @Test
    public void gaussianMirrorSpreadsPoint() {
        double[] grid = new double[11 * 11];
        grid[5 * 11 + 5] = 1;
        double[] out = ImageFilters.gaussianMirror(grid, 11, 11, 1);
        double sum = 0;
        for (double v : out) sum += v;
        assertEquals(1, sum, 1e-9);
        assertTrue(out[5 * 11 + 5] > out[5 * 11 + 6]);
        assertEquals(out[5 * 11 + 4], out[5 * 11 + 6], 1e-12);
    }
}
