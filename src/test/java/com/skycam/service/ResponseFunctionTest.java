package com.skycam.service;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import com.skycam.model.CropMask;
import ij.process.FloatProcessor;
import org.junit.Test;

public class ResponseFunctionTest {

    private static FloatProcessor blob() {
        FloatProcessor ip = new FloatProcessor(31, 31);
        for (int y = 0; y < 31; y++) {
            for (int x = 0; x < 31; x++) {
                double r2 = (x - 15) * (x - 15) + (y - 15) * (y - 15);
                ip.setf(x, y, (float) (0.1 + Math.exp(-r2 / 8.0)));
            }
        }
        return ip;
    }

    @Test
    public void namesAreCaseInsensitive() {
        assertSame(ResponseFunction.ALL, ResponseFunction.fromName("All"));
        assertSame(ResponseFunction.LOG, ResponseFunction.fromName("log"));
        assertSame(ResponseFunction.DOG, ResponseFunction.fromName("DOG"));
        assertSame(ResponseFunction.GRAD, ResponseFunction.fromName("grad"));
        assertSame(ResponseFunction.SOBEL, ResponseFunction.fromName(" Sobel "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownNameIsRejected() {
        ResponseFunction.fromName("Hessian");
    }

    @Test
    public void responsesAreNonNegative() {
        for (ResponseFunction f : ResponseFunction.values()) {
            ResponseFunction.Grids grids = f.compute(blob(), 1.0, null);
            for (float v : (float[]) grids.response.getPixels()) {
                assertTrue(f + " gave " + v, v >= 0);
            }
        }
    }

    @Test
    public void logPeaksAtBlob() {
        ResponseFunction.Grids grids = ResponseFunction.LOG.compute(blob(), 1.0, null);
        assertTrue(grids.response.getf(15, 15) > grids.response.getf(10, 15));
        assertFalse(grids.hasDiagnostics());
        assertNull(grids.gradient);
    }

    @Test
    public void allAddsDiagnosticGrids() {
        ResponseFunction.Grids all = ResponseFunction.ALL.compute(blob(), 1.0, null);
        ResponseFunction.Grids log = ResponseFunction.LOG.compute(blob(), 1.0, null);
        assertTrue(all.hasDiagnostics());
        float[] a = (float[]) all.response.getPixels();
        float[] b = (float[]) log.response.getPixels();
        for (int i = 0; i < a.length; i++) {
            assertTrue(a[i] == b[i]);
        }
    }

    @Test
    public void maskedPixelsAreNaN() {
        boolean[] excluded = new boolean[31 * 31];
        excluded[0] = true;
        ResponseFunction.Grids grids = ResponseFunction.ALL.compute(blob(), 1.0, new CropMask(31, 31, excluded));
        assertTrue(Float.isNaN(grids.response.getf(0, 0)));
        assertTrue(Float.isNaN(grids.gradient.getf(0, 0)));
        assertTrue(Float.isNaN(grids.sobel.getf(0, 0)));
        assertFalse(Float.isNaN(grids.response.getf(1, 0)));
    }
}
