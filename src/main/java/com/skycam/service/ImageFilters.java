package com.skycam.service;

import com.skycam.model.CropMask;
import ij.plugin.filter.Convolver;
import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;

// Filtros de imagen sobre FloatProcessor. Todos devuelven un procesador nuevo salvo los
// marcados "in situ".
public final class ImageFilters {

    private static final double GAUSS_ACCURACY = 0.0002;
    private static final double GAUSS_TRUNCATE = 4.0;

    private static final float[] LAPLACE_KERNEL = {
        0, -1, 0,
        -1, 4, -1,
        0, -1, 0
    };
    private static final float[] SOBEL_H = {
        0.25f, 0.5f, 0.25f,
        0, 0, 0,
        -0.25f, -0.5f, -0.25f
    };
    private static final float[] SOBEL_V = {
        0.25f, 0, -0.25f,
        0.5f, 0, -0.5f,
        0.25f, 0, -0.25f
    };

    private ImageFilters() {
    }

    public static FloatProcessor gaussian(FloatProcessor ip, double sigma) {
        FloatProcessor out = (FloatProcessor) ip.duplicate();
        if (sigma > 0) {
            new GaussianBlur().blurGaussian(out, sigma, sigma, GAUSS_ACCURACY);
        }
        return out;
    }

    // Laplaciano de 4 vecinos con signo positivo en los maximos.
    public static FloatProcessor laplace(FloatProcessor ip) {
        return convolve(ip, LAPLACE_KERNEL);
    }

    // Magnitud de Sobel sqrt((h^2 + v^2) / 2); el borde de un pixel queda a 0.
    public static FloatProcessor sobel(FloatProcessor ip) {
        FloatProcessor h = convolve(ip, SOBEL_H);
        FloatProcessor v = convolve(ip, SOBEL_V);
        int w = ip.getWidth(), ht = ip.getHeight();
        FloatProcessor out = new FloatProcessor(w, ht);
        for (int y = 0; y < ht; y++) {
            for (int x = 0; x < w; x++) {
                if (x == 0 || y == 0 || x == w - 1 || y == ht - 1) continue;
                float a = h.getf(x, y);
                float b = v.getf(x, y);
                out.setf(x, y, (float) Math.sqrt((a * a + b * b) / 2.0));
            }
        }
        return out;
    }

    // Gradiente cuadrado hacia atras en filas y columnas, solo la parte positiva, con borde
    // ciclico.
    public static FloatProcessor squaredGradient(FloatProcessor ip) {
        int w = ip.getWidth(), h = ip.getHeight();
        FloatProcessor out = new FloatProcessor(w, h);
        for (int y = 0; y < h; y++) {
            int yPrev = (y - 1 + h) % h;
            for (int x = 0; x < w; x++) {
                int xPrev = (x - 1 + w) % w;
                float v = ip.getf(x, y);
                float dRow = Math.max(0f, v - ip.getf(x, yPrev));
                float dCol = Math.max(0f, v - ip.getf(xPrev, y));
                out.setf(x, y, dRow * dRow + dCol * dCol);
            }
        }
        return out;
    }

    public static FloatProcessor difference(FloatProcessor a, FloatProcessor b) {
        FloatProcessor out = (FloatProcessor) a.duplicate();
        float[] pa = (float[]) out.getPixels();
        float[] pb = (float[]) b.getPixels();
        for (int i = 0; i < pa.length; i++) pa[i] -= pb[i];
        return out;
    }

    // In situ. Los NaN se conservan.
    public static void clipNegative(FloatProcessor ip) {
        float[] px = (float[]) ip.getPixels();
        for (int i = 0; i < px.length; i++) {
            if (px[i] < 0) px[i] = 0;
        }
    }

    // In situ: NaN en los pixeles recortados.
    public static void maskNaN(FloatProcessor ip, CropMask mask) {
        float[] px = (float[]) ip.getPixels();
        for (int i = 0; i < px.length; i++) {
            if (mask.isExcluded(i)) px[i] = Float.NaN;
        }
    }

    // Entrada para los filtros: los pixeles recortados o no finitos se sustituyen por la
    // media del resto, para que los NaN no se extiendan con la convolucion.
    public static FloatProcessor fillMasked(FloatProcessor ip, CropMask mask) {
        FloatProcessor out = (FloatProcessor) ip.duplicate();
        float[] px = (float[]) out.getPixels();
        double sum = 0;
        int n = 0;
        for (int i = 0; i < px.length; i++) {
            if (!isMasked(px[i], mask, i)) {
                sum += px[i];
                n++;
            }
        }
        float fill = n > 0 ? (float) (sum / n) : 0f;
        for (int i = 0; i < px.length; i++) {
            if (isMasked(px[i], mask, i)) px[i] = fill;
        }
        return out;
    }

    // Gaussiana separable con borde en espejo (d c b | a b c d | c b a) truncada a 4 sigma.
    // Trabaja en doble precision sobre una rejilla fila por fila.
    public static double[] gaussianMirror(double[] grid, int width, int height, double sigma) {
        if (sigma <= 0) return grid.clone();
        int radius = (int) (GAUSS_TRUNCATE * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            kernel[i + radius] = Math.exp(-0.5 * i * i / (sigma * sigma));
            sum += kernel[i + radius];
        }
        for (int i = 0; i < kernel.length; i++) kernel[i] /= sum;

        double[] tmp = new double[grid.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    acc += kernel[k + radius] * grid[y * width + mirror(x + k, width)];
                }
                tmp[y * width + x] = acc;
            }
        }
        double[] out = new double[grid.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    acc += kernel[k + radius] * tmp[mirror(y + k, height) * width + x];
                }
                out[y * width + x] = acc;
            }
        }
        return out;
    }

    static int mirror(int i, int n) {
        if (n == 1) return 0;
        int period = 2 * (n - 1);
        int m = Math.abs(i) % period;
        return m < n ? m : period - m;
    }

    private static boolean isMasked(float v, CropMask mask, int i) {
        return !Float.isFinite(v) || (mask != null && mask.isExcluded(i));
    }

    private static FloatProcessor convolve(FloatProcessor ip, float[] kernel) {
        FloatProcessor out = (FloatProcessor) ip.duplicate();
        Convolver convolver = new Convolver();
        convolver.setNormalize(false);
        convolver.convolve(out, kernel, 3, 3);
        return out;
    }
}
