package com.skycam.service;

import com.skycam.model.CelestialObject;
import com.skycam.model.CloudMap;
import java.util.ArrayList;
import java.util.List;

// Estadistica espacial de la visibilidad: porcentaje de estrellas visibles alrededor de un
// punto y mapa de nubosidad de toda la imagen.
public class CloudCoverageService {

    public enum RangeUnit { DEGREE, PIXEL }

    // Valor devuelto cuando no hay ninguna estrella en el rango.
    public static final double NO_STARS = -1;

    // True si la estrella esta a distancia <= range del ancla. En grados se usa ra/dec si
    // el ancla los tiene y alt/az en otro caso.
    public static boolean isInRange(CelestialObject anchor, CelestialObject star, double range, RangeUnit unit) {
        if (range < 0) {
            throw new IllegalArgumentException("Range must not be negative: " + range);
        }
        if (unit == RangeUnit.PIXEL) {
            double dx = anchor.x - star.x;
            double dy = anchor.y - star.y;
            return dx * dx + dy * dy <= range * range;
        }
        double delta;
        if (anchor.hasEquatorial()) {
            delta = Coordinates.angularSeparation(anchor.dec, anchor.ra, star.dec, star.ra);
        } else {
            delta = Coordinates.angularSeparation(anchor.altitude, anchor.azimuth, star.altitude, star.azimuth);
        }
        return delta <= Math.toRadians(range);
    }

    // limit >= 0: fraccion con visible >= limit; limit < 0: visibilidad media
    public double calcStarPercentage(CelestialObject anchor, List<CelestialObject> stars, double range,
                                     double limit, RangeUnit unit, boolean weighted) {
        List<CelestialObject> inRange;
        if (range < 0) {
            inRange = stars;
        } else {
            inRange = new ArrayList<>();
            for (CelestialObject s : stars) {
                if (isInRange(anchor, s, range, unit)) inRange.add(s);
            }
        }
        if (inRange.isEmpty()) return NO_STARS;

        double num = 0;
        double den = 0;
        for (CelestialObject s : inRange) {
            double w = weighted ? s.fluxWeight() : 1;
            if (limit >= 0) {
                if (s.visible >= limit) num += w;
            } else {
                num += s.visible * w;
            }
            den += w;
        }
        return num / den;
    }

    // Mapa de nubosidad: histogramas (visibles y todas) suavizados con la misma gaussiana;
    // nube = 1 - visibles/todas. Donde no hay densidad el cociente es 0.
    public CloudMap calcCloudMap(List<CelestialObject> stars, double sigma, int width, int height, boolean weighted) {
        double[] visible = new double[width * height];
        double[] all = new double[width * height];
        for (CelestialObject s : stars) {
            int col = bin(s.x, width);
            int row = bin(s.y, height);
            if (col < 0 || row < 0) continue;
            double w = weighted ? s.fluxWeight() : 1;
            visible[row * width + col] += s.visible * w;
            all[row * width + col] += w;
        }
        double[] densVisible = ImageFilters.gaussianMirror(visible, width, height, sigma);
        double[] densAll = ImageFilters.gaussianMirror(all, width, height, sigma);

        float[] ratio = new float[width * height];
        float[] cloud = new float[width * height];
        for (int i = 0; i < ratio.length; i++) {
            double r = densVisible[i] / densAll[i];
            if (!Double.isFinite(r)) r = 0;
            ratio[i] = (float) r;
            cloud[i] = (float) (1 - r);
        }
        return new CloudMap(width, height, cloud, ratio);
    }

    // Celda de histograma de ancho 1; el borde superior cae en la ultima celda, -1 si queda
    // fuera.
    static int bin(double v, int n) {
        if (!(v >= 0 && v <= n)) return -1;
        return v == n ? n - 1 : (int) v;
    }
}
