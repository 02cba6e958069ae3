package com.skycam.service;

import com.skycam.model.CelestialObject;
import ij.process.FloatProcessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Busca la respuesta real de cada estrella cerca de su posicion proyectada. La proyeccion
// del catalogo es aproximada (modelo de lente, alineacion), asi que se busca el maximo en
// una ventana cuadrada de semiancho tolerance.
public class StarDetectionService {

    private static final Logger log = LoggerFactory.getLogger(StarDetectionService.class);

    // Distancia maxima entre posicion esperada y real; algo menos de 1 grado, la separacion
    // minima entre estrellas del catalogo filtrado.
    public static int tolerance(double radius) {
        return Math.max(0, (int) ((radius / 90 - 1) / 2));
    }

    // Busca picos, elimina duplicados (gana la mas brillante) y extrae la respuesta.
    // Devuelve copias; descarta las estrellas sin respuesta positiva.
    public List<CelestialObject> detect(List<CelestialObject> stars, ResponseFunction.Grids grids, int tolerance) {
        List<CelestialObject> found = new ArrayList<>(stars.size());
        for (CelestialObject s : stars) {
            CelestialObject c = s.copy();
            int[] pos = findLocalMaxPos(grids.response, c.x, c.y, tolerance);
            c.maxX = pos[0];
            c.maxY = pos[1];
            found.add(c);
        }

        // estrellas confundidas con una vecina mas brillante
        found.sort(Comparator.comparingDouble(s -> s.magnitude));
        Set<Long> peaks = new HashSet<>();
        found.removeIf(s -> !peaks.add(((long) s.maxX << 32) | (s.maxY & 0xffffffffL)));

        for (CelestialObject c : found) {
            c.response = findLocalMaxValue(grids.response, c.x, c.y, tolerance);
            if (grids.hasDiagnostics()) {
                c.responseGrad = findLocalMaxValue(grids.gradient, c.x, c.y, tolerance);
                c.responseSobel = findLocalMaxValue(grids.sobel, c.x, c.y, tolerance);
            }
        }
        int before = found.size();
        found.removeIf(s -> !(s.response > 0));
        log.debug("Deteccion: {} estrellas, {} sin respuesta", before, before - found.size());
        return found;
    }

    // Posicion {x, y} del pixel mas brillante en la ventana. Si todos los valores finitos
    // son iguales (o no hay ninguno) se devuelve la posicion de partida.
    public static int[] findLocalMaxPos(FloatProcessor img, double x, double y, int radius) {
        int xi = (int) x;
        int yi = (int) y;
        int x0 = Math.max(xi - radius, 0), x1 = Math.min(xi + radius + 1, img.getWidth());
        int y0 = Math.max(yi - radius, 0), y1 = Math.min(yi + radius + 1, img.getHeight());

        float max = Float.NEGATIVE_INFINITY;
        float min = Float.POSITIVE_INFINITY;
        int bestX = xi, bestY = yi;
        for (int row = y0; row < y1; row++) {
            for (int col = x0; col < x1; col++) {
                float v = img.getf(col, row);
                if (Float.isNaN(v)) continue;
                if (v > max) {
                    max = v;
                    bestX = col;
                    bestY = row;
                }
                if (v < min) min = v;
            }
        }
        if (!(max > min)) {
            return new int[]{xi, yi};
        }
        return new int[]{bestX, bestY};
    }

    // Valor maximo finito en la ventana; NaN si no hay ninguno.
    public static double findLocalMaxValue(FloatProcessor img, double x, double y, int radius) {
        int xi = (int) x;
        int yi = (int) y;
        int x0 = Math.max(xi - radius, 0), x1 = Math.min(xi + radius + 1, img.getWidth());
        int y0 = Math.max(yi - radius, 0), y1 = Math.min(yi + radius + 1, img.getHeight());

        double max = Double.NaN;
        for (int row = y0; row < y1; row++) {
            for (int col = x0; col < x1; col++) {
                float v = img.getf(col, row);
                if (Float.isNaN(v)) continue;
                if (Double.isNaN(max) || v > max) max = v;
            }
        }
        return max;
    }
}
