package com.skycam.service;

import com.skycam.model.CameraModel;
import com.skycam.model.CelestialObject;
import com.skycam.model.CropMask;
import com.skycam.model.SkycamConfig;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Mascaras de recorte: discos estaticos de la configuracion mas el disco de la Luna.
public class CropMaskService {

    private static final Logger log = LoggerFactory.getLogger(CropMaskService.class);

    private static final String LIST_SEPARATOR = "\\s*,\\s*";

    public static class CropDisk {
        public final int x;
        public final int y;
        public final int radius;
        public final boolean deleteInside;

        public CropDisk(int x, int y, int radius, boolean deleteInside) {
            this.x = x;
            this.y = y;
            this.radius = radius;
            this.deleteInside = deleteInside;
        }
    }

    // Mascara estatica. Un error de formato en la seccion crop no aborta la imagen: se
    // registra y se devuelve una mascara vacia.
    public CropMask fromConfig(int width, int height, SkycamConfig config) {
        List<CropDisk> disks;
        try {
            disks = parseDisks(config.getCropX(), config.getCropY(), config.getCropRadius(), config.getCropDeleteInside());
        } catch (NumberFormatException e) {
            log.error("Recorte fallido, quiza hay un error de escritura en la seccion crop: {}", e.getMessage());
            return CropMask.empty(width, height);
        }
        return fromDisks(width, height, disks);
    }

    public CropMask fromDisks(int width, int height, List<CropDisk> disks) {
        boolean[] excluded = new boolean[width * height];
        for (CropDisk d : disks) {
            long r2 = (long) d.radius * d.radius;
            for (int row = 0; row < height; row++) {
                for (int col = 0; col < width; col++) {
                    long dist2 = (long) (row - d.y) * (row - d.y) + (long) (col - d.x) * (col - d.x);
                    boolean hit = d.deleteInside ? dist2 < r2 : dist2 > r2;
                    if (hit) excluded[row * width + col] = true;
                }
            }
        }
        return new CropMask(width, height, excluded);
    }

    // Disco alrededor de la Luna con radio = distancia minima permitida a la Luna.
    public CropMask moonDisk(CropMask base, CelestialObject moon, CameraModel cam, double minAngleToMoon) {
        if (!Double.isFinite(moon.x) || !Double.isFinite(moon.y)) {
            return base;
        }
        double r = cam.theta2r(Math.toRadians(minAngleToMoon));
        double r2 = r * r;
        boolean[] excluded = new boolean[base.width * base.height];
        for (int row = 0; row < base.height; row++) {
            for (int col = 0; col < base.width; col++) {
                double dy = row - moon.y;
                double dx = col - moon.x;
                excluded[row * base.width + col] = dx * dx + dy * dy < r2;
            }
        }
        return base.union(new CropMask(base.width, base.height, excluded));
    }

    static List<CropDisk> parseDisks(String xs, String ys, String rs, String inside) {
        int[] x = parseInts(xs);
        int[] y = parseInts(ys);
        int[] r = parseInts(rs);
        int[] in = parseInts(inside);
        int n = Math.min(Math.min(x.length, y.length), Math.min(r.length, in.length));
        if (n != Math.max(Math.max(x.length, y.length), Math.max(r.length, in.length))) {
            log.warn("Las listas de recorte tienen longitudes distintas; se usan {} discos", n);
        }
        List<CropDisk> disks = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            disks.add(new CropDisk(x[i], y[i], r[i], in[i] != 0));
        }
        return disks;
    }

    private static int[] parseInts(String list) {
        if (list == null || list.trim().isEmpty()) return new int[0];
        String[] parts = list.trim().split(LIST_SEPARATOR);
        int[] values = new int[parts.length];
        for (int i = 0; i < parts.length; i++) values[i] = Integer.parseInt(parts[i]);
        return values;
    }
}
