package com.skycam.service;

import com.skycam.model.SkyImage;
import com.skycam.model.SkycamConfig;
import ij.IJ;
import ij.ImagePlus;
import ij.process.FloatProcessor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Lee imagenes de la camara. FITS con la hora en la cabecera (TIMEUTC o UTC) y formatos
// raster (jpg, png, tif...) con la hora en el nombre del fichero.
public class SkyImageLoader {

    private static final Logger log = LoggerFactory.getLogger(SkyImageLoader.class);

    private static final DateTimeFormatter[] FITS_TIME_FORMATS = {
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")
    };

    private final DateTimeFormatter fileNameFormat;
    private final long offsetSeconds;

    public SkyImageLoader(SkycamConfig config) {
        this(config.getTimeFormat(), config.getTimeOffsetMinutes());
    }

    public SkyImageLoader(String timeFormat, double offsetMinutes) {
        this.fileNameFormat = DateTimeFormatter.ofPattern(timeFormat, Locale.ROOT);
        this.offsetSeconds = Math.round(offsetMinutes * 60);
    }

    public SkyImage load(Path file) throws IOException {
        return load(file, null);
    }

    // (imagenes descargadas); null = error
    public SkyImage load(Path file, Instant fallback) throws IOException {
        if (!Files.isReadable(file)) {
            throw new IOException("Error reading file '" + file + "': not readable");
        }
        SkyImage img = isFits(file) ? loadFits(file) : loadRaster(file, fallback);
        return img.withTimestamp(img.timestamp.plusSeconds(offsetSeconds));
    }

    static boolean isFits(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".fits") || name.endsWith(".fit") || name.endsWith(".fts") || name.endsWith(".gz");
    }

    // --- FITS ---
    private SkyImage loadFits(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException("No HDU in " + file);
            Header header = hdu.getHeader();
            String time = header.getStringValue("TIMEUTC");
            if (time == null) time = header.getStringValue("UTC");
            if (time == null) throw new IOException("No TIMEUTC/UTC header in " + file);

            double bzero = header.getDoubleValue("BZERO", 0);
            double bscale = header.getDoubleValue("BSCALE", 1);
            float[][] data = toFloatRaw(hdu.getKernel(), bzero, bscale);
            if (data.length == 0) throw new IOException("Unsupported FITS data type in " + file);

            int h = data.length, w = data[0].length;
            float[] px = new float[w * h];
            for (int y = 0; y < h; y++) System.arraycopy(data[y], 0, px, y * w, w);
            log.debug("FITS {} ({}x{}) hora {}", file.getFileName(), w, h, time);
            return new SkyImage(w, h, px, parseFitsTime(time.trim()));
        } catch (FitsException e) {
            throw new IOException("Error reading FITS file '" + file + "': " + e.getMessage(), e);
        }
    }

    static Instant parseFitsTime(String value) throws IOException {
        for (DateTimeFormatter f : FITS_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(value, f).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                log.trace("'{}' no encaja con {}", value, f);
            }
        }
        throw new IOException("Unable to parse FITS time: '" + value + "'");
    }

    // Valor fisico = BZERO + BSCALE * dato.
    private static float[][] toFloatRaw(Object k, double bzero, double bscale) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * (s[i][j] & 0xFF));
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            float[][] d = new float[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = (float) (bzero + bscale * f[i][j]);
            return d;
        }
        if (k instanceof double[][]) {
            double[][] f = (double[][]) k;
            float[][] d = new float[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = (float) (bzero + bscale * f[i][j]);
            return d;
        }
        return new float[0][0];
    }

    // --- RASTER ---
    private SkyImage loadRaster(Path file, Instant fallback) throws IOException {
        ImagePlus imp = IJ.openImage(file.toString());
        if (imp == null) {
            throw new IOException("Error reading file '" + file.getFileName() + "'");
        }
        FloatProcessor fp = imp.getProcessor().convertToFloatProcessor();
        double scale;
        switch (imp.getBitDepth()) {
            case 16: scale = 65535.0; break;
            case 32: scale = 1.0; break;
            default: scale = 255.0;
        }
        float[] px = (float[]) fp.getPixels();
        for (int i = 0; i < px.length; i++) px[i] = (float) (px[i] / scale);
        return new SkyImage(fp.getWidth(), fp.getHeight(), px, rasterTime(file, fallback));
    }

    private Instant rasterTime(Path file, Instant fallback) throws IOException {
        String name = file.getFileName().toString();
        int dot = name.indexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        try {
            return LocalDateTime.parse(base, fileNameFormat).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            if (fallback != null) return fallback;
            throw new IOException("Unable to parse image time from filename '" + base
                    + "'. Maybe format is wrong: " + fileNameFormat, e);
        }
    }
}
