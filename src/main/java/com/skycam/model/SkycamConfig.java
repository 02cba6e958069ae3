package com.skycam.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

// Configuracion de una camara. Fichero properties con claves "seccion.clave" (secciones
// properties, image, analysis, calibration, crop).
public class SkycamConfig {

    // properties
    private static final String KEY_NAME = "properties.name";
    private static final String KEY_LAT = "properties.latitude";
    private static final String KEY_LON = "properties.longitude";
    private static final String KEY_ELEVATION = "properties.elevation";
    private static final String KEY_TIMEFORMAT = "properties.timeformat";
    private static final String KEY_TIMEOFFSET = "properties.timeoffset";
    private static final String KEY_THREADS = "properties.threads";

    // image
    private static final String KEY_RESOLUTION = "image.resolution";
    private static final String KEY_ZENITH_X = "image.zenith_x";
    private static final String KEY_ZENITH_Y = "image.zenith_y";
    private static final String KEY_RADIUS = "image.radius";
    private static final String KEY_PROJECTION = "image.angleprojection";
    private static final String KEY_AZ_OFFSET = "image.azimuthoffset";
    private static final String KEY_OPENING = "image.openingangle";

    // analysis
    private static final String KEY_CATALOGUE = "analysis.catalogue";
    private static final String KEY_CATALOGUE_SEP = "analysis.catalogue_min_separation";
    private static final String KEY_POI = "analysis.points_of_interest";
    private static final String KEY_POI_RADIUS = "analysis.poi_radius";
    private static final String KEY_KERNEL = "analysis.kernelsize";
    private static final String KEY_FUNCTION = "analysis.function";
    private static final String KEY_VMAG = "analysis.vmaglimit";
    private static final String KEY_MOON_ANGLE = "analysis.minangletomoon";
    private static final String KEY_UPPER = "analysis.visibleupperlimit";
    private static final String KEY_LOWER = "analysis.visiblelowerlimit";
    private static final String KEY_CLOUDMAP = "analysis.cloudmap";
    private static final String KEY_RATESCAN = "analysis.ratescan";
    private static final String KEY_BLOBSIZE = "analysis.blobsize";

    // calibration
    private static final String KEY_ABSORPTION = "calibration.airmass_absorbtion";
    private static final String KEY_AIRMASS_MODEL = "calibration.airmass_model";

    // crop
    private static final String KEY_CROP_X = "crop.crop_x";
    private static final String KEY_CROP_Y = "crop.crop_y";
    private static final String KEY_CROP_R = "crop.crop_radius";
    private static final String KEY_CROP_INSIDE = "crop.crop_deleteinside";

    private static final String LIST_SEPARATOR = "\\s*,\\s*";

    private final Properties props;

    public SkycamConfig(Properties props) {
        this.props = props;
    }

    public static SkycamConfig load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(in);
        }
        return new SkycamConfig(props);
    }

    public static SkycamConfig load(InputStream input) throws IOException {
        Properties props = new Properties();
        try (InputStream in = input) {
            props.load(in);
        }
        return new SkycamConfig(props);
    }

    // --- PROPERTIES ---
    public String getName() { return get(KEY_NAME, "GTC"); }

    // Sitio por defecto: MAGIC, La Palma.
    public Observer observerAt(Instant timestamp) {
        double lat = parseAngle(KEY_LAT, get(KEY_LAT, "28:45:42"));
        double lon = parseAngle(KEY_LON, get(KEY_LON, "-17:53:28"));
        return new Observer(Math.toRadians(lat), Math.toRadians(lon), getDouble(KEY_ELEVATION, 2200), timestamp);
    }

    public String getTimeFormat() { return get(KEY_TIMEFORMAT, "'gtc_allskyimage_'yyyyMMdd_HHmmss"); }

    public double getTimeOffsetMinutes() { return getDouble(KEY_TIMEOFFSET, 0); }

    public int getThreads() {
        return (int) getDouble(KEY_THREADS, Runtime.getRuntime().availableProcessors());
    }

    // --- IMAGE ---
    public CameraModel getCameraModel() {
        List<Double> res = getDoubleList(KEY_RESOLUTION, null);
        if (res.size() != 2) {
            throw new ConfigException(KEY_RESOLUTION + " must be 'width, height' but was: " + props.getProperty(KEY_RESOLUTION));
        }
        return new CameraModel(
                getRequiredDouble(KEY_ZENITH_X),
                getRequiredDouble(KEY_ZENITH_Y),
                getRequiredDouble(KEY_RADIUS),
                Projection.fromName(get(KEY_PROJECTION, "lin")),
                Math.toRadians(getDouble(KEY_AZ_OFFSET, 0)),
                res.get(0).intValue(),
                res.get(1).intValue(),
                getOpeningAngle());
    }

    public double getOpeningAngle() { return getDouble(KEY_OPENING, 90); }

    // --- ANALYSIS ---
    public String getCatalogue() { return get(KEY_CATALOGUE, "catalogue.csv"); }

    public double getCatalogueMinSeparation() { return getDouble(KEY_CATALOGUE_SEP, 0); }

    public String getPointsOfInterest() { return get(KEY_POI, "points_of_interest.csv"); }

    public double getPoiRadius() { return getDouble(KEY_POI_RADIUS, 1.0); }

    public List<Double> getKernelSizes() { return getDoubleList(KEY_KERNEL, "1.0"); }

    public String getFunctionName() { return get(KEY_FUNCTION, "All"); }

    public double getVmagLimit() { return getDouble(KEY_VMAG, 6.0); }

    public double getMinAngleToMoon() { return getDouble(KEY_MOON_ANGLE, 10.0); }

    // [pendiente, ordenada] de la recta superior en (magnitud, log10 respuesta).
    public double[] getVisibleUpperLimit() { return getLine(KEY_UPPER); }

    public double[] getVisibleLowerLimit() { return getLine(KEY_LOWER); }

    public boolean isCloudMapEnabled() { return getBoolean(KEY_CLOUDMAP, true); }

    public boolean isRateScanEnabled() { return getBoolean(KEY_RATESCAN, false); }

    public boolean isBlobSizeEnabled() { return getBoolean(KEY_BLOBSIZE, false); }

    // --- CALIBRATION ---
    public double getAirmassAbsorption() { return getDoubleList(KEY_ABSORPTION, "0.57").get(0); }

    public String getAirmassModelName() { return get(KEY_AIRMASS_MODEL, "spherical"); }

    // --- CROP ---
    // Se devuelven en bruto: un error de formato no aborta la imagen, solo anula el recorte.
    public String getCropX() { return get(KEY_CROP_X, ""); }
    public String getCropY() { return get(KEY_CROP_Y, ""); }
    public String getCropRadius() { return get(KEY_CROP_R, ""); }
    public String getCropDeleteInside() { return get(KEY_CROP_INSIDE, ""); }

    // --- HELPERS ---
    private String get(String key, String def) {
        String v = props.getProperty(key);
        return v == null ? def : v.trim();
    }

    private double getDouble(String key, double def) {
        String v = props.getProperty(key);
        if (v == null || v.trim().isEmpty()) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid number for " + key + ": " + v, e);
        }
    }

    private double getRequiredDouble(String key) {
        if (props.getProperty(key) == null) throw new ConfigException("Missing config key: " + key);
        return getDouble(key, Double.NaN);
    }

    private boolean getBoolean(String key, boolean def) {
        String v = props.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v.trim());
    }

    private List<Double> getDoubleList(String key, String def) {
        String v = props.getProperty(key, def);
        if (v == null) throw new ConfigException("Missing config key: " + key);
        if (v.trim().isEmpty()) return Collections.emptyList();
        List<Double> values = new ArrayList<>();
        try {
            for (String s : v.trim().split(LIST_SEPARATOR)) values.add(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid number list for " + key + ": " + v, e);
        }
        return values;
    }

    private double[] getLine(String key) {
        List<Double> v = getDoubleList(key, null);
        if (v.size() != 2) throw new ConfigException(key + " must be 'slope, intercept'");
        return new double[]{v.get(0), v.get(1)};
    }

    // Grados decimales o sexagesimales "dd:mm:ss".
    static double parseAngle(String key, String value) {
        try {
            if (!value.contains(":")) return Double.parseDouble(value);
            String[] parts = value.split(":");
            boolean negative = parts[0].trim().startsWith("-");
            double deg = Math.abs(Double.parseDouble(parts[0]));
            double min = parts.length > 1 ? Double.parseDouble(parts[1]) : 0;
            double sec = parts.length > 2 ? Double.parseDouble(parts[2]) : 0;
            double angle = deg + min / 60 + sec / 3600;
            return negative ? -angle : angle;
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid angle for " + key + ": " + value, e);
        }
    }
}
