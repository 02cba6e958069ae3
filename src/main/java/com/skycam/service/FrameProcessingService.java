package com.skycam.service;

import com.skycam.model.AirMassModel;
import com.skycam.model.CameraModel;
import com.skycam.model.Catalog;
import com.skycam.model.CelestialObject;
import com.skycam.model.CloudMap;
import com.skycam.model.CropMask;
import com.skycam.model.FrameResult;
import com.skycam.model.Observer;
import com.skycam.model.RateScanResult;
import com.skycam.model.SkyImage;
import com.skycam.model.SkyObjects;
import com.skycam.model.SkycamConfig;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Procesa una imagen completa: posiciones, deteccion, visibilidad y estadistica de nubes.
// Sin estado mutable; una instancia se comparte entre los hilos del lote.
public class FrameProcessingService {

    private static final Logger log = LoggerFactory.getLogger(FrameProcessingService.class);

    private static final int BLOB_HALF_WINDOW = 25;
    private static final double BLOB_THRESHOLD_FRACTION = 0.1;
    private static final int CLOUD_SIGMA_DIVISOR = 80;

    private final SkycamConfig config;
    private final Catalog catalog;
    private final CameraModel camera;
    private final ResponseFunction function;
    private final List<Double> kernelSizes;
    private final CropMaskService cropService = new CropMaskService();
    private final SkyObjectService skyObjects;
    private final StarDetectionService detection = new StarDetectionService();
    private final CloudCoverageService coverage = new CloudCoverageService();
    private final RateScanService rateScan = new RateScanService();
    private final AirMassModel airMass;

    public FrameProcessingService(SkycamConfig config, Catalog catalog) {
        this.config = config;
        this.catalog = catalog;
        this.camera = config.getCameraModel();
        this.function = config.isRateScanEnabled() ? ResponseFunction.ALL : ResponseFunction.fromName(config.getFunctionName());
        this.kernelSizes = config.getKernelSizes();
        if (kernelSizes.isEmpty()) {
            throw new IllegalArgumentException("At least one kernel size is required");
        }
        this.airMass = AirMassModel.fromName(config.getAirmassModelName());
        this.skyObjects = new SkyObjectService(new EphemerisService(), camera, config.getVmagLimit(), config.getMinAngleToMoon());
    }

    // Resultado de la imagen, o vacio si la imagen no se puede analizar.
    public Optional<FrameResult> process(SkyImage image) {
        log.info("Procesando imagen tomada en {}", image.timestamp);
        if (!camera.matches(image.width, image.height)) {
            log.error("La resolucion no coincide: {}x{} != {}x{}. Fichero de configuracion equivocado?",
                    image.width, image.height, camera.width, camera.height);
            return Optional.empty();
        }
        String hash = sha1(image);
        Observer observer = config.observerAt(image.timestamp);

        // --- POSICIONES ---
        CropMask staticMask = cropService.fromConfig(image.width, image.height, config);
        SkyObjects objects = skyObjects.update(catalog, observer, staticMask);
        if (objects.stars.isEmpty()) {
            log.error("No quedan estrellas tras el filtrado (quiza las elimino el recorte); imagen sin analizar");
            return Optional.empty();
        }
        CropMask mask = cropService.moonDisk(staticMask, objects.moon, camera, config.getMinAngleToMoon());

        // --- BRILLO ---
        FloatProcessor masked = image.toProcessor();
        ImageFilters.maskNaN(masked, mask);
        ImageStatistics stats = masked.getStatistics();
        FloatProcessor input = ImageFilters.fillMasked(masked, mask);

        // --- DETECCION POR KERNEL ---
        VisibilityClassifier classifier = new VisibilityClassifier(
                config.getVisibleUpperLimit(), config.getVisibleLowerLimit(),
                airMass, config.getAirmassAbsorption(), observer.elevation / 1000.0);
        int tolerance = StarDetectionService.tolerance(camera.radius);
        Map<Double, List<CelestialObject>> byKernel = new LinkedHashMap<>();
        List<CelestialObject> stars = new ArrayList<>();
        List<CelestialObject> lastStars = null;
        ResponseFunction.Grids lastGrids = null;
        for (double k : kernelSizes) {
            log.debug("Filtros de imagen {} con kernel {}", function.label(), k);
            ResponseFunction.Grids grids = function.compute(input, k, mask);
            List<CelestialObject> found = detection.detect(objects.stars, grids, tolerance);
            for (CelestialObject s : found) s.kernelSize = k;
            classifier.classify(found);
            if (config.isBlobSizeEnabled()) {
                measureBlobs(found, grids.response);
            }
            byKernel.put(k, found);
            stars.addAll(found);
            lastStars = found;
            lastGrids = grids;
        }

        // --- PORCENTAJES ---
        List<CelestialObject> pois = new ArrayList<>();
        for (CelestialObject p : objects.pointsOfInterest) pois.add(p.copy());
        if (kernelSizes.size() == 1) {
            for (CelestialObject p : pois) {
                p.starPercentage = coverage.calcStarPercentage(p, stars, p.radius, -1, CloudCoverageService.RangeUnit.DEGREE, true);
            }
        } else {
            log.warn("Los puntos de interes no se procesan con varios tamanos de kernel");
        }
        double global = coverage.calcStarPercentage(CelestialObject.wholeSky(camera.openingAngle), stars,
                camera.openingAngle, -1, CloudCoverageService.RangeUnit.DEGREE, true);

        RateScanResult scan = null;
        if (config.isRateScanEnabled()) {
            scan = rateScan.scan(lastStars, lastGrids);
        }

        CloudMap cloudMap = null;
        OptionalDouble globalCoverage = OptionalDouble.empty();
        if (config.isCloudMapEnabled()) {
            log.debug("Calculando mapa de nubes");
            cloudMap = coverage.calcCloudMap(stars, image.width / CLOUD_SIGMA_DIVISOR, image.width, image.height, true)
                    .withMask(mask);
            globalCoverage = cloudMap.meanCoverage(mask);
        }

        log.info("{} estrellas, porcentaje global {}", stars.size(), String.format("%.3f", global));
        return Optional.of(new FrameResult(image.timestamp, hash, stars, byKernel, pois, objects.planets, global,
                cloudMap, globalCoverage, stats.mean, stats.stdDev,
                objects.sun.altitude, objects.moon.altitude, objects.moonPhase, scan));
    }

    // Ventana de 51x51 alrededor del pico; las estrellas junto al borde no se miden.
    private void measureBlobs(List<CelestialObject> stars, FloatProcessor response) {
        int size = 2 * BLOB_HALF_WINDOW + 1;
        for (CelestialObject s : stars) {
            int x0 = s.maxX - BLOB_HALF_WINDOW;
            int y0 = s.maxY - BLOB_HALF_WINDOW;
            if (x0 < 0 || y0 < 0 || x0 + size > response.getWidth() || y0 + size > response.getHeight()) {
                continue;
            }
            response.setRoi(x0, y0, size, size);
            FloatProcessor window = (FloatProcessor) response.crop();
            response.resetRoi();
            s.blobSize = BlobSizer.getBlobsize(window, BLOB_THRESHOLD_FRACTION * s.responseRaw, 0);
        }
    }

    static String sha1(SkyImage image) {
        float[] px = image.pixelsCopy();
        ByteBuffer buf = ByteBuffer.allocate(px.length * Float.BYTES);
        buf.asFloatBuffer().put(px);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(buf.array());
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
