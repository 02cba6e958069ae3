package com.skycam.service;

import com.skycam.model.Catalog;
import com.skycam.model.CelestialObject;
import com.skycam.model.SkycamConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Carga el catalogo de estrellas y los puntos de interes (CSV con cabecera, ra/dec en
// grados). Se ejecuta una vez por proceso.
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private static final String DATA_PACKAGE = "/com/skycam/data/";

    public Catalog load(SkycamConfig config) {
        log.debug("Cargando estrellas");
        if (isBundled(config.getCatalogue())) {
            log.warn("Usando el catalogo incluido {} (solo estrellas brillantes); para un mapa de nubes util configurar {}",
                    config.getCatalogue(), "analysis.catalogue");
        }
        List<CelestialObject> stars;
        try (InputStream in = open(config.getCatalogue())) {
            stars = readStars(in);
        } catch (IOException e) {
            throw new CatalogException("Star catalogue not readable: " + config.getCatalogue(), e);
        }

        double minSeparation = config.getCatalogueMinSeparation();
        if (minSeparation > 0) {
            int before = stars.size();
            stars = filterCatalogue(stars, minSeparation);
            log.info("Catalogo filtrado a {} grados: {} de {} estrellas", minSeparation, stars.size(), before);
        }

        log.debug("Cargando puntos de interes");
        List<CelestialObject> pois;
        try (InputStream in = open(config.getPointsOfInterest())) {
            pois = readPointsOfInterest(in, config.getPoiRadius());
        } catch (IOException e) {
            throw new CatalogException("Points of interest not readable: " + config.getPointsOfInterest(), e);
        }

        log.info("Catalogo cargado: {} estrellas, {} puntos de interes", stars.size(), pois.size());
        return new Catalog(stars, pois);
    }

    public List<CelestialObject> readStars(InputStream in) throws IOException {
        List<CelestialObject> stars = new ArrayList<>();
        for (Row row : readCsv(in)) {
            stars.add(CelestialObject.star(
                    row.getInt("id", stars.size()),
                    row.get("name", ""),
                    Math.toRadians(row.getDouble("ra")),
                    Math.toRadians(row.getDouble("dec")),
                    row.getDouble("vmag")));
        }
        return stars;
    }

    // Columnas: id, name, ra, dec. El radio es comun a todos (analysis.poi_radius).
    public List<CelestialObject> readPointsOfInterest(InputStream in, double radius) throws IOException {
        List<CelestialObject> pois = new ArrayList<>();
        for (Row row : readCsv(in)) {
            pois.add(CelestialObject.pointOfInterest(
                    row.getInt("id", pois.size()),
                    row.get("name", ""),
                    Math.toRadians(row.getDouble("ra")),
                    Math.toRadians(row.getDouble("dec")),
                    radius));
        }
        return pois;
    }

    // Supresion voraz: de la mas brillante a la mas debil, cada estrella retenida elimina
    // las mas debiles a menos de minSeparation grados. Devuelve las retenidas por brillo.
    public static List<CelestialObject> filterCatalogue(List<CelestialObject> stars, double minSeparation) {
        List<CelestialObject> remaining = new ArrayList<>(stars);
        remaining.sort(Comparator.comparingDouble(s -> s.magnitude));
        double limit = Math.toRadians(minSeparation);

        int i = 0;
        while (i < remaining.size() - 1) {
            CelestialObject ref = remaining.get(i);
            List<CelestialObject> kept = new ArrayList<>(remaining.subList(0, i + 1));
            for (int j = i + 1; j < remaining.size(); j++) {
                CelestialObject other = remaining.get(j);
                if (Coordinates.angularSeparation(ref.dec, ref.ra, other.dec, other.ra) > limit) {
                    kept.add(other);
                }
            }
            remaining = kept;
            i++;
        }
        return remaining;
    }

    static boolean isBundled(String name) {
        return !Files.isRegularFile(Paths.get(name));
    }

    // Fichero local o, si no existe, el recurso incluido en el paquete.
    private InputStream open(String name) throws IOException {
        Path path = Paths.get(name);
        if (!isBundled(name)) {
            return Files.newInputStream(path);
        }
        log.debug("{} no encontrado, buscando en los datos del paquete", name);
        InputStream in = CatalogService.class.getResourceAsStream(DATA_PACKAGE + path.getFileName());
        if (in == null) {
            throw new CatalogException("Catalogue file not found: " + name);
        }
        return in;
    }

    private List<Row> readCsv(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        List<Row> rows = new ArrayList<>();
        Map<String, Integer> columns = null;
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            String[] cells = trimmed.split(",", -1);
            if (columns == null) {
                columns = new HashMap<>();
                for (int c = 0; c < cells.length; c++) columns.put(cells[c].trim().toLowerCase(Locale.ROOT), c);
                for (String required : new String[]{"ra", "dec"}) {
                    if (!columns.containsKey(required)) {
                        throw new CatalogException("Catalogue header has no '" + required + "' column");
                    }
                }
                continue;
            }
            rows.add(new Row(columns, cells, lineNo));
        }
        if (columns == null) {
            throw new CatalogException("Catalogue is empty");
        }
        return rows;
    }

    private static class Row {
        final Map<String, Integer> columns;
        final String[] cells;
        final int lineNo;

        Row(Map<String, Integer> columns, String[] cells, int lineNo) {
            this.columns = columns;
            this.cells = cells;
            this.lineNo = lineNo;
        }

        String get(String column, String def) {
            Integer idx = columns.get(column);
            if (idx == null || idx >= cells.length) return def;
            return cells[idx].trim();
        }

        double getDouble(String column) {
            String v = get(column, null);
            if (v == null || v.isEmpty()) {
                throw new CatalogException("Missing '" + column + "' in catalogue line " + lineNo);
            }
            try {
                return Double.parseDouble(v);
            } catch (NumberFormatException e) {
                throw new CatalogException("Invalid '" + column + "' in catalogue line " + lineNo + ": " + v, e);
            }
        }

        int getInt(String column, int def) {
            String v = get(column, null);
            if (v == null || v.isEmpty()) return def;
            try {
                return (int) Double.parseDouble(v);
            } catch (NumberFormatException e) {
                throw new CatalogException("Invalid '" + column + "' in catalogue line " + lineNo + ": " + v, e);
            }
        }
    }
}
