package com.skycam.main;

import com.skycam.model.Catalog;
import com.skycam.model.ConfigException;
import com.skycam.model.FrameResult;
import com.skycam.model.SkycamConfig;
import com.skycam.service.BatchProcessingService;
import com.skycam.service.CatalogException;
import com.skycam.service.CatalogService;
import com.skycam.service.FrameProcessingService;
import com.skycam.service.SkyImageLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Linea de comandos: SkycamApp <config.properties> <imagen>.... Escribe una linea de resumen
// por imagen.
public class SkycamApp {

    private static final Logger log = LoggerFactory.getLogger(SkycamApp.class);

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        if (args.length < 2) {
            System.err.println("Usage: SkycamApp <config.properties> <image>...");
            System.exit(2);
        }
        System.exit(run(args));
    }

    static int run(String[] args) {
        SkycamConfig config;
        try {
            config = SkycamConfig.load(Paths.get(args[0]));
        } catch (IOException e) {
            log.error("No se puede leer la configuracion {}: {}", args[0], e.getMessage());
            return 1;
        }

        Catalog catalog;
        FrameProcessingService processor;
        try {
            catalog = new CatalogService().load(config);
            processor = new FrameProcessingService(config, catalog);
        } catch (CatalogException e) {
            log.error("Error de catalogo: {}", e.getMessage());
            return 1;
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Error de configuracion en {}: {}", args[0], e.getMessage());
            return 1;
        }

        List<Path> files = new ArrayList<>();
        for (int i = 1; i < args.length; i++) files.add(Paths.get(args[i]));

        BatchProcessingService batch = new BatchProcessingService(new SkyImageLoader(config), processor, config.getThreads());
        List<FrameResult> results;
        try {
            results = batch.processAll(files);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Lote interrumpido");
            return 1;
        }

        for (FrameResult r : results) {
            log.info("{} {}: estrellas={} planetas={} porcentaje={} nubes={} altSol={} altLuna={}",
                    config.getName(), r.timestamp, r.stars.size(), r.planets.size(),
                    String.format("%.3f", r.globalStarPercentage),
                    r.globalCoverage.isPresent() ? String.format("%.3f", r.globalCoverage.getAsDouble()) : "-",
                    String.format("%.1f", Math.toDegrees(r.sunAltitude)),
                    String.format("%.1f", Math.toDegrees(r.moonAltitude)));
        }
        return 0;
    }
}
