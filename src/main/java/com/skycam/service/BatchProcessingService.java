package com.skycam.service;

import com.skycam.model.FrameResult;
import com.skycam.model.SkyImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Procesa un lote de imagenes independientes en un pool fijo de hilos. Las imagenes que no
// se pueden leer o analizar se registran y se saltan.
public class BatchProcessingService {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessingService.class);

    private static final long DEFAULT_TIMEOUT_MINUTES = 24 * 60;

    private final SkyImageLoader loader;
    private final FrameProcessingService processor;
    private final int threads;
    private final long timeoutMinutes;
    private volatile int lastSkipped;

    public BatchProcessingService(SkyImageLoader loader, FrameProcessingService processor, int threads) {
        this(loader, processor, threads, DEFAULT_TIMEOUT_MINUTES);
    }

    public BatchProcessingService(SkyImageLoader loader, FrameProcessingService processor, int threads, long timeoutMinutes) {
        this.loader = loader;
        this.processor = processor;
        this.threads = Math.max(1, threads);
        this.timeoutMinutes = timeoutMinutes;
    }

    // Imagenes saltadas en la ultima llamada a processAll
    public int getLastSkipped() {
        return lastSkipped;
    }

    // Resultados ordenados por hora de la imagen.
    public List<FrameResult> processAll(List<Path> files) throws InterruptedException {
        List<FrameResult> results = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger processed = new AtomicInteger(0);
        AtomicInteger skipped = new AtomicInteger(0);

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        List<Future<?>> tasks = new ArrayList<>();
        try {
            for (Path file : files) {
                tasks.add(exec.submit(() -> {
                    try {
                        SkyImage image = loader.load(file);
                        Optional<FrameResult> result = processor.process(image);
                        if (result.isPresent()) {
                            results.add(result.get());
                        } else {
                            skipped.incrementAndGet();
                        }
                    } catch (IOException e) {
                        log.error("Saltando {}: {}", file, e.getMessage());
                        skipped.incrementAndGet();
                    } catch (RuntimeException e) {
                        log.error("Fallo al procesar {}", file, e);
                        skipped.incrementAndGet();
                    } finally {
                        log.debug("Progreso {}/{}", processed.incrementAndGet(), files.size());
                    }
                }));
            }
            exec.shutdown();
            if (!exec.awaitTermination(timeoutMinutes, TimeUnit.MINUTES)) {
                log.error("Lote sin terminar tras {} min; resultados parciales", timeoutMinutes);
            }
            // Errores que no son RuntimeException (OutOfMemoryError...) solo se ven en el Future
            for (int i = 0; i < tasks.size(); i++) {
                Future<?> f = tasks.get(i);
                if (!f.isDone()) {
                    log.error("Imagen {} sin procesar", files.get(i));
                    skipped.incrementAndGet();
                    continue;
                }
                try {
                    f.get();
                } catch (ExecutionException e) {
                    log.error("Fallo al procesar {}", files.get(i), e.getCause());
                    skipped.incrementAndGet();
                }
            }
        } finally {
            exec.shutdownNow();
        }

        lastSkipped = skipped.get();
        log.info("Lote terminado: {} imagenes, {} saltadas", files.size(), skipped.get());
        List<FrameResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparing(r -> r.timestamp));
        return sorted;
    }
}
