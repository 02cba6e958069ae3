package com.skycam.service;

import com.skycam.model.SkyImage;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Descarga la ultima imagen publicada por la camara. Solo se acepta una imagen si la web
// cambio su Last-Modified y ademas el contenido es distinto (a veces la web se actualiza sin
// cambiar la imagen).
public class ImageDownloadService {

    private static final Logger log = LoggerFactory.getLogger(ImageDownloadService.class);

    private final SkyImageLoader loader;
    private final int timeoutMillis;
    private final DownloadState state = new DownloadState();

    public ImageDownloadService(SkyImageLoader loader, int timeoutMillis) {
        this.loader = loader;
        this.timeoutMillis = timeoutMillis;
    }

    public SkyImage download(URL url) throws IOException, TooEarlyException {
        long modified = lastModified(url);
        if (!state.isNewModification(modified)) {
            throw new TooEarlyException("Not modified since " + Instant.ofEpochMilli(modified));
        }
        state.markModification(modified);

        log.info("Descargando imagen de {}", url);
        byte[] content = fetch(url);
        String hash = sha1(content);
        if (!state.isNewContent(hash)) {
            throw new TooEarlyException("Same content as previous image: " + hash);
        }
        state.markContent(hash);

        Path tmp = Files.createTempFile("skycam_", suffix(url));
        try {
            Files.write(tmp, content);
            return loader.load(tmp, Instant.ofEpochMilli(modified));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public DownloadState getState() {
        return state;
    }

    private long lastModified(URL url) throws IOException {
        HttpURLConnection conn = open(url, "HEAD");
        try {
            long modified = conn.getLastModified();
            if (modified == 0) throw new IOException("No Last-Modified header from " + url);
            return modified;
        } finally {
            conn.disconnect();
        }
    }

    private byte[] fetch(URL url) throws IOException {
        HttpURLConnection conn = open(url, "GET");
        try (InputStream in = conn.getInputStream()) {
            return in.readAllBytes();
        } finally {
            conn.disconnect();
        }
    }

    private HttpURLConnection open(URL url, String method) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) url.openConnection();
        conn.setRequestMethod(method);
        conn.setConnectTimeout(timeoutMillis);
        conn.setReadTimeout(timeoutMillis);
        int code = conn.getResponseCode();
        if (code != HttpURLConnection.HTTP_OK) {
            conn.disconnect();
            throw new IOException(method + " " + url + " returned HTTP " + code);
        }
        return conn;
    }

    static String suffix(URL url) {
        String path = url.getPath();
        int slash = path.lastIndexOf('/');
        int dot = path.indexOf('.', slash + 1);
        return dot >= 0 ? path.substring(dot) : ".img";
    }

    static String sha1(byte[] content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(content);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
