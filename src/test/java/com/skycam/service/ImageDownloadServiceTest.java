package com.skycam.service;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import com.skycam.model.SkyImage;
import com.sun.net.httpserver.HttpServer;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import java.io.File;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ImageDownloadServiceTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private HttpServer server;
    private volatile byte[] content;
    private volatile Instant modified;

    @Before
    public void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/latest.tif", exchange -> {
            exchange.getResponseHeaders().set("Last-Modified",
                    DateTimeFormatter.RFC_1123_DATE_TIME.format(modified.atZone(ZoneOffset.UTC)));
            if ("HEAD".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(200, -1);
            } else {
                exchange.sendResponseHeaders(200, content.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(content);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @After
    public void stopServer() {
        server.stop(0);
    }

    private byte[] tiff(int value) throws Exception {
        ByteProcessor bp = new ByteProcessor(3, 3);
        bp.set(1, 1, value);
        File file = tmp.newFile();
        new FileSaver(new ImagePlus("", bp)).saveAsTiff(file.getPath());
        return Files.readAllBytes(file.toPath());
    }

    private URL url() throws Exception {
        return new URL("http://127.0.0.1:" + server.getAddress().getPort() + "/latest.tif");
    }

    @Test
    public void downloadsOnlyNewImages() throws Exception {
        ImageDownloadService service = new ImageDownloadService(new SkyImageLoader("'x_'yyyyMMdd_HHmmss", 0), 5000);
        content = tiff(255);
        modified = Instant.parse("2024-03-01T23:00:00Z");

        SkyImage first = service.download(url());
        assertEquals(modified, first.timestamp);
        assertEquals(1f, first.get(1, 1), 1e-6f);

        try {
            service.download(url());
            fail("Same Last-Modified must be rejected");
        } catch (TooEarlyException e) {
            assertTrue(e.getMessage().startsWith("Not modified"));
        }

        modified = Instant.parse("2024-03-01T23:02:00Z");
        try {
            service.download(url());
            fail("Same content must be rejected");
        } catch (TooEarlyException e) {
            assertTrue(e.getMessage().startsWith("Same content"));
        }

        content = tiff(128);
        modified = Instant.parse("2024-03-01T23:04:00Z");
        SkyImage next = service.download(url());
        assertEquals(modified, next.timestamp);
        assertEquals(modified.toEpochMilli(), service.getState().getLastModified());
    }

    @Test
    public void stateTracksModificationAndContent() {
        DownloadState state = new DownloadState();
        assertTrue(state.isNewModification(0));
        state.markModification(1000);
        assertFalse(state.isNewModification(1000));
        assertTrue(state.isNewModification(2000));

        assertTrue(state.isNewContent("abc"));
        state.markContent("abc");
        assertFalse(state.isNewContent("abc"));
        assertEquals("abc", state.getHash());
    }

    @Test
    public void suffixFollowsUrlPath() throws Exception {
        assertEquals(".tif", ImageDownloadService.suffix(new URL("http://host/img/latest.tif")));
        assertEquals(".fits.gz", ImageDownloadService.suffix(new URL("http://host/a.b/latest.fits.gz")));
        assertEquals(".img", ImageDownloadService.suffix(new URL("http://host/cam/latest")));
    }

    @Test
    public void sha1IsHex() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d",
                ImageDownloadService.sha1("abc".getBytes(StandardCharsets.US_ASCII)));
    }
}
