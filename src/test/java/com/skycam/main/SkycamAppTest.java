package com.skycam.main;

import static org.junit.Assert.assertEquals;
import java.io.File;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SkycamAppTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private File config(String key, String value) throws Exception {
        Properties props = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/com/skycam/test-camera.properties")) {
            props.load(in);
        }
        if (key != null) props.setProperty(key, value);
        File file = tmp.newFile("camera.properties");
        try (OutputStream out = Files.newOutputStream(file.toPath())) {
            props.store(out, null);
        }
        return file;
    }

    @Test
    public void missingConfigFails() {
        assertEquals(1, SkycamApp.run(new String[]{new File(tmp.getRoot(), "none.properties").getPath(), "img.fits"}));
    }

    @Test
    public void missingCatalogueFails() throws Exception {
        File cfg = config("analysis.catalogue", new File(tmp.getRoot(), "nothing_here.csv").getPath());
        assertEquals(1, SkycamApp.run(new String[]{cfg.getPath(), "img.fits"}));
    }

    @Test
    public void unknownFunctionFails() throws Exception {
        File cfg = config("analysis.function", "Wavelet");
        assertEquals(1, SkycamApp.run(new String[]{cfg.getPath(), "img.fits"}));
    }

    @Test
    public void unreadableImagesAreSkipped() throws Exception {
        File cfg = config(null, null);
        assertEquals(0, SkycamApp.run(new String[]{cfg.getPath(), new File(tmp.getRoot(), "missing.fits").getPath()}));
    }
}
