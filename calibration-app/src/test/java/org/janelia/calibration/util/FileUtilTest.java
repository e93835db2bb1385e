package org.janelia.calibration.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.zip.GZIPInputStream;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link FileUtil} class.
 *
 * @author Eric Trautman
 */
public class FileUtilTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testSaveCompressedJsonFile() throws Exception {

        final File file = new File(temporaryFolder.getRoot(), "nested/dir/test.cal");
        FileUtil.saveJsonFile(file.toPath(), Collections.singletonMap("name", "camera é"));

        Assert.assertTrue("file not written", file.exists());

        final String rawText;
        try (final InputStream in = new GZIPInputStream(new FileInputStream(file))) {
            rawText = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Assert.assertTrue("invalid content " + rawText, rawText.contains("camera é"));

        Assert.assertEquals("readText should decompress", rawText, FileUtil.readText(file.toPath()));
    }

    @Test
    public void testReadLegacyEncodedText() throws Exception {
        final Path path = temporaryFolder.getRoot().toPath().resolve("legacy.json");
        Files.write(path, "{\"name\":\"Kamera ü\"}".getBytes(StandardCharsets.ISO_8859_1));

        Assert.assertEquals("invalid fallback decoding", "{\"name\":\"Kamera ü\"}", FileUtil.readText(path));
    }

    @Test(expected = IOException.class)
    public void testReadMissingFile() throws Exception {
        FileUtil.readText(temporaryFolder.getRoot().toPath().resolve("missing.cal"));
    }

}
