package org.janelia.calibration.util;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.janelia.calibration.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    /** Extensions of files that are written gzip compressed. */
    private static final String[] COMPRESSED_EXTENSIONS = { ".gz", ".cal" };

    private static final int BUFFER_SIZE = 65536;

    /**
     * @return UTF-8 writer for the path, gzip compressed if the path has a compressed extension.
     */
    public static Writer getExtensionBasedWriter(final Path path)
            throws IOException {

        final OutputStream outputStream;
        if (isCompressedExtension(path.toString())) {
            outputStream = new GZIPOutputStream(Files.newOutputStream(path), BUFFER_SIZE);
        } else {
            outputStream = new BufferedOutputStream(Files.newOutputStream(path), BUFFER_SIZE);
        }

        return new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
    }

    /**
     * Reads the full text content of a file that may or may not be gzip compressed
     * (compression is detected from the content, not the extension).
     * Content is decoded as UTF-8, falling back to ISO-8859-1 for content written with legacy encodings.
     *
     * @param  path  file to read.
     *
     * @return the decoded text.
     *
     * @throws IOException
     *   if the file cannot be read.
     */
    public static String readText(final Path path)
            throws IOException {

        byte[] bytes = Files.readAllBytes(path);

        if (isGzipped(bytes)) {
            try (final InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
                bytes = in.readAllBytes();
            }
        }

        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (final CharacterCodingException e) {
            LOG.warn("readText: {} is not valid UTF-8, decoding with ISO-8859-1 instead", path);
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }

        return text;
    }

    public static void saveJsonFile(final Path path,
                                    final Object data)
            throws IOException {
        saveJsonFile(path, data, JsonUtils.MAPPER);
    }

    /**
     * Writes the data as JSON, creating missing parent directories.
     * Files with a .gz or .cal extension are gzip compressed.
     *
     * @throws IOException
     *   if the file cannot be written.
     */
    public static void saveJsonFile(final Path path,
                                    final Object data,
                                    final ObjectMapper mapper)
            throws IOException {

        final Path toPath = path.toAbsolutePath();
        if (toPath.getParent() != null) {
            ensureWritableDirectory(toPath.getParent().toFile());
        }

        try (final Writer writer = getExtensionBasedWriter(toPath)) {
            mapper.writeValue(writer, data);
        } catch (final IOException | RuntimeException e) {
            throw new IOException("failed to write " + toPath, e);
        }

        LOG.info("saveJsonFile: wrote {}", toPath);
    }

    /**
     * @throws IllegalArgumentException
     *   if the directory cannot be created or is not writable.
     */
    public static void ensureWritableDirectory(final File directory)
            throws IllegalArgumentException {
        // mkdirs fails when another process creates the directory concurrently, so check existence again
        if ((! directory.exists()) && (! directory.mkdirs()) && (! directory.exists())) {
            throw new IllegalArgumentException("failed to create " + directory);
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    private static boolean isCompressedExtension(final String fullPathName) {
        for (final String extension : COMPRESSED_EXTENSIONS) {
            if (fullPathName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isGzipped(final byte[] bytes) {
        return (bytes.length > 1) &&
               ((bytes[0] & 0xff) == (GZIPInputStream.GZIP_MAGIC & 0xff)) &&
               ((bytes[1] & 0xff) == ((GZIPInputStream.GZIP_MAGIC >> 8) & 0xff));
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
