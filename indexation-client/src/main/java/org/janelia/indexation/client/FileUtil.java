package org.janelia.indexation.client;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.janelia.indexation.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility for reading and writing (optionally gzipped) JSON files.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    public static final FileUtil DEFAULT_INSTANCE = new FileUtil();

    private final int bufferSize;

    public FileUtil() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public FileUtil(final int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public Reader getExtensionBasedReader(final String fullPathName)
            throws IOException {

        final InputStream inputStream;

        if (fullPathName.endsWith(".gz")) {
            inputStream = new GZIPInputStream(new FileInputStream(fullPathName), bufferSize);
        } else {
            inputStream = new BufferedInputStream(new FileInputStream(fullPathName), bufferSize);
        }

        return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
    }

    public Writer getExtensionBasedWriter(final String fullPathName)
            throws IOException {

        final OutputStream outputStream;

        if (fullPathName.endsWith(".gz")) {
            outputStream = new GZIPOutputStream(new FileOutputStream(fullPathName), bufferSize);
        } else {
            outputStream = new BufferedOutputStream(new FileOutputStream(fullPathName), bufferSize);
        }

        return new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
    }

    public static <T> T loadJsonFile(final String path,
                                     final Class<T> valueType)
            throws IOException {

        final Path fromPath = Paths.get(path).toAbsolutePath();

        LOG.info("loadJsonFile: entry, path={}", fromPath);

        final T data;
        try (final Reader reader = DEFAULT_INSTANCE.getExtensionBasedReader(fromPath.toString())) {
            data = JsonUtils.FAST_MAPPER.readValue(reader, valueType);
        }

        LOG.info("loadJsonFile: exit, loaded {}", valueType.getSimpleName());

        return data;
    }

    public static void saveJsonFile(final String path,
                                    final Object data)
            throws IOException {

        final Path toPath = Paths.get(path).toAbsolutePath();

        LOG.info("saveJsonFile: entry");

        try (final Writer writer = DEFAULT_INSTANCE.getExtensionBasedWriter(toPath.toString())) {
            JsonUtils.MAPPER.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + toPath, t);
        }

        LOG.info("saveJsonFile: exit, wrote data to {}", toPath);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

    private static final int DEFAULT_BUFFER_SIZE = 65536;
}
