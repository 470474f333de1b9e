/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.exception.SampleLoadException;
import com.ammann.randomness.exception.SampleNotFoundException;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.model.ByteSample;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reads sample bytes from files or streams.
 *
 * <p>The whole input is materialized in memory before analysis, bounded by
 * {@code randomness.loader.max-bytes}. File requests are resolved against
 * {@code randomness.loader.base-dir} and may not escape it. All I/O failures are
 * reported here, before the statistical engine runs.
 */
@ApplicationScoped
public class SampleLoaderService {

    private static final Logger LOG = Logger.getLogger(SampleLoaderService.class);

    static final long DEFAULT_MAX_BYTES = 64L * 1024 * 1024;
    private static final int READ_CHUNK_BYTES = 8192;

    @ConfigProperty(name = "randomness.loader.max-bytes", defaultValue = "67108864")
    long maxBytes = DEFAULT_MAX_BYTES;

    @ConfigProperty(name = "randomness.loader.base-dir", defaultValue = ".")
    String baseDir = ".";

    public SampleLoaderService() {}

    public SampleLoaderService(long maxBytes, String baseDir) {
        this.maxBytes = maxBytes;
        this.baseDir = baseDir;
    }

    /**
     * Reads a stream to its end.
     *
     * @param input stream to consume; not closed by this method
     * @return sample holding every byte read
     * @throws SampleLoadException if reading fails
     * @throws ValidationException if the stream exceeds the configured maximum
     */
    public ByteSample load(InputStream input) {
        if (input == null) {
            throw ValidationException.invalidParameter("input", null, "readable stream");
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[READ_CHUNK_BYTES];
        long total = 0;

        try {
            int read;
            while ((read = input.read(chunk)) != -1) {
                total += read;
                checkSize(total);
                buffer.write(chunk, 0, read);
            }
        } catch (IOException e) {
            throw new SampleLoadException("Failed to read sample stream: " + e.getMessage(), e);
        }

        LOG.debugf("Loaded %d bytes from stream", total);
        return ByteSample.of(buffer.toByteArray());
    }

    /**
     * Reads a whole file.
     *
     * @param file path of the file to read
     * @return sample holding the file contents
     * @throws SampleNotFoundException if the file does not exist
     * @throws SampleLoadException if reading fails for any other reason
     */
    public ByteSample load(Path file) {
        if (file == null) {
            throw ValidationException.invalidParameter("path", null, "file path");
        }

        try {
            if (Files.isDirectory(file)) {
                throw ValidationException.invalidParameter("path", file, "regular file");
            }
            checkSize(Files.size(file));
            byte[] bytes = Files.readAllBytes(file);
            LOG.debugf("Loaded %d bytes from %s", bytes.length, file);
            return ByteSample.of(bytes);
        } catch (NoSuchFileException e) {
            throw new SampleNotFoundException(file.toString(), e);
        } catch (IOException e) {
            LOG.warnf("Cannot read sample file %s: %s", file, e.getMessage());
            throw new SampleLoadException("Failed to read sample file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves a caller-supplied relative path against the configured base directory.
     *
     * @throws ValidationException if the path is blank, absolute, or escapes the base directory
     */
    public Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw ValidationException.invalidParameter("path", relativePath, "non-blank relative path");
        }

        Path base = Path.of(baseDir).toAbsolutePath().normalize();
        Path requested = Path.of(relativePath);
        if (requested.isAbsolute()) {
            throw ValidationException.invalidParameter("path", relativePath, "path relative to the sample directory");
        }

        Path resolved = base.resolve(requested).normalize();
        if (!resolved.startsWith(base)) {
            throw ValidationException.invalidParameter("path", relativePath, "path inside the sample directory");
        }
        return resolved;
    }

    private void checkSize(long size) {
        if (size > maxBytes) {
            throw ValidationException.invalidParameter(
                    "sample size", size + " bytes", "at most " + maxBytes + " bytes");
        }
    }
}
