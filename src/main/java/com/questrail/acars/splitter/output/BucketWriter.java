package com.questrail.acars.splitter.output;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * BucketWriter
 * -----------------------------------------------------------------------------
 * Appends messages to bucket files under one output directory.
 *
 * <h2>File format</h2>
 * <p>Messages are written as UTF-8 with no trailing separator. When the target
 * file already has content, a blank line ({@code "\n\n"}) is written first, so
 * consecutive messages are separated by exactly one blank line. Files are only
 * ever appended to, never truncated, including across process restarts.</p>
 *
 * <h2>Lifecycle</h2>
 * <p>{@link #prepare()} creates the output directory and must be called before
 * the first append. Bucket files are created lazily by the first message routed
 * to them. Each append opens and closes the file; nothing is held open between
 * messages.</p>
 */
public final class BucketWriter {

    static final String SEPARATOR = "\n\n";

    private final Path outputDirectory;

    public BucketWriter(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    /**
     * Create the output directory (and parents) if missing.
     *
     * @throws BucketWriteException if the directory cannot be created
     */
    public void prepare() {
        try {
            Files.createDirectories(outputDirectory);
        }
        catch (IOException e) {
            throw new BucketWriteException(outputDirectory, "Cannot create output directory", e);
        }
    }

    /**
     * Append one message to a bucket file.
     *
     * @param bucket file name relative to the output directory (see {@link BucketNaming})
     * @return the file written
     * @throws BucketWriteException on any I/O failure
     */
    public Path append(String bucket, String message) {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(message, "message");

        Path file = outputDirectory.resolve(bucket);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            // Size is read after open: CREATE has made the file exist, and nothing
            // has been written through this handle yet.
            if (Files.size(file) > 0) {
                out.write(SEPARATOR);
            }
            out.write(message);
        }
        catch (IOException e) {
            throw new BucketWriteException(file, "Cannot append to bucket", e);
        }
        return file;
    }
}
