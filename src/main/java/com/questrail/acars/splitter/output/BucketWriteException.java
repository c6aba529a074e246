package com.questrail.acars.splitter.output;

import java.nio.file.Path;

/**
 * Indicates that a message could not be appended to its bucket file, or that the
 * output directory could not be prepared.
 *
 * <p>Write failures are scoped to one bucket: the engine reports them and keeps
 * routing other messages.</p>
 */
public final class BucketWriteException extends RuntimeException
{
    private final Path path;

    public BucketWriteException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
