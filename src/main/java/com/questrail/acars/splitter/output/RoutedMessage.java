package com.questrail.acars.splitter.output;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where one message ended up.
 */
public record RoutedMessage(Optional<String> key, String bucket, Path file) {
    public RoutedMessage {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(file, "file");
    }
}
