package com.questrail.acars.splitter.observability;

import java.time.Instant;

/**
 * Record representing a failure inside the splitter (bucket write errors,
 * unexpected exceptions at a task boundary).
 */
public record SplitterErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
