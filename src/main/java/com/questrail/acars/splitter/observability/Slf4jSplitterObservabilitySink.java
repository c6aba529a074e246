package com.questrail.acars.splitter.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SplitterObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSplitterObservabilitySink implements SplitterObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSplitterObservabilitySink.class);

    @Override
    public void onMessageRouted(MessageRoutedEvent event) {
        String key = event.key().orElse("unclassified");
        switch (event.reason()) {
            case DELIMITED -> log.info("Port {}: Processed message with {}: {}",
                event.port(), event.strategy().configName(), key);
            case TIMEOUT -> log.info("Port {}: Processed timeout message with {}: {}",
                event.port(), event.strategy().configName(), key);
            case OVERFLOW -> log.warn("Port {}: Buffer cap reached, flushed pending message with {}: {}",
                event.port(), event.strategy().configName(), key);
        }
        log.debug("Port {}: appended to {}", event.port(), event.bucket());
    }

    @Override
    public void onSourceAnomaly(SourceAnomalyEvent event) {
        switch (event.kind()) {
            case UNDECODABLE_DATAGRAM -> log.warn(
                "Received data on port {} that could not be decoded as UTF-8", event.port());
            case NO_DELIMITER -> log.warn(
                "Port {}: {} buffered characters contain no timestamp line; cannot flush "
                    + "(is JAERO set to output format 3?)", event.port(), event.bufferedChars());
            case BUFFER_DISCARDED -> log.warn(
                "Port {}: discarded {} buffered characters that never contained a timestamp line",
                event.port(), event.bufferedChars());
            case LEADING_TEXT_DISCARDED -> log.warn(
                "Port {}: discarded {} characters received before the first timestamp line",
                event.port(), event.bufferedChars());
        }
    }

    @Override
    public void onTransportEvent(TransportStateEvent event) {
        if (event.up()) {
            log.info("Listening for ACARS messages on port {}", event.port());
        }
        else if (event.cause() != null) {
            log.error("Port {}: transport failed", event.port(), event.cause());
        }
        else {
            log.info("Port {}: listener closed", event.port());
        }
    }

    @Override
    public void onError(SplitterErrorEvent event) {
        log.error("Splitter error: {}", event.message(), event.cause());
    }
}
