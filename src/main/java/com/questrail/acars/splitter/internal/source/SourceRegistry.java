package com.questrail.acars.splitter.internal.source;

import com.questrail.acars.splitter.internal.time.MonotonicClock;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Owner of every {@link SourceBuffer}, one per configured port.
 *
 * <p>The set of sources is fixed at construction; buffers live as long as the
 * registry. Each buffer starts empty with its last activity set to the
 * construction tick, so a source cannot be swept before one full idle window
 * has passed.</p>
 */
public final class SourceRegistry {

    private final Map<Integer, SourceBuffer> sources;

    public SourceRegistry(Collection<Integer> ports, MonotonicClock clock) {
        Objects.requireNonNull(ports, "ports");
        Objects.requireNonNull(clock, "clock");
        if (ports.isEmpty()) {
            throw new IllegalArgumentException("At least one port required");
        }

        long now = clock.nowNanos();
        Map<Integer, SourceBuffer> m = new LinkedHashMap<>();
        for (Integer port : ports) {
            m.putIfAbsent(Objects.requireNonNull(port, "port"), new SourceBuffer(port, now));
        }
        this.sources = Collections.unmodifiableMap(m);
    }

    /**
     * @throws IllegalArgumentException if the port was not configured
     */
    public SourceBuffer source(int port) {
        SourceBuffer s = sources.get(port);
        if (s == null) {
            throw new IllegalArgumentException("Unknown source port: " + port);
        }
        return s;
    }

    /**
     * Sources in configuration order.
     */
    public Collection<SourceBuffer> all() {
        return sources.values();
    }

    public Set<Integer> ports() {
        return sources.keySet();
    }
}
