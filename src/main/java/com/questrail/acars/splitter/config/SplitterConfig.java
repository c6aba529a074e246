package com.questrail.acars.splitter.config;

import com.questrail.acars.splitter.classify.SplitStrategy;
import com.questrail.acars.splitter.internal.exec.BufferPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for the splitter runtime.
 *
 * <p>Output directory, strategy and keyword follow the rules of
 * {@link OutputSettings}. Ports keep their configured order with duplicates
 * removed.</p>
 */
public record SplitterConfig(
    String host,
    Set<Integer> ports,
    Path outputDirectory,
    BufferPolicy bufferPolicy,
    SplitStrategy splitBy,
    String keyword
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("acars_split");

    public SplitterConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(ports, "ports");
        Objects.requireNonNull(bufferPolicy, "bufferPolicy");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (ports.isEmpty()) {
            throw new IllegalArgumentException("At least one port required");
        }
        for (Integer port : ports) {
            if (port == null || port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
        }
        keyword = new OutputSettings(outputDirectory, splitBy, keyword).keyword();
        ports = Collections.unmodifiableSet(new LinkedHashSet<>(ports));
    }

    public OutputSettings output() {
        return new OutputSettings(outputDirectory, splitBy, keyword);
    }

    public Duration bufferTimeout() {
        return bufferPolicy.bufferTimeout();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private final List<Integer> ports = new ArrayList<>();
        private Path outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
        private Duration bufferTimeout = BufferPolicy.DEFAULT_BUFFER_TIMEOUT;
        private int maxBufferChars = BufferPolicy.DEFAULT_MAX_BUFFER_CHARS;
        private SplitStrategy splitBy = SplitStrategy.LABEL;
        private String keyword;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.ports.add(port);
            return this;
        }

        public Builder withPorts(Collection<Integer> ports) {
            this.ports.addAll(ports);
            return this;
        }

        public Builder withOutputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder withBufferTimeout(Duration bufferTimeout) {
            this.bufferTimeout = bufferTimeout;
            return this;
        }

        public Builder withMaxBufferChars(int maxBufferChars) {
            this.maxBufferChars = maxBufferChars;
            return this;
        }

        public Builder withSplitBy(SplitStrategy splitBy) {
            this.splitBy = splitBy;
            return this;
        }

        public Builder withKeyword(String keyword) {
            this.keyword = keyword;
            return this;
        }

        public SplitterConfig build() {
            return new SplitterConfig(host, new LinkedHashSet<>(ports), outputDirectory,
                new BufferPolicy(bufferTimeout, maxBufferChars), splitBy, keyword);
        }
    }
}
