package com.questrail.acars.splitter.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.questrail.acars.splitter.classify.SplitStrategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * SplitterConfigLoader
 * =============================================================================
 * Reads a {@link SplitterConfig} from a JSON document (comments allowed).
 *
 * <pre>
 * {
 *   "host": "127.0.0.1",          // optional
 *   "ports": [5555, 5556],        // required, non-empty
 *   "output_dir": "acars_split",  // optional
 *   "buffer_timeout": 60,         // optional, seconds, > 0
 *   "split_by": "label",          // optional: label | tail | type | keyword
 *   "keyword": "WARN",            // required when split_by is keyword
 *   "max_buffer_chars": 1048576   // optional, > 0
 * }
 * </pre>
 *
 * <h2>Failures</h2>
 * Missing {@code ports}, malformed JSON and out-of-range values raise
 * {@link ConfigurationException}. Two mistakes are recoverable and only logged:
 * an unknown {@code split_by}, and {@code split_by=keyword} without a keyword.
 * Both fall back to label splitting.
 *
 * <p>{@link #loadOutputSettings(Path)} reads only {@code output_dir},
 * {@code split_by} and {@code keyword}, for offline splitting. It ignores the
 * socket keys, so {@code ports} may be absent.</p>
 */
public final class SplitterConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SplitterConfigLoader.class);

    private final ObjectMapper mapper;

    public SplitterConfigLoader() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
    }

    /**
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public SplitterConfig load(Path file) {
        return parse(read(file));
    }

    /**
     * @throws ConfigurationException if the document is malformed or invalid
     */
    public SplitterConfig parse(String json) {
        return fromTree(readTree(json));
    }

    /**
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public OutputSettings loadOutputSettings(Path file) {
        return parseOutputSettings(read(file));
    }

    /**
     * @throws ConfigurationException if the document is malformed or invalid
     */
    public OutputSettings parseOutputSettings(String json) {
        return readOutput(readTree(json));
    }

    private static String read(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            return Files.readString(file);
        }
        catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file, e);
        }
    }

    private JsonNode readTree(String json) {
        Objects.requireNonNull(json, "json");

        final JsonNode root;
        try {
            root = mapper.readTree(json);
        }
        catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }
        return root;
    }

    private SplitterConfig fromTree(JsonNode root) {
        SplitterConfig.Builder builder = SplitterConfig.builder();

        readPorts(root, builder);
        text(root, "host").ifPresent(builder::withHost);

        JsonNode timeout = root.get("buffer_timeout");
        if (isPresent(timeout)) {
            builder.withBufferTimeout(toTimeout(timeout));
        }

        JsonNode maxChars = root.get("max_buffer_chars");
        if (isPresent(maxChars)) {
            if (!maxChars.isIntegralNumber() || !maxChars.canConvertToInt() || maxChars.intValue() <= 0) {
                throw new ConfigurationException("max_buffer_chars must be a positive integer, got " + maxChars);
            }
            builder.withMaxBufferChars(maxChars.intValue());
        }

        OutputSettings output = readOutput(root);
        builder.withOutputDirectory(output.outputDirectory())
            .withSplitBy(output.splitBy())
            .withKeyword(output.keyword());

        try {
            return builder.build();
        }
        catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static OutputSettings readOutput(JsonNode root) {
        Path outputDirectory = text(root, "output_dir")
            .map(SplitterConfigLoader::toPath)
            .orElse(SplitterConfig.DEFAULT_OUTPUT_DIRECTORY);

        SplitStrategy strategy = readStrategy(root);
        String keyword = null;
        if (strategy == SplitStrategy.KEYWORD) {
            Optional<String> configured = text(root, "keyword").filter(k -> !k.isBlank());
            if (configured.isPresent()) {
                keyword = configured.get();
            }
            else {
                log.warn("split_by is 'keyword' but no keyword specified. Using 'label' instead.");
                strategy = SplitStrategy.LABEL;
            }
        }
        return new OutputSettings(outputDirectory, strategy, keyword);
    }

    private static void readPorts(JsonNode root, SplitterConfig.Builder builder) {
        JsonNode ports = root.get("ports");
        if (!isPresent(ports) || !ports.isArray() || ports.isEmpty()) {
            throw new ConfigurationException("Configuration must include a non-empty 'ports' array");
        }
        for (JsonNode port : ports) {
            if (!port.isIntegralNumber() || !port.canConvertToInt()
                    || port.intValue() < 1 || port.intValue() > 65535) {
                throw new ConfigurationException("Invalid port " + port + "; expected an integer in 1..65535");
            }
            builder.withPort(port.intValue());
        }
    }

    private static SplitStrategy readStrategy(JsonNode root) {
        JsonNode splitBy = root.get("split_by");
        if (!isPresent(splitBy)) {
            return SplitStrategy.LABEL;
        }

        Optional<SplitStrategy> strategy = splitBy.isTextual()
            ? SplitStrategy.fromConfigName(splitBy.textValue())
            : Optional.empty();
        if (strategy.isEmpty()) {
            log.warn("Invalid split_by value: '{}'. Using 'label' instead.",
                splitBy.isTextual() ? splitBy.textValue() : splitBy.toString());
            return SplitStrategy.LABEL;
        }
        return strategy.get();
    }

    private static Duration toTimeout(JsonNode node) {
        if (!node.isNumber()) {
            throw new ConfigurationException("buffer_timeout must be a number of seconds, got " + node);
        }
        double seconds = node.doubleValue();
        if (!(seconds > 0) || Double.isInfinite(seconds)) {
            throw new ConfigurationException("buffer_timeout must be positive, got " + node);
        }

        Duration timeout = Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
        if (timeout.isZero()) {
            throw new ConfigurationException("buffer_timeout is too small: " + node);
        }
        return timeout;
    }

    private static Path toPath(String dir) {
        try {
            return Path.of(dir);
        }
        catch (InvalidPathException e) {
            throw new ConfigurationException("Invalid output_dir: " + dir, e);
        }
    }

    private static Optional<String> text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (!isPresent(node)) {
            return Optional.empty();
        }
        if (!node.isTextual()) {
            throw new ConfigurationException(field + " must be a string, got " + node);
        }
        return Optional.of(node.textValue());
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull();
    }
}
