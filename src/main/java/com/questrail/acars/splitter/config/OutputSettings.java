package com.questrail.acars.splitter.config;

import com.questrail.acars.splitter.classify.SplitStrategy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where messages go and how they are bucketed. This is all an offline split
 * needs; the UDP runtime gets it from {@link SplitterConfig#output()}.
 *
 * <p>{@code keyword} is {@code null} unless {@code splitBy} is
 * {@link SplitStrategy#KEYWORD}, in which case it is required and non-blank.</p>
 */
public record OutputSettings(Path outputDirectory, SplitStrategy splitBy, String keyword) {

    public OutputSettings {
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(splitBy, "splitBy");

        if (splitBy == SplitStrategy.KEYWORD) {
            if (keyword == null || keyword.isBlank()) {
                throw new IllegalArgumentException("split_by=keyword requires a keyword");
            }
        }
        else {
            keyword = null;
        }
    }

    /**
     * {@code acars_split}, split by label.
     */
    public static OutputSettings defaults() {
        return new OutputSettings(SplitterConfig.DEFAULT_OUTPUT_DIRECTORY, SplitStrategy.LABEL, null);
    }

    public OutputSettings withOutputDirectory(Path outputDirectory) {
        return new OutputSettings(outputDirectory, splitBy, keyword);
    }

    public OutputSettings withSplitBy(SplitStrategy splitBy, String keyword) {
        return new OutputSettings(outputDirectory, splitBy, keyword);
    }
}
