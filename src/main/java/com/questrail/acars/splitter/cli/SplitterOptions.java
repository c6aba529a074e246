package com.questrail.acars.splitter.cli;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import com.questrail.acars.splitter.classify.SplitStrategy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command-line options of {@code acars-splitter}.
 *
 * <pre>
 * acars-splitter [options] &lt;config-file&gt;
 * acars-splitter -i &lt;log-file&gt; [-o dir] [-l | -t | -m | -k keyword] [config-file]
 * </pre>
 *
 * <p>The output flags apply to offline splitting only. There the configuration
 * file is optional, and any flag given overrides the file's value.</p>
 */
public final class SplitterOptions {

    static final String PROGRAM_NAME = "acars-splitter";

    private static final String[] VALID_LOG_LEVELS = {"TRACE", "DEBUG", "INFO", "WARN", "ERROR"};

    @Parameter(description = "<config-file>")
    List<String> positional = new ArrayList<>();

    @Parameter(names = {"--input-file", "-i"},
        description = "Split an existing JAERO log file instead of listening on UDP.")
    String inputFile;

    @Parameter(names = {"--output-dir", "-o"},
        description = "Offline: directory to store output files (default: acars_split).")
    String outputDir;

    @Parameter(names = {"--by-label", "-l"}, description = "Offline: split messages by label (default).")
    boolean byLabel;

    @Parameter(names = {"--by-tail", "-t"}, description = "Offline: split messages by aircraft tail number.")
    boolean byTail;

    @Parameter(names = {"--by-type", "-m"}, description = "Offline: split messages by type (CPDLC, ADS-C, MIAM, OTHER).")
    boolean byType;

    @Parameter(names = {"--keyword", "-k"}, description = "Offline: split messages by whether they contain KEYWORD.")
    String keyword;

    @Parameter(names = {"--log-level", "-L"},
        description = "Log level. Can be one of: TRACE,DEBUG,INFO,WARN,ERROR.",
        validateWith = LogLevelValidator.class)
    String logLevel;

    @Parameter(names = {"--help", "-h"}, help = true, description = "Display this help message")
    boolean help;

    /**
     * Checks constraints JCommander cannot express. Skipped when help was requested.
     *
     * @throws ParameterException when the arguments are unusable
     */
    void validate() {
        if (help) {
            return;
        }
        if (inputFile == null) {
            if (positional.size() != 1) {
                throw new ParameterException("Expected exactly one configuration file, got " + positional.size());
            }
            if (outputDir != null || strategyFlags() > 0) {
                throw new ParameterException("Output options apply only with --input-file");
            }
            return;
        }

        if (positional.size() > 1) {
            throw new ParameterException("Expected at most one configuration file, got " + positional.size());
        }
        if (strategyFlags() > 1) {
            throw new ParameterException("Only one of --by-label, --by-tail, --by-type, --keyword may be given");
        }
        if (keyword != null && keyword.isBlank()) {
            throw new ParameterException("--keyword must not be blank");
        }
    }

    private int strategyFlags() {
        int count = 0;
        for (boolean flag : new boolean[] {byLabel, byTail, byType, keyword != null}) {
            if (flag) {
                count++;
            }
        }
        return count;
    }

    public boolean help() {
        return help;
    }

    /**
     * Always present outside offline mode once {@link #validate()} has passed.
     */
    public Optional<Path> configFile() {
        return positional.isEmpty() ? Optional.empty() : Optional.of(Path.of(positional.get(0)));
    }

    public Optional<Path> outputDir() {
        return Optional.ofNullable(outputDir).map(Path::of);
    }

    /**
     * The strategy chosen by flag, if any.
     */
    public Optional<SplitStrategy> splitBy() {
        if (byTail) {
            return Optional.of(SplitStrategy.TAIL);
        }
        if (byType) {
            return Optional.of(SplitStrategy.TYPE);
        }
        if (keyword != null) {
            return Optional.of(SplitStrategy.KEYWORD);
        }
        if (byLabel) {
            return Optional.of(SplitStrategy.LABEL);
        }
        return Optional.empty();
    }

    public String keyword() {
        return keyword;
    }

    public Optional<Path> inputFile() {
        return Optional.ofNullable(inputFile).map(Path::of);
    }

    public Optional<String> logLevel() {
        return Optional.ofNullable(logLevel);
    }

    public static class LogLevelValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (!Arrays.asList(VALID_LOG_LEVELS).contains(value.toUpperCase(Locale.ROOT))) {
                throw new ParameterException("Valid values for parameter " + name + " are: "
                    + String.join(",", VALID_LOG_LEVELS) + ". Value " + value + " is not valid.");
            }
        }
    }
}
