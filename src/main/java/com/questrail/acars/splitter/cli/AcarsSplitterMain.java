package com.questrail.acars.splitter.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import com.questrail.acars.splitter.config.ConfigurationException;
import com.questrail.acars.splitter.config.OutputSettings;
import com.questrail.acars.splitter.config.SplitterConfig;
import com.questrail.acars.splitter.config.SplitterConfigLoader;
import com.questrail.acars.splitter.observability.Slf4jSplitterObservabilitySink;
import com.questrail.acars.splitter.output.BucketWriteException;
import com.questrail.acars.splitter.runtime.LogFileSplitter;
import com.questrail.acars.splitter.runtime.SplitterRuntime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point for {@code acars-splitter}.
 *
 * <p>UDP mode runs until the JVM is asked to terminate (Ctrl-C, SIGTERM). The
 * shutdown hook stops the runtime and then releases the main thread.</p>
 */
public final class AcarsSplitterMain {
    private static final Logger log = LoggerFactory.getLogger(AcarsSplitterMain.class);

    private AcarsSplitterMain() {}

    public static void main(String[] args) {
        ExitCode code = run(args);
        if (code != ExitCode.SUCCESS) {
            System.exit(code.code());
        }
    }

    /**
     * Parses arguments, loads configuration and runs the selected mode. Returns
     * instead of exiting; UDP mode blocks until shutdown.
     */
    public static ExitCode run(String[] args) {
        SplitterOptions options = new SplitterOptions();
        JCommander jc = JCommander.newBuilder()
            .addObject(options)
            .programName(SplitterOptions.PROGRAM_NAME)
            .build();

        try {
            jc.parse(args);
            options.validate();
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            jc.usage();
            return ExitCode.USAGE;
        }
        if (options.help()) {
            jc.usage();
            return ExitCode.SUCCESS;
        }

        options.logLevel().ifPresent(LoggingConfigurator::setRootLevel);

        SplitterConfigLoader loader = new SplitterConfigLoader();
        try {
            if (options.inputFile().isPresent()) {
                return splitFile(offlineOutput(options, loader), options.inputFile().get());
            }
            return listen(loader.load(options.configFile().orElseThrow()));
        }
        catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return ExitCode.CONFIG_ERROR;
        }
    }

    /**
     * Output settings from the optional configuration file, overridden by flags.
     */
    static OutputSettings offlineOutput(SplitterOptions options, SplitterConfigLoader loader) {
        OutputSettings output = options.configFile()
            .map(loader::loadOutputSettings)
            .orElseGet(OutputSettings::defaults);

        if (options.outputDir().isPresent()) {
            output = output.withOutputDirectory(options.outputDir().get());
        }
        if (options.splitBy().isPresent()) {
            output = output.withSplitBy(options.splitBy().get(), options.keyword());
        }
        return output;
    }

    private static ExitCode splitFile(OutputSettings output, Path input) {
        if (!Files.isRegularFile(input)) {
            log.error("Input file '{}' not found.", input);
            return ExitCode.INPUT_ERROR;
        }

        try {
            LogFileSplitter.forOutput(output).split(input);
            return ExitCode.SUCCESS;
        }
        catch (IOException e) {
            log.error("Cannot read input file '{}'", input, e);
            return ExitCode.INPUT_ERROR;
        }
        catch (BucketWriteException e) {
            log.error("Cannot create output directory {}", e.path(), e);
            return ExitCode.OUTPUT_ERROR;
        }
    }

    private static ExitCode listen(SplitterConfig config) {
        SplitterRuntime runtime = SplitterRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(new Slf4jSplitterObservabilitySink())
            .build();

        try {
            runtime.start();
        }
        catch (BucketWriteException e) {
            log.error("Cannot create output directory {}", e.path(), e);
            runtime.stop();
            return ExitCode.OUTPUT_ERROR;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Exiting...");
            runtime.stop();
            stopped.countDown();
        }, "acars-splitter-shutdown"));

        try {
            stopped.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runtime.stop();
        }
        return ExitCode.SUCCESS;
    }
}
