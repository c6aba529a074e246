package com.questrail.acars.splitter.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.beust.jcommander.JCommander;
import com.questrail.acars.splitter.classify.SplitStrategy;
import com.questrail.acars.splitter.config.OutputSettings;
import com.questrail.acars.splitter.config.SplitterConfigLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exit statuses of the command line. UDP mode blocks until shutdown and is
 * covered by the runtime tests instead.
 */
class AcarsSplitterMainTest {

    @TempDir
    Path tempDir;

    private Logger root;
    private Level originalLevel;

    @BeforeEach
    void rememberRootLevel() {
        root = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        originalLevel = root.getLevel();
    }

    @AfterEach
    void restoreRootLevel() {
        root.setLevel(originalLevel);
    }

    private Path config(String json) throws IOException {
        return Files.writeString(tempDir.resolve("config.json"), json);
    }

    private String outputDirJson() {
        return tempDir.resolve("out").toString().replace("\\", "\\\\");
    }

    @Test
    void noArgumentsIsUsageError() {
        assertEquals(ExitCode.USAGE, AcarsSplitterMain.run(new String[0]));
    }

    @Test
    void unknownOptionIsUsageError() {
        assertEquals(ExitCode.USAGE, AcarsSplitterMain.run(new String[] {"--bogus", "config.json"}));
    }

    @Test
    void invalidLogLevelIsUsageError() {
        assertEquals(ExitCode.USAGE, AcarsSplitterMain.run(new String[] {"-L", "LOUD", "config.json"}));
    }

    @Test
    void helpSucceeds() {
        assertEquals(ExitCode.SUCCESS, AcarsSplitterMain.run(new String[] {"--help"}));
    }

    @Test
    void missingConfigFileIsConfigError() {
        String absent = tempDir.resolve("absent.json").toString();
        assertEquals(ExitCode.CONFIG_ERROR, AcarsSplitterMain.run(new String[] {absent}));
    }

    @Test
    void missingPortsIsConfigError() throws IOException {
        Path config = config("{\"output_dir\": \"" + outputDirJson() + "\"}");
        assertEquals(ExitCode.CONFIG_ERROR, AcarsSplitterMain.run(new String[] {config.toString()}));
    }

    @Test
    void missingInputFileIsInputError() throws IOException {
        Path config = config("{\"ports\": [5555], \"output_dir\": \"" + outputDirJson() + "\"}");
        String absent = tempDir.resolve("absent.log").toString();

        assertEquals(ExitCode.INPUT_ERROR,
            AcarsSplitterMain.run(new String[] {"-i", absent, config.toString()}));
    }

    @Test
    void offlineSplitSucceedsAndAppliesLogLevel() throws IOException {
        Path config = config("{\"ports\": [5555], \"output_dir\": \"" + outputDirJson() + "\", \"split_by\": \"label\"}");
        Path log = Files.writeString(tempDir.resolve("jaero.log"),
            "00:16:25 01-01-24 UTC ! H1 D\nbody\n00:17:02 01-01-24 UTC ! Q0 1\n");

        ExitCode code = AcarsSplitterMain.run(
            new String[] {"--log-level", "debug", "--input-file", log.toString(), config.toString()});

        assertEquals(ExitCode.SUCCESS, code);
        assertEquals(Level.DEBUG, root.getLevel());
        assertTrue(Files.exists(tempDir.resolve("out").resolve("acars_label_H1.txt")));
        assertTrue(Files.exists(tempDir.resolve("out").resolve("acars_label_Q0.txt")));
    }

    @Test
    void unusableOutputDirectoryIsOutputError() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("out"), "x");
        Path config = config("{\"ports\": [5555], \"output_dir\": \"" + outputDirJson() + "\"}");
        Path log = Files.writeString(tempDir.resolve("jaero.log"), "00:16:25 01-01-24 UTC ! H1 D\nbody\n");

        assertTrue(Files.isRegularFile(blocker));
        assertEquals(ExitCode.OUTPUT_ERROR,
            AcarsSplitterMain.run(new String[] {"-i", log.toString(), config.toString()}));
    }

    @Test
    void offlineSplitNeedsNoConfigFile() throws IOException {
        Path out = tempDir.resolve("by-type");
        Path log = Files.writeString(tempDir.resolve("jaero.log"),
            "00:16:25 01-01-24 UTC ! H1 D\nFANS-1/A CPDLC\n00:17:02 01-01-24 UTC ! Q0 1\n");

        ExitCode code = AcarsSplitterMain.run(new String[] {"-i", log.toString(), "-o", out.toString(), "-m"});

        assertEquals(ExitCode.SUCCESS, code);
        assertTrue(Files.exists(out.resolve("acars_type_CPDLC.txt")));
        assertTrue(Files.exists(out.resolve("acars_type_OTHER.txt")));
    }

    @Test
    void offlineConfigWithoutPortsIsAccepted() throws IOException {
        Path config = config("{\"output_dir\": \"" + outputDirJson() + "\", \"split_by\": \"keyword\", \"keyword\": \"q0\"}");
        Path log = Files.writeString(tempDir.resolve("jaero.log"),
            "00:16:25 01-01-24 UTC ! H1 D\nbody\n00:17:02 01-01-24 UTC ! Q0 1\n");

        assertEquals(ExitCode.SUCCESS,
            AcarsSplitterMain.run(new String[] {"-i", log.toString(), config.toString()}));
        assertTrue(Files.exists(tempDir.resolve("out").resolve("acars_containing_q0.txt")));
        assertTrue(Files.exists(tempDir.resolve("out").resolve("acars_not_containing_q0.txt")));
    }

    @Test
    void flagsOverrideOfflineConfig() throws IOException {
        Path config = config("{\"output_dir\": \"" + outputDirJson() + "\", \"split_by\": \"type\"}");
        SplitterOptions options = new SplitterOptions();
        JCommander.newBuilder().addObject(options).build()
            .parse("-i", "jaero.log", "-k", "WARN", config.toString());
        options.validate();

        OutputSettings output = AcarsSplitterMain.offlineOutput(options, new SplitterConfigLoader());

        assertEquals(tempDir.resolve("out"), output.outputDirectory());
        assertEquals(SplitStrategy.KEYWORD, output.splitBy());
        assertEquals("WARN", output.keyword());
    }

    @Test
    void outputFlagsWithoutInputFileAreUsageErrors() {
        assertEquals(ExitCode.USAGE, AcarsSplitterMain.run(new String[] {"-t", "config.json"}));
    }

    @Test
    void conflictingStrategyFlagsAreUsageErrors() {
        assertEquals(ExitCode.USAGE, AcarsSplitterMain.run(new String[] {"-i", "jaero.log", "-t", "-m"}));
    }
}
