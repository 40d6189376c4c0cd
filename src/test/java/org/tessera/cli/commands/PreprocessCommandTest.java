package org.tessera.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tessera.cli.CommandLineInterface;
import org.tessera.junit.extensions.logging.ExpectLog;
import org.tessera.junit.extensions.logging.LogLevel;
import org.tessera.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.ConfigFactory;

import picocli.CommandLine;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class PreprocessCommandTest {

    private static final String L1C = "S2A_MSIL1C_20180105T075301_N0206_R135_T36KWA_20180105T093538.SAFE";

    @TempDir
    Path tempDir;

    private CommandLine cmdLine;
    private StringWriter out;
    private StringWriter err;
    private String configFile;

    @BeforeEach
    void setUp() throws URISyntaxException {
        ConfigFactory.invalidateCaches();
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        configFile = Path.of(getClass().getResource("/org/tessera/cli/config/test-config.conf").toURI()).toString();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("preprocess.command");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void testHelpOutput() {
        cmdLine.execute("help", "preprocess");

        assertThat(out.toString()).contains("--resolution").contains("--output-dir").contains("--gipp");
    }

    @Test
    void testRequiresInput() {
        int exitCode = cmdLine.execute("preprocess");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("PATH");
    }

    @Test
    void testReportsMissingProducts() {
        int exitCode = cmdLine.execute("-c", configFile, "preprocess", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: No level-1C products found");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testRunsProcessorAndSkipsProcessedProducts() throws IOException {
        Files.createDirectories(tempDir.resolve(L1C));
        Files.createDirectories(tempDir.resolve("S2B_MSIL1C_20180110T075211_N0206_R135_T36KWA_20180110T093538.SAFE"));
        Files.createDirectories(tempDir.resolve("S2B_MSIL2A_20180110T075211_N0206_R135_T36KWA_20180110T120000.SAFE"));
        System.setProperty("preprocess.command", "true");
        ConfigFactory.invalidateCaches();

        int exitCode = cmdLine.execute("-c", configFile, "preprocess", tempDir.toString());

        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        assertThat(out.toString())
            .contains(L1C + ": done in")
            .contains("S2B_MSIL1C_20180110T075211_N0206_R135_T36KWA_20180110T093538.SAFE: already processed, skipping");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Preprocessing .* failed: .*exit code 1")
    void testFailingProcessorFailsCommand() throws IOException {
        Files.createDirectories(tempDir.resolve(L1C));
        System.setProperty("preprocess.command", "false");
        ConfigFactory.invalidateCaches();

        int exitCode = cmdLine.execute("-c", configFile, "preprocess", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains(L1C + ": failed");
    }
}
