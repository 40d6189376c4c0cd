package org.tessera.process;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class AtmosphericCorrectionTest {

    private static final String L1C = "S2A_MSIL1C_20180105T075301_N0206_R135_T36KWA_20180105T093538.SAFE";

    @TempDir
    Path tempDir;

    @Test
    void defaultsComeFromReferenceConfiguration() {
        AtmosphericCorrection correction =
            AtmosphericCorrection.fromConfig(ConfigFactory.defaultReference().getConfig("preprocess"));

        assertThat(correction.executable()).isEqualTo("L2A_Process");
        assertThat(correction.gippFile()).isNull();
        assertThat(correction.outputDir()).isNull();
        assertThat(correction.timeout()).isEqualTo(Duration.ofHours(6));
    }

    @Test
    void buildsFullCommandLine() {
        AtmosphericCorrection correction = new AtmosphericCorrection(
            "L2A_Process", Path.of("gipp.xml"), null, Duration.ofHours(1)).withOutputDir(Path.of("out"));

        assertThat(correction.command(Path.of(L1C), 20)).containsExactly(
            "L2A_Process", "--GIP_L2A", "gipp.xml", "--resolution", "20", "--output_dir", "out", L1C);
    }

    @Test
    void omitsOptionalArguments() {
        AtmosphericCorrection correction = new AtmosphericCorrection("sen2cor", null, null, Duration.ofHours(1));

        assertThat(correction.command(Path.of(L1C), 0)).containsExactly("sen2cor", L1C);
        assertThat(correction.task(Path.of(L1C), 0).command()).containsExactly("sen2cor", L1C);
    }

    @Test
    void recognisesExistingLevel2Product() throws IOException {
        Path product = Files.createDirectories(tempDir.resolve(L1C));
        AtmosphericCorrection correction = new AtmosphericCorrection("sen2cor", null, null, Duration.ofHours(1));
        assertThat(correction.isProcessed(product)).isFalse();

        Files.createDirectories(
            tempDir.resolve("S2A_MSIL2A_20180105T075301_N9999_R135_T36KWA_20240101T000000.SAFE"));

        assertThat(correction.isProcessed(product)).isTrue();
    }

    @Test
    void otherTilesDoNotCount() throws IOException {
        Path product = Files.createDirectories(tempDir.resolve(L1C));
        Path output = Files.createDirectories(tempDir.resolve("out"));
        Files.createDirectories(output.resolve("S2A_MSIL2A_20180105T075301_N0206_R135_T36KWB_20180105T093538.SAFE"));
        AtmosphericCorrection correction =
            new AtmosphericCorrection("sen2cor", null, output, Duration.ofHours(1));

        assertThat(correction.isProcessed(product)).isFalse();
    }
}
