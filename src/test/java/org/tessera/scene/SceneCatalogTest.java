package org.tessera.scene;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class SceneCatalogTest {

    private static final String L2A_PRODUCT = "S2A_MSIL2A_20180105T075301_N0206_R135_T36KWA_20180105T112516.SAFE";
    private static final String L1C_PRODUCT = "S2A_MSIL1C_20180105T075301_N0206_R135_T36KWA_20180105T095744.SAFE";
    private static final String PRODUCT_GRANULE = "L2A_T36KWA_A013163_20180105T075109";
    private static final String BARE_GRANULE = "L2A_T36KWB_A013163_20180110T075109";
    private static final String L1C_GRANULE = "L1C_T36KWC_A013163_20180110T075109";

    @TempDir
    Path tempDir;

    private Path products;

    @BeforeEach
    void setUp() throws IOException {
        products = Files.createDirectories(tempDir.resolve("products"));
        granule(products.resolve(L2A_PRODUCT).resolve("GRANULE").resolve(PRODUCT_GRANULE));
        granule(products.resolve(BARE_GRANULE));
        granule(products.resolve(L1C_GRANULE));
        Files.createDirectories(products.resolve(L1C_PRODUCT).resolve("GRANULE"));
    }

    @Test
    @DisplayName("Granules are found inside products and directly in a directory, filtered by level")
    void findsGranulesInDirectory() throws IOException {
        List<Path> granules = SceneCatalog.findGranules(List.of(products), "L2A");

        assertThat(granules).extracting(p -> p.getFileName().toString())
            .containsExactlyInAnyOrder(PRODUCT_GRANULE, BARE_GRANULE);
        assertThat(granules).allMatch(Path::isAbsolute);
    }

    @Test
    void acceptsGranuleAndProductPathsDirectly() throws IOException {
        List<Path> granules = SceneCatalog.findGranules(
            List.of(products.resolve(L2A_PRODUCT), products.resolve(BARE_GRANULE), products.resolve(BARE_GRANULE)),
            "L2A");

        assertThat(granules).hasSize(2);
    }

    @Test
    @DisplayName("List files name inputs relative to their own directory and may contain comments")
    void expandsListFiles() throws IOException {
        Path list = tempDir.resolve("scenes.txt");
        Files.writeString(list, "# January\n\nproducts/" + BARE_GRANULE + "\n");

        List<Path> granules = SceneCatalog.findGranules(List.of(list), "L2A");

        assertThat(granules).extracting(p -> p.getFileName().toString()).containsExactly(BARE_GRANULE);
    }

    @Test
    void missingInputIsAnError() {
        assertThatThrownBy(() -> SceneCatalog.findGranules(List.of(tempDir.resolve("nope")), "L2A"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void listedEntryThatIsNotADirectoryIsAnError() throws IOException {
        Path list = tempDir.resolve("scenes.txt");
        Files.writeString(list, "products/missing\n");

        assertThatThrownBy(() -> SceneCatalog.findGranules(List.of(list), "L2A"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("not a directory");
    }

    @Test
    @DisplayName("Products are filtered by processing level")
    void findsProductsByLevel() throws IOException {
        assertThat(SceneCatalog.findProducts(List.of(products), "L1C"))
            .extracting(p -> p.getFileName().toString()).containsExactly(L1C_PRODUCT);
        assertThat(SceneCatalog.findProducts(List.of(products.resolve(L2A_PRODUCT)), "L2A"))
            .extracting(p -> p.getFileName().toString()).containsExactly(L2A_PRODUCT);
    }

    private static void granule(Path dir) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("MTD_TL.xml"), "<Level-2A_Tile_ID/>");
    }
}
