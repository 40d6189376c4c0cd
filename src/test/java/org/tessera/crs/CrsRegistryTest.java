package org.tessera.crs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tessera.raster.Extent;

@Tag("unit")
class CrsRegistryTest {

    private CrsRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CrsRegistry();
    }

    @Test
    void normalisesEpsgCodes() {
        assertThat(CrsRegistry.epsgCode(32736)).isEqualTo("EPSG:32736");
        assertThat(CrsRegistry.epsgNumber(" epsg:4326 ")).isEqualTo(4326);
        assertThat(CrsRegistry.sameCrs("EPSG:32736", "epsg:32736")).isTrue();
        assertThatThrownBy(() -> CrsRegistry.epsgNumber("ESRI:102100")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CrsRegistry.epsgCode(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Known codes resolve and are cached, unknown codes are rejected")
    void resolvesCodes() {
        assertThat(registry.get("EPSG:32736")).isSameAs(registry.get("epsg:32736"));
        assertThat(registry.isKnown("EPSG:4326")).isTrue();
        assertThat(registry.isKnown("EPSG:999999")).isFalse();
        assertThatThrownBy(() -> registry.get("EPSG:999999"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("EPSG:999999");
    }

    @Test
    @DisplayName("The central meridian of UTM zone 36 maps to the false easting")
    void transformsGeographicToUtm() {
        double[] utm = registry.transformPoint(33.0, -20.0, "EPSG:4326", "EPSG:32736");

        assertThat(utm[0]).isCloseTo(500000.0, within(1.0));
        assertThat(utm[1]).isBetween(7780000.0, 7795000.0);
    }

    @Test
    void sameCrsLeavesCoordinatesUntouched() {
        Extent extent = new Extent(1, 2, 3, 4);

        assertThat(registry.transformPoint(5, 6, "EPSG:32736", "EPSG:32736")).containsExactly(5, 6);
        assertThat(registry.transformExtent(extent, "EPSG:32736", "EPSG:32736")).isSameAs(extent);
    }

    @Test
    void transformedExtentBoundsTheCorners() {
        Extent degrees = registry.transformExtent(
            new Extent(490000, 7780000, 510000, 7800000), "EPSG:32736", "EPSG:4326");

        assertThat(degrees.xmin()).isBetween(32.8, 33.0);
        assertThat(degrees.xmax()).isBetween(33.0, 33.2);
        assertThat(degrees.ymin()).isBetween(-20.1, -19.8);
        assertThat(degrees.ymax()).isGreaterThan(degrees.ymin());
    }
}
