package org.tessera.composite;

import java.util.List;

import org.tessera.raster.Raster;

/**
 * One composited output band.
 *
 * @param band    the band identifier.
 * @param raster  the band mosaic on the destination grid.
 * @param skipped scenes whose band or classification could not be read.
 */
public record BandComposite(String band, Raster raster, List<SkippedScene> skipped) {

    public BandComposite {
        skipped = List.copyOf(skipped);
    }
}
