package org.tessera.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import javax.imageio.ImageIO;

import org.tessera.raster.Raster;

/**
 * Renders three co-registered bands into an 8-bit RGB PNG with a per-channel linear percentile stretch.
 * Zero samples are treated as no-data and rendered black.
 */
public class QuickLookRenderer {

    private final double lowPercentile;
    private final double highPercentile;

    public QuickLookRenderer() {
        this(2.0, 98.0);
    }

    public QuickLookRenderer(double lowPercentile, double highPercentile) {
        if (lowPercentile < 0 || highPercentile > 100 || lowPercentile >= highPercentile) {
            throw new IllegalArgumentException("Invalid stretch percentiles: " + lowPercentile + ", " + highPercentile);
        }
        this.lowPercentile = lowPercentile;
        this.highPercentile = highPercentile;
    }

    /**
     * Renders the image.
     *
     * @param red   red channel.
     * @param green green channel.
     * @param blue  blue channel.
     * @return an RGB image the size of the rasters.
     */
    public BufferedImage render(Raster red, Raster green, Raster blue) {
        int width = red.grid().cols();
        int height = red.grid().rows();
        if (!red.grid().equals(green.grid()) || !red.grid().equals(blue.grid())) {
            throw new IllegalArgumentException("Quick-look channels must share a grid");
        }
        int[] r = stretch(red.values());
        int[] g = stretch(green.values());
        int[] b = stretch(blue.values());
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                image.setRGB(x, y, (r[i] << 16) | (g[i] << 8) | b[i]);
            }
        }
        return image;
    }

    /**
     * Renders and writes a PNG atomically.
     */
    public void write(Raster red, Raster green, Raster blue, Path target) throws IOException {
        BufferedImage image = render(red, green, blue);
        AtomicFiles.write(target, file -> {
            if (!ImageIO.write(image, "png", file.toFile())) {
                throw new IOException("No PNG writer available");
            }
        });
    }

    int[] stretch(int[] values) {
        int[] data = Arrays.stream(values).filter(v -> v != 0).sorted().toArray();
        int[] out = new int[values.length];
        if (data.length == 0) {
            return out;
        }
        double low = data[(int) Math.floor((data.length - 1) * lowPercentile / 100.0)];
        double high = data[(int) Math.ceil((data.length - 1) * highPercentile / 100.0)];
        double range = Math.max(high - low, 1.0);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == 0) continue;
            double scaled = (values[i] - low) / range * 255.0;
            out[i] = (int) Math.max(0, Math.min(255, Math.round(scaled)));
        }
        return out;
    }
}
