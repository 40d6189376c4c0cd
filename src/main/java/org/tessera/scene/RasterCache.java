package org.tessera.scene;

import java.time.Duration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.typesafe.config.Config;
import org.tessera.raster.Raster;

/**
 * Memory-bounded cache of decoded classification rasters, shared by all scene sources of a run.
 * <p>
 * A mosaic reads every scene's classification twice (provenance and colour balancing), so caching the
 * raw and corrected masks avoids decoding and filtering them again. Entries are weighed by their pixel
 * buffer size. Cached rasters are shared and must not be mutated.
 */
public class RasterCache {

    private static final int BYTES_PER_PIXEL = Integer.BYTES;

    private final Cache<String, Raster> cache;

    public RasterCache(long maximumBytes, Duration expireAfterAccess) {
        this.cache = Caffeine.newBuilder()
            .maximumWeight(maximumBytes)
            .weigher((String key, Raster raster) -> weigh(raster))
            .expireAfterAccess(expireAfterAccess)
            .build();
    }

    /**
     * Creates a cache from the {@code scenes.cache} configuration block.
     */
    public static RasterCache fromConfig(Config config) {
        return new RasterCache(config.getBytes("maximum-bytes"), config.getDuration("expire-after-access"));
    }

    /**
     * Returns the cached raster for a key, loading it on a miss.
     * <p>
     * Concurrent callers asking for the same missing key wait for a single load.
     *
     * @param key    a unique key, typically the file path plus a variant suffix.
     * @param loader loads the raster when absent.
     * @return the cached or freshly loaded raster.
     * @throws SceneReadException if loading fails; failures are not cached.
     */
    public Raster get(String key, RasterLoader loader) throws SceneReadException {
        try {
            return cache.get(key, k -> {
                try {
                    return loader.load();
                } catch (SceneReadException e) {
                    throw new LoadFailure(e);
                }
            });
        } catch (LoadFailure e) {
            throw e.getCause();
        }
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * Forces pending evictions; weight-based eviction is otherwise applied asynchronously.
     */
    void cleanUp() {
        cache.cleanUp();
    }

    static int weigh(Raster raster) {
        return (int) Math.min(Integer.MAX_VALUE, (long) BYTES_PER_PIXEL * raster.values().length);
    }

    /**
     * Loads a raster on a cache miss.
     */
    @FunctionalInterface
    public interface RasterLoader {
        Raster load() throws SceneReadException;
    }

    private static final class LoadFailure extends RuntimeException {

        LoadFailure(SceneReadException cause) {
            super(cause);
        }

        @Override
        public synchronized SceneReadException getCause() {
            return (SceneReadException) super.getCause();
        }
    }
}
