package com.ttennebkram.imagefilter;

import com.ttennebkram.imagefilter.mask.MaskRasterizer;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Engine tuning knobs.
 *
 * Values come from the classpath resource {@value #RESOURCE}, then from system
 * properties named {@value #SYSTEM_PREFIX} followed by the key (for example
 * {@code -Dfilterengine.cache.maxEntries=64}). A value that does not parse
 * keeps the default and logs a warning.
 */
public class EngineSettings {

    private static final Logger LOGGER = Logger.getLogger(EngineSettings.class.getName());

    public static final String RESOURCE = "filter-engine.properties";
    public static final String SYSTEM_PREFIX = "filterengine.";

    public static final String KEY_CACHE_MAX_ENTRIES = "cache.maxEntries";
    public static final String KEY_CACHE_MAX_BYTES = "cache.maxBytes";
    public static final String KEY_WORKER_THREADS = "executor.workerThreads";
    public static final String KEY_MEMORY_CEILING = "executor.memoryCeilingBytes";
    public static final String KEY_MASK_SAMPLES = "mask.samplesPerAxis";
    public static final String KEY_BACKEND = "backend";

    public static final int DEFAULT_CACHE_MAX_ENTRIES = 32;
    public static final long DEFAULT_CACHE_MAX_BYTES = 256L * 1024 * 1024;
    public static final long DEFAULT_MEMORY_CEILING = 0;

    public enum Backend {
        JAVA,
        OPENCV
    }

    private int cacheMaxEntries = DEFAULT_CACHE_MAX_ENTRIES;
    private long cacheMaxBytes = DEFAULT_CACHE_MAX_BYTES;
    private int workerThreads = defaultWorkerThreads();
    private long memoryCeilingBytes = DEFAULT_MEMORY_CEILING;
    private int maskSamplesPerAxis = MaskRasterizer.DEFAULT_SAMPLES_PER_AXIS;
    private Backend backend = Backend.JAVA;

    /**
     * Built-in defaults only.
     */
    public EngineSettings() {
    }

    /**
     * Defaults, then the classpath resource, then system properties.
     */
    public static EngineSettings load() {
        EngineSettings settings = new EngineSettings();
        settings.apply(readResource());
        settings.apply(systemOverrides(System.getProperties()));
        return settings;
    }

    public static EngineSettings fromProperties(Properties properties) {
        EngineSettings settings = new EngineSettings();
        settings.apply(properties);
        return settings;
    }

    static Properties readResource() {
        Properties properties = new Properties();
        try (InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOGGER.fine(RESOURCE + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read " + RESOURCE + ", using defaults", e);
        }
        return properties;
    }

    static Properties systemOverrides(Properties system) {
        Properties overrides = new Properties();
        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                overrides.setProperty(name.substring(SYSTEM_PREFIX.length()), system.getProperty(name));
            }
        }
        return overrides;
    }

    /**
     * Overlay the recognised keys of the given properties onto these settings.
     */
    public void apply(Properties properties) {
        cacheMaxEntries = intValue(properties, KEY_CACHE_MAX_ENTRIES, cacheMaxEntries, 1);
        cacheMaxBytes = longValue(properties, KEY_CACHE_MAX_BYTES, cacheMaxBytes, 1);
        workerThreads = intValue(properties, KEY_WORKER_THREADS, workerThreads, 1);
        memoryCeilingBytes = longValue(properties, KEY_MEMORY_CEILING, memoryCeilingBytes, 0);
        maskSamplesPerAxis = intValue(properties, KEY_MASK_SAMPLES, maskSamplesPerAxis, 1);
        if (maskSamplesPerAxis > MaskRasterizer.MAX_SAMPLES_PER_AXIS) {
            LOGGER.warning(KEY_MASK_SAMPLES + "=" + maskSamplesPerAxis + " is above "
                    + MaskRasterizer.MAX_SAMPLES_PER_AXIS + ", capping");
            maskSamplesPerAxis = MaskRasterizer.MAX_SAMPLES_PER_AXIS;
        }

        String backendName = properties.getProperty(KEY_BACKEND);
        if (backendName != null) {
            try {
                backend = Backend.valueOf(backendName.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOGGER.warning("Unknown " + KEY_BACKEND + " '" + backendName + "', keeping " + backend);
            }
        }
    }

    private static int intValue(Properties properties, String key, int fallback, int min) {
        return (int) longValue(properties, key, fallback, min);
    }

    private static long longValue(Properties properties, String key, long fallback, long min) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min) {
                LOGGER.warning(key + "=" + raw + " is below " + min + ", keeping " + fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            LOGGER.warning("Invalid number for " + key + ": '" + raw + "', keeping " + fallback);
            return fallback;
        }
    }

    private static int defaultWorkerThreads() {
        return Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public long getCacheMaxBytes() {
        return cacheMaxBytes;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Per-chain pre-flight limit; 0 disables the check.
     */
    public long getMemoryCeilingBytes() {
        return memoryCeilingBytes;
    }

    public int getMaskSamplesPerAxis() {
        return maskSamplesPerAxis;
    }

    public Backend getBackend() {
        return backend;
    }

    @Override
    public String toString() {
        return "EngineSettings[cache=" + cacheMaxEntries + " entries/" + cacheMaxBytes + " bytes"
                + ", workers=" + workerThreads
                + ", memoryCeiling=" + memoryCeilingBytes
                + ", maskSamples=" + maskSamplesPerAxis
                + ", backend=" + backend.name().toLowerCase(Locale.ROOT) + "]";
    }
}
