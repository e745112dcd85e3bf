package com.bizsim.drg.engine;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Engine-wide settings.
 *
 * Loaded from {@code bizsim.properties} on the classpath; any {@code bizsim.*}
 * system property overrides the file. Missing keys fall back to
 * {@link #defaults()}.
 *
 * <pre>
 * bizsim.parallelism=4
 * bizsim.maxIterations=100
 * bizsim.threshold=0.001
 * bizsim.cache.maxEntries=1024
 * </pre>
 *
 * @param parallelism     Worker threads for concurrent groups of one level; 1 evaluates inline.
 * @param maxIterations   Default iteration cap for runs that do not pass their own options.
 * @param threshold       Default convergence threshold.
 * @param cacheMaxEntries Bound per cache tier.
 */
public record EngineConfig(int parallelism, int maxIterations, double threshold, int cacheMaxEntries) {

    public static final String RESOURCE = "bizsim.properties";
    public static final String PARALLELISM = "bizsim.parallelism";
    public static final String MAX_ITERATIONS = "bizsim.maxIterations";
    public static final String THRESHOLD = "bizsim.threshold";
    public static final String CACHE_MAX_ENTRIES = "bizsim.cache.maxEntries";

    public EngineConfig {
        if (parallelism < 1)
            throw new IllegalArgumentException(PARALLELISM + " must be >= 1, got " + parallelism);
        if (cacheMaxEntries < 1)
            throw new IllegalArgumentException(CACHE_MAX_ENTRIES + " must be >= 1, got " + cacheMaxEntries);
        // Validates maxIterations and threshold.
        new RunOptions(maxIterations, threshold, null, false);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(Math.max(1, Runtime.getRuntime().availableProcessors()),
                RunOptions.DEFAULT_MAX_ITERATIONS, RunOptions.DEFAULT_THRESHOLD, 1024);
    }

    /** Classpath resource, then system properties. */
    public static EngineConfig load() {
        Properties props = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                props.load(in);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("bizsim."))
                props.setProperty(key, System.getProperty(key));
        }
        return fromProperties(props);
    }

    public static EngineConfig fromProperties(Properties props) {
        EngineConfig d = defaults();
        return new EngineConfig(
                intValue(props, PARALLELISM, d.parallelism()),
                intValue(props, MAX_ITERATIONS, d.maxIterations()),
                doubleValue(props, THRESHOLD, d.threshold()),
                intValue(props, CACHE_MAX_ENTRIES, d.cacheMaxEntries()));
    }

    public RunOptions defaultRunOptions() {
        return new RunOptions(maxIterations, threshold, null, false);
    }

    public EngineConfig withParallelism(int value) {
        return new EngineConfig(value, maxIterations, threshold, cacheMaxEntries);
    }

    public EngineConfig withCacheMaxEntries(int value) {
        return new EngineConfig(parallelism, maxIterations, threshold, value);
    }

    private static int intValue(Properties props, String key, int fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank())
            return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + v + "'", e);
        }
    }

    private static double doubleValue(Properties props, String key, double fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank())
            return fallback;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": '" + v + "'", e);
        }
    }
}
