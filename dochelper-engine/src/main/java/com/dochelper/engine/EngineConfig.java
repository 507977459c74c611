package com.dochelper.engine;

/**
 * Configuration for the runtime engine.
 */
public class EngineConfig {
    private static final int DEFAULT_MAX_DEPTH = 256;
    private static final boolean DEFAULT_CACHE_ENABLED = true;
    private static final int DEFAULT_CACHE_MAX_ENTRIES = 1024;

    private final int maxDepth;
    private final boolean cacheEnabled;
    private final int cacheMaxEntries;

    public EngineConfig(int maxDepth, boolean cacheEnabled, int cacheMaxEntries) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        if (cacheMaxEntries < 0) {
            throw new IllegalArgumentException("cacheMaxEntries must not be negative, got " + cacheMaxEntries);
        }
        this.maxDepth = maxDepth;
        this.cacheEnabled = cacheEnabled;
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MAX_DEPTH, DEFAULT_CACHE_ENABLED, DEFAULT_CACHE_MAX_ENTRIES);
    }

    public static EngineConfig load() {
        // Load from system properties or environment, with sensible defaults
        int maxDepth = Integer.parseInt(System.getProperty("dochelper.engine.max_depth",
            System.getenv().getOrDefault("DOCHELPER_MAX_DEPTH", String.valueOf(DEFAULT_MAX_DEPTH))));

        boolean cacheEnabled = Boolean.parseBoolean(System.getProperty("dochelper.engine.cache_enabled",
            System.getenv().getOrDefault("DOCHELPER_CACHE_ENABLED", String.valueOf(DEFAULT_CACHE_ENABLED))));

        int cacheMaxEntries = Integer.parseInt(System.getProperty("dochelper.engine.cache_max_entries",
            System.getenv().getOrDefault("DOCHELPER_CACHE_MAX_ENTRIES", String.valueOf(DEFAULT_CACHE_MAX_ENTRIES))));

        return new EngineConfig(maxDepth, cacheEnabled, cacheMaxEntries);
    }

    /**
     * Deepest formula nesting, and longest chain of calculated fields, the engine follows.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    @Override
    public String toString() {
        return "EngineConfig{maxDepth=" + maxDepth + ", cacheEnabled=" + cacheEnabled
            + ", cacheMaxEntries=" + cacheMaxEntries + "}";
    }
}
