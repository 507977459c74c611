package com.dochelper.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("dochelper.engine.max_depth");
        System.clearProperty("dochelper.engine.cache_enabled");
        System.clearProperty("dochelper.engine.cache_max_entries");
    }

    @Test
    @DisplayName("Defaults")
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(256, config.getMaxDepth());
        assertTrue(config.isCacheEnabled());
        assertEquals(1024, config.getCacheMaxEntries());
    }

    @Test
    @DisplayName("System properties override defaults")
    void systemProperties() {
        System.setProperty("dochelper.engine.max_depth", "12");
        System.setProperty("dochelper.engine.cache_enabled", "false");
        System.setProperty("dochelper.engine.cache_max_entries", "5");

        EngineConfig config = EngineConfig.load();

        assertEquals(12, config.getMaxDepth());
        assertFalse(config.isCacheEnabled());
        assertEquals(5, config.getCacheMaxEntries());
    }

    @Test
    @DisplayName("Rejects invalid limits")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(0, true, 10));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(10, true, -1));
    }

    @Test
    @DisplayName("Formula service follows the cache setting")
    void cacheSetting() {
        FormulaService cached = new FormulaService(new EngineConfig(64, true, 10));
        FormulaService uncached = new FormulaService(new EngineConfig(64, false, 10));

        cached.parse("a + b");
        cached.parse("a + b");
        uncached.parse("a + b");

        assertEquals(1, cached.cachedFormulaCount());
        assertEquals(0, uncached.cachedFormulaCount());
    }
}
