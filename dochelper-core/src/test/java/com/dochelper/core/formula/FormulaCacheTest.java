package com.dochelper.core.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class FormulaCacheTest {

    @Test
    @DisplayName("Returns the stored result for repeated text")
    void reusesResult() {
        FormulaCache cache = new FormulaCache(10);

        Parser.ParseResult first = cache.parse("a + 1");
        Parser.ParseResult second = cache.parse("a + 1");

        assertSame(first, second);
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Stores failed parses too")
    void storesFailures() {
        FormulaCache cache = new FormulaCache(10);

        Parser.ParseResult result = cache.parse("a +");

        assertFalse(result.success());
        assertSame(result, cache.parse("a +"));
    }

    @Test
    @DisplayName("Stops storing once full but still parses")
    void boundedSize() {
        FormulaCache cache = new FormulaCache(2);

        cache.parse("1");
        cache.parse("2");
        Parser.ParseResult third = cache.parse("3");

        assertTrue(third.success());
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("Clear empties the cache")
    void clear() {
        FormulaCache cache = new FormulaCache(10);
        cache.parse("x");

        cache.clear();

        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Applies its nesting limit")
    void nestingLimit() {
        FormulaCache cache = new FormulaCache(10, 3);

        assertFalse(cache.parse("((((((1))))))").success());
    }

    @Test
    @DisplayName("Concurrent parses agree")
    void concurrentParses() throws Exception {
        FormulaCache cache = new FormulaCache(100);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Parser.ParseResult>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> cache.parse("price * quantity - discount")));
            }
            AstNode expected = new Parser().parse("price * quantity - discount").ast();
            for (Future<Parser.ParseResult> future : futures) {
                assertEquals(expected, future.get().ast());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Rejects a negative size")
    void rejectsNegativeSize() {
        assertThrows(IllegalArgumentException.class, () -> new FormulaCache(-1));
    }
}
