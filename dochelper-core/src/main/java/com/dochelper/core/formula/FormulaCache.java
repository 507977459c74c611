package com.dochelper.core.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parse results keyed by formula source text.
 *
 * Read-mostly and safe for concurrent use. Two threads may parse the same text at once; both
 * produce equal trees and one of them is kept. Once {@code maxEntries} is reached new results
 * are returned but no longer stored.
 */
public final class FormulaCache {

    private static final Logger log = LoggerFactory.getLogger(FormulaCache.class);

    private final Map<String, Parser.ParseResult> entries = new ConcurrentHashMap<>();
    private final int maxDepth;
    private final int maxEntries;
    private volatile boolean fullLogged = false;

    public FormulaCache(int maxEntries) {
        this(maxEntries, Parser.DEFAULT_MAX_DEPTH);
    }

    public FormulaCache(int maxEntries, int maxDepth) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must not be negative, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.maxDepth = maxDepth;
    }

    /**
     * Parse the formula, or return the stored result of an earlier parse of the same text.
     */
    public Parser.ParseResult parse(String formula) {
        String key = formula != null ? formula : "";
        Parser.ParseResult cached = entries.get(key);
        if (cached != null) {
            return cached;
        }

        Parser.ParseResult result = new Parser(maxDepth).parse(key);
        if (entries.size() < maxEntries) {
            Parser.ParseResult existing = entries.putIfAbsent(key, result);
            return existing != null ? existing : result;
        }
        if (!fullLogged) {
            fullLogged = true;
            log.info("Formula cache reached {} entries; further formulas are parsed uncached", maxEntries);
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        fullLogged = false;
    }
}
