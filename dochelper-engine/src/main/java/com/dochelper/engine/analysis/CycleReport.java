package com.dochelper.engine.analysis;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cycles found among an entity's calculated field formulas. Each cycle lists its fields once,
 * starting from the smallest id; the cycles themselves are sorted.
 */
public record CycleReport(String entityId, List<List<String>> cycles, int analyzedFieldCount) {

    public CycleReport {
        cycles = cycles.stream().map(List::copyOf).toList();
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public Set<String> fieldsInCycles() {
        Set<String> fields = new TreeSet<>();
        cycles.forEach(fields::addAll);
        return fields;
    }

    public List<String> describeCycles() {
        return cycles.stream()
            .map(cycle -> String.join(" -> ", cycle) + " -> " + cycle.get(0))
            .toList();
    }
}
