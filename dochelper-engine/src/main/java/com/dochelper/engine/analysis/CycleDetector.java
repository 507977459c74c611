package com.dochelper.engine.analysis;

import com.dochelper.core.formula.DependencyTracker;
import com.dochelper.core.formula.Parser;
import com.dochelper.core.model.EntityDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds circular references between formulas ahead of runtime.
 *
 * Depth-first search with white/gray/black marking over the graph "field reads field", visiting
 * fields and their dependencies in sorted order. Only references to other formula fields form
 * edges. Formulas that do not parse are left out of the graph.
 *
 * The report is advisory; runtime evaluation guards against cycles on its own.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    private static final Comparator<List<String>> CYCLE_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private enum Mark { WHITE, GRAY, BLACK }

    /**
     * Check the calculated fields of an entity.
     */
    public CycleReport detectCycles(EntityDefinition entity) {
        return detectCycles(entity.id(), entity.calculatedFormulas());
    }

    /**
     * @param fieldFormulas formula text keyed by field id
     */
    public CycleReport detectCycles(String entityId, Map<String, String> fieldFormulas) {
        Parser parser = new Parser();
        Map<String, Set<String>> graph = new TreeMap<>();
        for (Map.Entry<String, String> entry : fieldFormulas.entrySet()) {
            Parser.ParseResult parsed = parser.parse(entry.getValue());
            if (!parsed.success()) {
                log.warn("Skipping field {} of entity {} in cycle analysis: {}",
                    entry.getKey(), entityId, parsed.error().message());
                continue;
            }
            graph.put(entry.getKey(), new TreeSet<>(DependencyTracker.extractDependencies(parsed.ast())));
        }

        Map<String, Mark> marks = new HashMap<>();
        graph.keySet().forEach(id -> marks.put(id, Mark.WHITE));

        Set<List<String>> cycles = new LinkedHashSet<>();
        List<String> stack = new ArrayList<>();
        for (String fieldId : graph.keySet()) {
            if (marks.get(fieldId) == Mark.WHITE) {
                visit(fieldId, graph, marks, stack, cycles);
            }
        }

        List<List<String>> sorted = new ArrayList<>(cycles);
        sorted.sort(CYCLE_ORDER);
        if (!sorted.isEmpty()) {
            log.debug("Entity {} has {} formula cycle(s)", entityId, sorted.size());
        }
        return new CycleReport(entityId, sorted, graph.size());
    }

    private void visit(String fieldId, Map<String, Set<String>> graph, Map<String, Mark> marks,
                       List<String> stack, Set<List<String>> cycles) {
        marks.put(fieldId, Mark.GRAY);
        stack.add(fieldId);

        for (String dependency : graph.get(fieldId)) {
            Mark mark = marks.get(dependency);
            if (mark == null) {
                continue; // not a formula field
            }
            if (mark == Mark.GRAY) {
                cycles.add(canonical(stack.subList(stack.indexOf(dependency), stack.size())));
            } else if (mark == Mark.WHITE) {
                visit(dependency, graph, marks, stack, cycles);
            }
        }

        stack.remove(stack.size() - 1);
        marks.put(fieldId, Mark.BLACK);
    }

    // Rotate so the smallest id comes first; equal cycles found from different starts then match
    private static List<String> canonical(List<String> cycle) {
        List<String> rotated = new ArrayList<>(cycle);
        int smallest = rotated.indexOf(Collections.min(rotated));
        Collections.rotate(rotated, -smallest);
        return List.copyOf(rotated);
    }
}
