package com.dochelper.engine.calc;

import com.dochelper.core.formula.DependencyTracker;
import com.dochelper.core.formula.EvaluationContext;
import com.dochelper.core.formula.EvaluationError;
import com.dochelper.core.formula.Parser;
import com.dochelper.core.formula.Value;
import com.dochelper.core.model.EntityDefinition;
import com.dochelper.core.model.FieldDefinition;
import com.dochelper.engine.FormulaOutcome;
import com.dochelper.engine.FormulaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the values of an entity's calculated fields.
 *
 * <p>Calculated fields may read other calculated fields. Resolution follows those references
 * depth-first and carries the path of fields being resolved; meeting a field already on the
 * path yields a {@code CIRCULAR_DEPENDENCY} error naming the loop (for example
 * {@code total -> tax -> total}), and a path longer than the configured depth yields
 * {@code RECURSION_LIMIT}. A field whose dependency failed fails too, with an error naming it.
 * Fields outside the failing chain resolve normally.</p>
 *
 * <p>The value supplied for a calculated field is ignored; its formula wins.</p>
 */
public class CalculatedFieldResolver {

    private static final Logger log = LoggerFactory.getLogger(CalculatedFieldResolver.class);

    private final FormulaService formulas;
    private final int maxDepth;

    public CalculatedFieldResolver(FormulaService formulas) {
        this.formulas = formulas;
        this.maxDepth = formulas.getMaxDepth();
    }

    /**
     * Resolve every calculated field of the entity, in schema order.
     */
    public Map<String, FormulaOutcome> resolveAll(EntityDefinition entity, Map<String, Value> snapshot) {
        Resolution resolution = new Resolution(entity, snapshot);
        Map<String, FormulaOutcome> results = new LinkedHashMap<>();
        for (String fieldId : entity.calculatedFields().keySet()) {
            results.put(fieldId, resolution.resolve(fieldId));
        }
        return results;
    }

    /**
     * Resolve one calculated field.
     *
     * @throws IllegalArgumentException if the entity has no calculated field with that id
     */
    public FormulaOutcome resolve(EntityDefinition entity, String fieldId, Map<String, Value> snapshot) {
        if (!entity.calculatedFields().containsKey(fieldId)) {
            throw new IllegalArgumentException("No calculated field '" + fieldId + "' in entity " + entity.id());
        }
        return new Resolution(entity, snapshot).resolve(fieldId);
    }

    /**
     * State of one resolution pass: the memo of finished fields and the current path.
     */
    private final class Resolution {
        private final Map<String, FieldDefinition> calculated;
        private final Map<String, Value> snapshot;
        private final Map<String, FormulaOutcome> memo = new HashMap<>();
        // chain-limit failures, keyed by the shallowest path length that produced them
        private final Map<String, Limited> limited = new HashMap<>();
        private final List<String> path = new ArrayList<>();

        Resolution(EntityDefinition entity, Map<String, Value> snapshot) {
            this.calculated = entity.calculatedFields();
            this.snapshot = snapshot;
        }

        FormulaOutcome resolve(String fieldId) {
            FormulaOutcome done = memo.get(fieldId);
            if (done != null) {
                return done;
            }

            int index = path.indexOf(fieldId);
            if (index >= 0) {
                List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
                cycle.add(fieldId);
                String loop = String.join(" -> ", cycle);
                log.debug("Circular dependency while resolving calculated fields: {}", loop);
                // path-dependent, so not memoized
                return FormulaOutcome.failed(EvaluationError.of(EvaluationError.Kind.CIRCULAR_DEPENDENCY,
                    "Circular dependency: " + loop));
            }

            Limited known = limited.get(fieldId);
            if (known != null && path.size() >= known.pathLength()) {
                return known.outcome();
            }

            if (path.size() >= maxDepth) {
                FormulaOutcome limit = FormulaOutcome.failed(EvaluationError.of(EvaluationError.Kind.RECURSION_LIMIT,
                    "Calculated field chain deeper than " + maxDepth + " at '" + fieldId + "'"));
                limited.put(fieldId, new Limited(path.size(), limit));
                return limit;
            }

            path.add(fieldId);
            FormulaOutcome outcome;
            try {
                outcome = compute(fieldId);
            } finally {
                path.remove(path.size() - 1);
            }
            // a chain-limit failure holds only at this path length or deeper
            if (isKind(outcome, EvaluationError.Kind.RECURSION_LIMIT)) {
                limited.put(fieldId, new Limited(path.size(), outcome));
            } else {
                memo.put(fieldId, outcome);
            }
            return outcome;
        }

        private FormulaOutcome compute(String fieldId) {
            Parser.ParseResult parsed = formulas.parse(calculated.get(fieldId).formula());
            if (!parsed.success()) {
                return FormulaOutcome.failed(parsed.error());
            }

            Map<String, Value> values = new HashMap<>(snapshot);
            for (String dependency : DependencyTracker.extractDependencies(parsed.ast())) {
                if (!calculated.containsKey(dependency)) {
                    continue;
                }
                FormulaOutcome dependencyOutcome = resolve(dependency);
                if (!dependencyOutcome.success()) {
                    return propagate(dependency, dependencyOutcome);
                }
                values.put(dependency, dependencyOutcome.value());
            }

            return formulas.evaluate(parsed.ast(), EvaluationContext.of(values));
        }

        // Cycle and depth errors pass through unchanged; other failures name the failed dependency
        private FormulaOutcome propagate(String dependency, FormulaOutcome failure) {
            EvaluationError error = failure.evaluationError();
            if (isKind(failure, EvaluationError.Kind.CIRCULAR_DEPENDENCY)
                    || isKind(failure, EvaluationError.Kind.RECURSION_LIMIT)) {
                return failure;
            }
            EvaluationError.Kind kind = error != null ? error.kind() : EvaluationError.Kind.INVALID_OPERATION;
            return FormulaOutcome.failed(EvaluationError.of(kind,
                "Depends on '" + dependency + "', which failed: " + failure.errorMessage()));
        }

        private boolean isKind(FormulaOutcome outcome, EvaluationError.Kind kind) {
            EvaluationError error = outcome.evaluationError();
            return error != null && error.kind() == kind;
        }
    }

    private record Limited(int pathLength, FormulaOutcome outcome) {
    }
}
