package com.dochelper.engine.control;

import com.dochelper.core.formula.EvaluationContext;
import com.dochelper.core.model.ControlRule;
import com.dochelper.core.model.ControlType;
import com.dochelper.core.model.EntityDefinition;
import com.dochelper.engine.FormulaOutcome;
import com.dochelper.engine.FormulaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides visibility, enablement and forced value of fields from the entity's control rules.
 *
 * A rule is active when it is enabled and its condition evaluates truthy. For each control type
 * the active rule with the highest priority wins; equal priorities are broken by rule id,
 * lowest first. A condition that fails to evaluate leaves its rule inactive and is reported as a
 * diagnostic.
 */
public class ControlRuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ControlRuleEvaluator.class);

    static final Comparator<ControlRule> PRECEDENCE =
        Comparator.comparingInt(ControlRule::priority).reversed().thenComparing(ControlRule::id);

    private final FormulaService formulas;

    public ControlRuleEvaluator(FormulaService formulas) {
        this.formulas = formulas;
    }

    /**
     * Control state of every field of the entity, keyed by field id in schema order.
     */
    public Map<String, ControlState> evaluateAll(EntityDefinition entity, EvaluationContext context) {
        Map<String, ControlState> states = new LinkedHashMap<>();
        entity.fields().forEach(field -> states.put(field.id(), evaluate(entity, field.id(), context)));
        return states;
    }

    public ControlState evaluate(EntityDefinition entity, String fieldId, EvaluationContext context) {
        return evaluate(entity.rulesFor(fieldId), context);
    }

    /**
     * Merge the given rules. All of them are assumed to target the same field.
     */
    public ControlState evaluate(List<ControlRule> rules, EvaluationContext context) {
        if (rules.isEmpty()) {
            return ControlState.defaultState();
        }

        Map<ControlType, ControlRule> winners = new EnumMap<>(ControlType.class);
        List<String> diagnostics = new ArrayList<>();

        for (ControlRule rule : rules) {
            if (!rule.enabled()) {
                continue;
            }
            FormulaOutcome condition = formulas.evaluate(rule.condition(), context);
            if (!condition.success()) {
                log.debug("Control rule {} condition failed: {}", rule.id(), condition.errorMessage());
                diagnostics.add("Control rule '" + rule.id() + "' condition failed: " + condition.errorMessage());
                continue;
            }
            if (!condition.value().isTruthy()) {
                continue;
            }
            winners.merge(rule.controlType(), rule,
                (current, candidate) -> PRECEDENCE.compare(candidate, current) < 0 ? candidate : current);
        }

        ControlRule visibility = winners.get(ControlType.VISIBILITY);
        ControlRule enable = winners.get(ControlType.ENABLE);
        ControlRule valueSet = winners.get(ControlType.VALUE_SET);

        return new ControlState(
            visibility == null || visibility.effect().booleanValue(),
            enable == null || enable.effect().booleanValue(),
            valueSet != null ? valueSet.effect().value() : null,
            diagnostics);
    }
}
