package com.dochelper.engine.control;

import com.dochelper.core.formula.Value;

import java.util.List;

/**
 * Merged effect of the control rules targeting one field.
 *
 * @param valueToSet  value from the winning VALUE_SET rule, or {@code null} when none is active
 * @param diagnostics non-fatal messages about rules whose condition could not be evaluated
 */
public record ControlState(boolean visible, boolean enabled, Value valueToSet, List<String> diagnostics) {

    private static final ControlState DEFAULT = new ControlState(true, true, null, List.of());

    public ControlState {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static ControlState defaultState() {
        return DEFAULT;
    }

    public boolean hasValueToSet() {
        return valueToSet != null;
    }
}
