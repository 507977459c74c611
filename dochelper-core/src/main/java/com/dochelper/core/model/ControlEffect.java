package com.dochelper.core.model;

import com.dochelper.core.formula.Value;

import java.util.Objects;

/**
 * Effect a control rule applies to its target field while the rule is active.
 * VISIBILITY and ENABLE effects always carry a boolean value.
 */
public record ControlEffect(ControlType controlType, String targetFieldId, Value value) {

    public ControlEffect {
        Objects.requireNonNull(controlType, "controlType");
        if (targetFieldId == null || targetFieldId.isBlank()) {
            throw new IllegalArgumentException("targetFieldId must not be empty");
        }
        value = value != null ? value : Value.nullValue();
        if (controlType != ControlType.VALUE_SET && !(value instanceof Value.BooleanValue)) {
            throw new IllegalArgumentException(controlType + " effect on '" + targetFieldId
                + "' needs a boolean value, got " + value.typeName());
        }
    }

    public static ControlEffect setValue(String targetFieldId, Value value) {
        return new ControlEffect(ControlType.VALUE_SET, targetFieldId, value);
    }

    public static ControlEffect visibility(String targetFieldId, boolean visible) {
        return new ControlEffect(ControlType.VISIBILITY, targetFieldId, Value.of(visible));
    }

    public static ControlEffect enable(String targetFieldId, boolean enabled) {
        return new ControlEffect(ControlType.ENABLE, targetFieldId, Value.of(enabled));
    }

    /**
     * The boolean carried by a VISIBILITY or ENABLE effect.
     */
    public boolean booleanValue() {
        return value instanceof Value.BooleanValue b && b.value();
    }
}
