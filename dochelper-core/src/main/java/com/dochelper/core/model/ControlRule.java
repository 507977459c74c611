package com.dochelper.core.model;

import java.util.Objects;

/**
 * Applies its effect while its condition formula evaluates truthy.
 * When rules of the same control type target one field, the highest priority wins.
 */
public record ControlRule(String id, String condition, ControlEffect effect, boolean enabled, int priority) {

    public ControlRule {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Control rule id must not be empty");
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '-') {
                throw new IllegalArgumentException(
                    "Control rule id can only contain letters, digits, '_' and '-': " + id);
            }
        }
        if (condition == null || condition.isBlank()) {
            throw new IllegalArgumentException("Control rule " + id + " has an empty condition");
        }
        Objects.requireNonNull(effect, "effect");
    }

    public ControlRule(String id, String condition, ControlEffect effect) {
        this(id, condition, effect, true, 0);
    }

    public String targetFieldId() {
        return effect.targetFieldId();
    }

    public ControlType controlType() {
        return effect.controlType();
    }
}
