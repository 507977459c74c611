package com.dochelper.engine;

import com.dochelper.core.model.Severity;
import com.dochelper.core.model.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What a form needs to render an entity: per-field visibility, enablement, required marker and
 * messages grouped by severity.
 */
public record FormRuntimeState(String entityId, List<FieldState> fields, boolean hasBlockingErrors) {

    public FormRuntimeState {
        fields = List.copyOf(fields);
    }

    public record FieldState(
        String fieldId,
        boolean visible,
        boolean enabled,
        boolean required,
        List<String> validationErrors,
        List<String> warnings,
        List<String> info,
        boolean hasBlockingErrors
    ) {
        public FieldState {
            validationErrors = List.copyOf(validationErrors);
            warnings = List.copyOf(warnings);
            info = List.copyOf(info);
        }
    }

    public static FormRuntimeState from(RuntimeEvaluationResult result) {
        List<FieldState> fields = result.fields().stream()
            .map(field -> new FieldState(
                field.fieldId(),
                field.visible(),
                field.enabled(),
                field.required(),
                messages(field, Severity.ERROR),
                messages(field, Severity.WARNING),
                messages(field, Severity.INFO),
                field.hasBlockingErrors()))
            .toList();
        return new FormRuntimeState(result.entityId(), fields, result.hasBlockingErrors());
    }

    public Optional<FieldState> field(String fieldId) {
        return fields.stream().filter(f -> f.fieldId().equals(fieldId)).findFirst();
    }

    /**
     * Warnings the user has to acknowledge before generating.
     */
    public boolean hasWarnings() {
        return fields.stream().anyMatch(f -> !f.warnings().isEmpty());
    }

    private static List<String> messages(FieldEvaluation field, Severity severity) {
        List<String> messages = field.issues(severity).stream().map(ValidationIssue::message).toList();
        if (severity == Severity.ERROR) {
            // Failed output mappings are blocking, so they are listed with the errors
            List<String> withOutputs = new ArrayList<>(messages);
            field.failedOutputs().forEach(o -> withOutputs.add("Output " + o.target() + ": " + o.errorMessage()));
            return withOutputs;
        }
        return messages;
    }
}
