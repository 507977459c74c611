package com.dochelper.engine;

import com.dochelper.core.model.Severity;
import com.dochelper.core.model.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Result of one runtime evaluation pass over an entity. Fields are in schema order.
 *
 * @param entityFound false when the entity id is unknown; the pass then has no fields and blocks
 */
public record RuntimeEvaluationResult(String entityId, boolean entityFound, List<FieldEvaluation> fields) {

    public RuntimeEvaluationResult {
        fields = List.copyOf(fields);
    }

    public static RuntimeEvaluationResult entityNotFound(String entityId) {
        return new RuntimeEvaluationResult(entityId, false, List.of());
    }

    public Optional<FieldEvaluation> field(String fieldId) {
        return fields.stream().filter(f -> f.fieldId().equals(fieldId)).findFirst();
    }

    public List<ValidationIssue> issues() {
        List<ValidationIssue> all = new ArrayList<>();
        fields.forEach(f -> all.addAll(f.issues()));
        return all;
    }

    public List<ValidationIssue> issues(Severity severity) {
        return issues().stream().filter(i -> i.severity() == severity).toList();
    }

    /**
     * Any ERROR issue or failed output mapping blocks document generation.
     * Warnings and info never do.
     */
    public boolean hasBlockingErrors() {
        return !entityFound || fields.stream().anyMatch(FieldEvaluation::hasBlockingErrors);
    }

    /**
     * Short summary of why generation is blocked, or null when it is not.
     */
    public String blockingReason() {
        if (!entityFound) {
            return "Unknown entity: " + entityId;
        }
        long errors = issues(Severity.ERROR).size();
        long outputFailures = fields.stream().mapToLong(f -> f.failedOutputs().size()).sum();
        if (errors == 0 && outputFailures == 0) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (errors > 0) {
            parts.add(errors + " ERROR severity issue(s)");
        }
        if (outputFailures > 0) {
            parts.add(outputFailures + " failed output mapping(s)");
        }
        return "Blocked by " + String.join(" and ", parts);
    }

    /**
     * One message per blocking problem, in field order.
     */
    public List<String> blockingMessages() {
        List<String> messages = new ArrayList<>();
        if (!entityFound) {
            messages.add("Unknown entity: " + entityId);
        }
        for (FieldEvaluation field : fields) {
            for (ValidationIssue issue : field.issues()) {
                if (issue.isBlocking()) {
                    messages.add(field.fieldId() + ": " + issue.message());
                }
            }
            field.failedOutputs().forEach(output -> messages.add(
                field.fieldId() + ": output " + output.target() + " failed: " + output.errorMessage()));
        }
        return messages;
    }
}
