package com.dochelper.engine;

import com.dochelper.core.formula.Value;
import com.dochelper.core.model.OutputTarget;
import com.dochelper.core.model.ValidationIssue;
import com.dochelper.engine.output.OutputMappingResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only input for document generation: field values and coerced output values.
 * Generation must not proceed while {@link #hasBlockingErrors()} is true.
 */
public record DocumentRuntimeContext(
    String entityId,
    List<DocumentField> fields,
    Map<String, Map<OutputTarget, Object>> outputValues,
    boolean hasBlockingErrors,
    List<String> blockingErrors
) {

    public DocumentRuntimeContext {
        fields = List.copyOf(fields);
        blockingErrors = List.copyOf(blockingErrors);
        // output values may be null, so no Map.copyOf
        Map<String, Map<OutputTarget, Object>> outputs = new LinkedHashMap<>();
        outputValues.forEach((fieldId, byTarget) -> {
            Map<OutputTarget, Object> targets = new EnumMap<>(OutputTarget.class);
            targets.putAll(byTarget);
            outputs.put(fieldId, Collections.unmodifiableMap(targets));
        });
        outputValues = Collections.unmodifiableMap(outputs);
    }

    public record DocumentField(String fieldId, Value value, boolean visible, List<ValidationIssue> issues) {
        public DocumentField {
            issues = List.copyOf(issues);
        }
    }

    public static DocumentRuntimeContext from(RuntimeEvaluationResult result) {
        List<DocumentField> fields = result.fields().stream()
            .map(f -> new DocumentField(f.fieldId(), f.value(), f.visible(), f.issues()))
            .toList();

        Map<String, Map<OutputTarget, Object>> outputs = new LinkedHashMap<>();
        for (FieldEvaluation field : result.fields()) {
            Map<OutputTarget, Object> byTarget = new EnumMap<>(OutputTarget.class);
            for (OutputMappingResult output : field.outputs()) {
                if (output.success()) {
                    byTarget.put(output.target(), output.value());
                }
            }
            if (!byTarget.isEmpty()) {
                outputs.put(field.fieldId(), byTarget);
            }
        }

        return new DocumentRuntimeContext(result.entityId(), fields, outputs,
            result.hasBlockingErrors(), result.blockingMessages());
    }

    public Object outputValue(String fieldId, OutputTarget target) {
        Map<OutputTarget, Object> byTarget = outputValues.get(fieldId);
        return byTarget != null ? byTarget.get(target) : null;
    }

    /**
     * @throws IllegalStateException listing the blocking errors when generation is not allowed
     */
    public void requireGeneratable() {
        if (hasBlockingErrors) {
            throw new IllegalStateException("Document for " + entityId + " cannot be generated: "
                + String.join("; ", blockingErrors));
        }
    }
}
