package com.dochelper.engine;

import com.dochelper.core.formula.Value;
import com.dochelper.core.model.FieldType;
import com.dochelper.core.model.Severity;
import com.dochelper.core.model.ValidationIssue;
import com.dochelper.engine.output.OutputMappingResult;

import java.util.List;

/**
 * Everything the runtime pass decided about one field.
 *
 * @param value              effective value: the calculated value, else a forced VALUE_SET value,
 *                           else the supplied value
 * @param issues             validation issues, including calculation failures
 * @param controlDiagnostics non-fatal messages from control rules whose condition failed
 */
public record FieldEvaluation(
    String fieldId,
    FieldType fieldType,
    Value value,
    boolean visible,
    boolean enabled,
    boolean required,
    List<ValidationIssue> issues,
    List<OutputMappingResult> outputs,
    List<String> controlDiagnostics
) {

    public FieldEvaluation {
        issues = List.copyOf(issues);
        outputs = List.copyOf(outputs);
        controlDiagnostics = List.copyOf(controlDiagnostics);
    }

    public List<ValidationIssue> issues(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    public List<OutputMappingResult> failedOutputs() {
        return outputs.stream().filter(o -> !o.success()).toList();
    }

    /**
     * An ERROR issue or a failed output mapping.
     */
    public boolean hasBlockingErrors() {
        return issues.stream().anyMatch(ValidationIssue::isBlocking) || !failedOutputs().isEmpty();
    }
}
