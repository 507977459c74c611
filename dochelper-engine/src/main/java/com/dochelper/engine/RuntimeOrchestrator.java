package com.dochelper.engine;

import com.dochelper.core.formula.EvaluationContext;
import com.dochelper.core.formula.Value;
import com.dochelper.core.model.EntityDefinition;
import com.dochelper.core.model.FieldDefinition;
import com.dochelper.core.model.OutputMapping;
import com.dochelper.core.model.ValidationIssue;
import com.dochelper.core.schema.SchemaRepository;
import com.dochelper.engine.calc.CalculatedFieldResolver;
import com.dochelper.engine.control.ControlRuleEvaluator;
import com.dochelper.engine.control.ControlState;
import com.dochelper.engine.output.OutputMappingEvaluator;
import com.dochelper.engine.output.OutputMappingResult;
import com.dochelper.engine.validation.ValidationRuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one deterministic evaluation pass over an entity.
 *
 * <p>Order of work:</p>
 * <ol>
 *   <li>Resolve calculated fields. Their values replace whatever was supplied for them.</li>
 *   <li>Evaluate control rules against the supplied plus calculated values.</li>
 *   <li>Per field, in schema order: pick the effective value, validate it, evaluate output mappings.</li>
 * </ol>
 *
 * <p>The pass only reads its inputs. Failures stay with the field they occur on; control rule
 * failures never block, ERROR issues and failed output mappings always do.</p>
 */
public class RuntimeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RuntimeOrchestrator.class);

    private final SchemaRepository schemas;
    private final CalculatedFieldResolver calculatedFields;
    private final ControlRuleEvaluator controlRules;
    private final ValidationRuleEvaluator validationRules;
    private final OutputMappingEvaluator outputMappings;

    public RuntimeOrchestrator(SchemaRepository schemas) {
        this(schemas, EngineConfig.load());
    }

    public RuntimeOrchestrator(SchemaRepository schemas, EngineConfig config) {
        this(schemas, new FormulaService(config));
    }

    public RuntimeOrchestrator(SchemaRepository schemas, FormulaService formulas) {
        this.schemas = schemas;
        this.calculatedFields = new CalculatedFieldResolver(formulas);
        this.controlRules = new ControlRuleEvaluator(formulas);
        this.validationRules = new ValidationRuleEvaluator();
        this.outputMappings = new OutputMappingEvaluator(formulas);
    }

    public RuntimeEvaluationResult evaluate(String entityId, Map<String, Value> fieldValues) {
        return evaluate(entityId, FieldValueSnapshot.of(fieldValues));
    }

    public RuntimeEvaluationResult evaluate(String entityId, FieldValueSnapshot snapshot) {
        return schemas.findEntity(entityId)
            .map(entity -> evaluate(entity, snapshot))
            .orElseGet(() -> {
                log.warn("Runtime evaluation requested for unknown entity: {}", entityId);
                return RuntimeEvaluationResult.entityNotFound(entityId);
            });
    }

    public RuntimeEvaluationResult evaluate(EntityDefinition entity, FieldValueSnapshot snapshot) {
        Map<String, Value> values = snapshot.values();

        Map<String, FormulaOutcome> calculated = calculatedFields.resolveAll(entity, values);
        calculated.forEach((fieldId, outcome) -> values.put(fieldId, outcome.success() ? outcome.value() : Value.nullValue()));
        EvaluationContext context = EvaluationContext.of(values);

        Map<String, ControlState> controls = controlRules.evaluateAll(entity, context);

        List<FieldEvaluation> fields = new ArrayList<>();
        for (FieldDefinition field : entity.fields()) {
            ControlState control = controls.get(field.id());
            FormulaOutcome calculation = calculated.get(field.id());

            Value effective;
            if (calculation != null) {
                effective = context.get(field.id());
            } else if (control.hasValueToSet()) {
                effective = control.valueToSet();
            } else {
                effective = snapshot.get(field.id());
            }

            List<ValidationIssue> issues = new ArrayList<>();
            if (calculation != null && !calculation.success()) {
                issues.add(ValidationIssue.formulaError(field.id(),
                    field.label() + " could not be calculated: " + calculation.errorMessage()));
            }
            issues.addAll(validationRules.validate(field, effective, snapshot.attachment(field.id())));

            List<OutputMappingResult> outputs = new ArrayList<>();
            for (OutputMapping mapping : field.outputMappings()) {
                outputs.add(outputMappings.evaluate(mapping, context));
            }

            fields.add(new FieldEvaluation(field.id(), field.fieldType(), effective,
                control.visible(), control.enabled(), field.isEffectivelyRequired(),
                issues, outputs, control.diagnostics()));
        }

        RuntimeEvaluationResult result = new RuntimeEvaluationResult(entity.id(), true, fields);
        if (log.isDebugEnabled()) {
            log.debug("Evaluated entity {}: {} fields, {} issues, blocking={}",
                entity.id(), fields.size(), result.issues().size(), result.hasBlockingErrors());
        }
        return result;
    }

    public FormRuntimeState buildFormState(RuntimeEvaluationResult result) {
        return FormRuntimeState.from(result);
    }

    public DocumentRuntimeContext buildDocumentContext(RuntimeEvaluationResult result) {
        return DocumentRuntimeContext.from(result);
    }
}
