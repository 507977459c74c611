package com.dochelper.engine.analysis;

import com.dochelper.core.formula.AstNode;
import com.dochelper.core.formula.DependencyTracker;
import com.dochelper.core.formula.FormulaResultType;
import com.dochelper.core.formula.FunctionRegistry;
import com.dochelper.core.formula.Parser;
import com.dochelper.core.formula.Value;
import com.dochelper.core.model.EntityDefinition;
import com.dochelper.core.model.FieldType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a formula without running it: syntax, references to unknown fields and functions,
 * argument counts, and the type of value it will produce.
 */
public class FormulaAnalyzer {

    private static final Map<FieldType, FormulaResultType> FIELD_RESULT_TYPES = new EnumMap<>(FieldType.class);

    static {
        FIELD_RESULT_TYPES.put(FieldType.TEXT, FormulaResultType.TEXT);
        FIELD_RESULT_TYPES.put(FieldType.TEXTAREA, FormulaResultType.TEXT);
        FIELD_RESULT_TYPES.put(FieldType.NUMBER, FormulaResultType.NUMBER);
        FIELD_RESULT_TYPES.put(FieldType.DATE, FormulaResultType.TEXT);
        FIELD_RESULT_TYPES.put(FieldType.DROPDOWN, FormulaResultType.TEXT);
        FIELD_RESULT_TYPES.put(FieldType.CHECKBOX, FormulaResultType.BOOLEAN);
        FIELD_RESULT_TYPES.put(FieldType.RADIO, FormulaResultType.TEXT);
        FIELD_RESULT_TYPES.put(FieldType.FILE, FormulaResultType.TEXT);
        FIELD_RESULT_TYPES.put(FieldType.IMAGE, FormulaResultType.TEXT);
        // CALCULATED, LOOKUP and TABLE depend on data not known here
    }

    private static final Set<String> NUMERIC_ONLY = Set.of("-", "*", "/", "%", "**");

    private final FunctionRegistry functions;

    public FormulaAnalyzer() {
        this(FunctionRegistry.builtIns());
    }

    public FormulaAnalyzer(FunctionRegistry functions) {
        this.functions = functions;
    }

    public FormulaDiagnostics analyze(String formulaText, EntityDefinition entity) {
        List<SchemaFieldInfo> fields = entity.fields().stream()
            .map(f -> new SchemaFieldInfo(f.id(), f.fieldType()))
            .toList();
        return analyze(formulaText, fields);
    }

    public FormulaDiagnostics analyze(String formulaText, Collection<SchemaFieldInfo> schemaFields) {
        if (formulaText == null || formulaText.isBlank()) {
            return FormulaDiagnostics.invalid("Formula cannot be empty", null);
        }

        Parser.ParseResult parsed = new Parser().parse(formulaText);
        if (!parsed.success()) {
            return FormulaDiagnostics.invalid("Syntax error: " + parsed.error().message(), parsed.error().position());
        }
        AstNode ast = parsed.ast();

        Map<String, FieldType> fieldTypes = new HashMap<>();
        schemaFields.forEach(f -> fieldTypes.put(f.fieldId(), f.fieldType()));

        Set<String> references = new TreeSet<>(DependencyTracker.extractDependencies(ast));
        List<String> errors = new ArrayList<>();
        for (String reference : references) {
            if (!fieldTypes.containsKey(reference)) {
                errors.add("Unknown field: '" + reference + "'");
            }
        }
        checkFunctions(ast, errors);

        List<String> warnings = new ArrayList<>();
        checkTypes(ast, fieldTypes, warnings);

        return new FormulaDiagnostics(errors.isEmpty(), errors, warnings, inferType(ast, fieldTypes),
            new ArrayList<>(references), null);
    }

    /**
     * Result type of the formula, UNKNOWN when it does not parse.
     */
    public FormulaResultType inferResultType(String formulaText, Collection<SchemaFieldInfo> schemaFields) {
        Parser.ParseResult parsed = new Parser().parse(formulaText);
        if (!parsed.success()) {
            return FormulaResultType.UNKNOWN;
        }
        Map<String, FieldType> fieldTypes = new HashMap<>();
        schemaFields.forEach(f -> fieldTypes.put(f.fieldId(), f.fieldType()));
        return inferType(parsed.ast(), fieldTypes);
    }

    private void checkFunctions(AstNode node, List<String> errors) {
        if (node instanceof AstNode.FunctionCall call) {
            Optional<FunctionRegistry.FunctionDefinition> function = functions.get(call.name());
            if (function.isEmpty()) {
                errors.add("Unknown function: '" + call.name() + "'");
            } else if (!function.get().acceptsArgCount(call.args().size())) {
                errors.add("Function '" + call.name() + "' expects " + function.get().describeArity()
                    + ", got " + call.args().size());
            }
            call.args().forEach(arg -> checkFunctions(arg, errors));
        } else if (node instanceof AstNode.BinaryOp b) {
            checkFunctions(b.left(), errors);
            checkFunctions(b.right(), errors);
        } else if (node instanceof AstNode.UnaryOp u) {
            checkFunctions(u.operand(), errors);
        }
    }

    private void checkTypes(AstNode node, Map<String, FieldType> fieldTypes, List<String> warnings) {
        if (node instanceof AstNode.BinaryOp b) {
            if (NUMERIC_ONLY.contains(b.operator())) {
                if (inferType(b.left(), fieldTypes) == FormulaResultType.TEXT) {
                    warnings.add("Arithmetic operation '" + b.operator() + "' on TEXT type may fail");
                }
                if (inferType(b.right(), fieldTypes) == FormulaResultType.TEXT) {
                    warnings.add("Arithmetic operation '" + b.operator() + "' on TEXT type may fail");
                }
            }
            checkTypes(b.left(), fieldTypes, warnings);
            checkTypes(b.right(), fieldTypes, warnings);
        } else if (node instanceof AstNode.UnaryOp u) {
            if (!"not".equals(u.operator()) && inferType(u.operand(), fieldTypes) == FormulaResultType.TEXT) {
                warnings.add("Unary '" + u.operator() + "' on TEXT type may fail");
            }
            checkTypes(u.operand(), fieldTypes, warnings);
        } else if (node instanceof AstNode.FunctionCall c) {
            c.args().forEach(arg -> checkTypes(arg, fieldTypes, warnings));
        }
    }

    private FormulaResultType inferType(AstNode node, Map<String, FieldType> fieldTypes) {
        if (node instanceof AstNode.Literal l) {
            Value value = l.value();
            if (value instanceof Value.BooleanValue) {
                return FormulaResultType.BOOLEAN;
            }
            if (value instanceof Value.NumberValue) {
                return FormulaResultType.NUMBER;
            }
            if (value instanceof Value.TextValue) {
                return FormulaResultType.TEXT;
            }
            return FormulaResultType.UNKNOWN;
        }
        if (node instanceof AstNode.FieldReference f) {
            FieldType type = fieldTypes.get(f.name());
            return type != null ? FIELD_RESULT_TYPES.getOrDefault(type, FormulaResultType.UNKNOWN)
                : FormulaResultType.UNKNOWN;
        }
        if (node instanceof AstNode.BinaryOp b) {
            return switch (b.operator()) {
                case "==", "!=", "<", "<=", ">", ">=", "and", "or" -> FormulaResultType.BOOLEAN;
                case "+" -> inferType(b.left(), fieldTypes) == FormulaResultType.TEXT
                    || inferType(b.right(), fieldTypes) == FormulaResultType.TEXT
                    ? FormulaResultType.TEXT : FormulaResultType.NUMBER;
                default -> FormulaResultType.NUMBER;
            };
        }
        if (node instanceof AstNode.UnaryOp u) {
            return "not".equals(u.operator()) ? FormulaResultType.BOOLEAN : FormulaResultType.NUMBER;
        }
        if (node instanceof AstNode.FunctionCall c) {
            return functions.get(c.name())
                .map(FunctionRegistry.FunctionDefinition::returnType)
                .orElse(FormulaResultType.UNKNOWN);
        }
        return FormulaResultType.UNKNOWN;
    }
}
