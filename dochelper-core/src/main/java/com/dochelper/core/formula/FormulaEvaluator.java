package com.dochelper.core.formula;

import com.dochelper.core.formula.EvaluationError.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates formula AST nodes against field values.
 *
 * Evaluation is pure and total: the same tree and context always give the same result, and
 * failures come back as an {@link EvaluationResult} instead of an exception. An instance holds
 * no per-call state and can be shared between threads.
 */
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final FunctionRegistry functions;
    private final int maxDepth;

    public FormulaEvaluator() {
        this(FunctionRegistry.builtIns(), DEFAULT_MAX_DEPTH);
    }

    public FormulaEvaluator(FunctionRegistry functions) {
        this(functions, DEFAULT_MAX_DEPTH);
    }

    public FormulaEvaluator(FunctionRegistry functions, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.functions = Objects.requireNonNull(functions, "functions");
        this.maxDepth = maxDepth;
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    /**
     * Evaluate an AST against the given field values.
     */
    public EvaluationResult evaluate(AstNode node, EvaluationContext context) {
        try {
            return EvaluationResult.ok(evaluateNode(node, context, 1));
        } catch (EvaluationException e) {
            log.debug("Formula evaluation failed: {}", e.error);
            return EvaluationResult.failed(e.error);
        }
    }

    private Value evaluateNode(AstNode node, EvaluationContext context, int depth) {
        if (depth > maxDepth) {
            throw new EvaluationException(Kind.RECURSION_LIMIT,
                "Formula nesting exceeds the maximum depth of " + maxDepth);
        }
        if (node instanceof AstNode.Literal l) {
            return l.value();
        }
        if (node instanceof AstNode.FieldReference f) {
            return context.get(f.name());
        }
        if (node instanceof AstNode.BinaryOp b) {
            return evaluateBinary(b, context, depth);
        }
        if (node instanceof AstNode.UnaryOp u) {
            return evaluateUnary(u, context, depth);
        }
        if (node instanceof AstNode.FunctionCall c) {
            return evaluateFunction(c, context, depth);
        }
        throw new EvaluationException(Kind.INVALID_OPERATION, "Unsupported node: " + node);
    }

    private Value evaluateBinary(AstNode.BinaryOp node, EvaluationContext context, int depth) {
        String operator = node.operator();

        // Short-circuit evaluation
        if ("and".equals(operator)) {
            if (!evaluateNode(node.left(), context, depth + 1).isTruthy()) {
                return Value.of(false);
            }
            return Value.of(evaluateNode(node.right(), context, depth + 1).isTruthy());
        }
        if ("or".equals(operator)) {
            if (evaluateNode(node.left(), context, depth + 1).isTruthy()) {
                return Value.of(true);
            }
            return Value.of(evaluateNode(node.right(), context, depth + 1).isTruthy());
        }

        Value left = evaluateNode(node.left(), context, depth + 1);
        Value right = evaluateNode(node.right(), context, depth + 1);

        return switch (operator) {
            case "+", "-", "*", "/", "%", "**" -> evaluateArithmetic(operator, left, right);
            case "==" -> Value.of(valuesEqual(left, right));
            case "!=" -> Value.of(!valuesEqual(left, right));
            case "<", "<=", ">", ">=" -> evaluateOrdering(operator, left, right);
            default -> throw new EvaluationException(Kind.INVALID_OPERATION, "Unknown operator: " + operator);
        };
    }

    private Value evaluateArithmetic(String operator, Value left, Value right) {
        if (left.isNull() || right.isNull()) {
            return Value.nullValue();
        }

        if ("+".equals(operator) && left instanceof Value.TextValue l && right instanceof Value.TextValue r) {
            return Value.of(l.value() + r.value());
        }

        if (!(left instanceof Value.NumberValue l) || !(right instanceof Value.NumberValue r)) {
            throw typeMismatch(operator, left, right);
        }

        double a = l.value();
        double b = r.value();
        double result = switch (operator) {
            case "+" -> a + b;
            case "-" -> a - b;
            case "*" -> a * b;
            case "/" -> {
                if (b == 0.0) {
                    throw new EvaluationException(Kind.DIVISION_BY_ZERO, "Division by zero");
                }
                yield a / b;
            }
            case "%" -> {
                if (b == 0.0) {
                    throw new EvaluationException(Kind.DIVISION_BY_ZERO, "Modulo by zero");
                }
                yield floorMod(a, b);
            }
            case "**" -> {
                if (a == 0.0 && b < 0) {
                    throw new EvaluationException(Kind.DIVISION_BY_ZERO, "Zero raised to a negative power");
                }
                yield Math.pow(a, b);
            }
            default -> throw new EvaluationException(Kind.INVALID_OPERATION, "Unknown operator: " + operator);
        };

        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new EvaluationException(Kind.INVALID_OPERATION,
                "Result of " + l + " " + operator + " " + r + " is not a finite number");
        }
        return Value.of(result);
    }

    // Result takes the sign of the divisor: -7 % 3 == 2
    private static double floorMod(double a, double b) {
        double r = a % b;
        if (r != 0 && (r < 0) != (b < 0)) {
            r += b;
        }
        return r;
    }

    private Value evaluateOrdering(String operator, Value left, Value right) {
        int cmp;
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            cmp = Double.compare(l.value(), r.value());
        } else if (left instanceof Value.TextValue l && right instanceof Value.TextValue r) {
            cmp = l.value().compareTo(r.value());
        } else {
            throw typeMismatch(operator, left, right);
        }

        return Value.of(switch (operator) {
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case ">" -> cmp > 0;
            case ">=" -> cmp >= 0;
            default -> throw new EvaluationException(Kind.INVALID_OPERATION, "Unknown operator: " + operator);
        });
    }

    private static boolean valuesEqual(Value left, Value right) {
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            return l.value() == r.value();
        }
        return left.equals(right);
    }

    private Value evaluateUnary(AstNode.UnaryOp node, EvaluationContext context, int depth) {
        Value operand = evaluateNode(node.operand(), context, depth + 1);

        if ("not".equals(node.operator())) {
            return Value.of(!operand.isTruthy());
        }
        if (operand.isNull()) {
            return operand;
        }
        if (!(operand instanceof Value.NumberValue n)) {
            throw new EvaluationException(Kind.TYPE_MISMATCH,
                "Cannot apply unary '" + node.operator() + "' to " + operand.typeName());
        }

        return switch (node.operator()) {
            case "-" -> Value.of(-n.value());
            case "+" -> n;
            default -> throw new EvaluationException(Kind.INVALID_OPERATION,
                "Unknown unary operator: " + node.operator());
        };
    }

    private Value evaluateFunction(AstNode.FunctionCall node, EvaluationContext context, int depth) {
        FunctionRegistry.FunctionDefinition function = functions.get(node.name())
            .orElseThrow(() -> new EvaluationException(Kind.UNKNOWN_FUNCTION, "Unknown function: " + node.name()));

        if (!function.acceptsArgCount(node.args().size())) {
            throw new EvaluationException(Kind.INVALID_ARGUMENT,
                node.name() + " expects " + function.describeArity() + ", got " + node.args().size());
        }

        List<Value> args = new ArrayList<>(node.args().size());
        for (AstNode arg : node.args()) {
            args.add(evaluateNode(arg, context, depth + 1));
        }

        Value result;
        try {
            result = function.implementation().apply(List.copyOf(args));
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(Kind.INVALID_ARGUMENT, e.getMessage());
        } catch (ArithmeticException e) {
            throw new EvaluationException(Kind.INVALID_OPERATION, node.name() + ": " + e.getMessage());
        }

        if (result == null) {
            return Value.nullValue();
        }
        if (result instanceof Value.NumberValue n && (Double.isNaN(n.value()) || Double.isInfinite(n.value()))) {
            throw new EvaluationException(Kind.INVALID_OPERATION,
                node.name() + " did not return a finite number");
        }
        return result;
    }

    private static EvaluationException typeMismatch(String operator, Value left, Value right) {
        return new EvaluationException(Kind.TYPE_MISMATCH,
            "Cannot apply '" + operator + "' to " + left.typeName() + " and " + right.typeName());
    }

    /**
     * Internal signal carrying a typed error up to {@link #evaluate}.
     */
    private static final class EvaluationException extends RuntimeException {
        private final transient EvaluationError error;

        EvaluationException(Kind kind, String message) {
            super(message, null, false, false);
            this.error = EvaluationError.of(kind, message);
        }
    }
}
