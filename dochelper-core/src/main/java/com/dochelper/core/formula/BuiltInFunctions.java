package com.dochelper.core.formula;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

import static com.dochelper.core.formula.FunctionRegistry.VARIADIC;

/**
 * The standard formula functions. Most of them pass null through: {@code upper(null)} is null,
 * {@code sum} and {@code min}/{@code max} ignore null arguments.
 */
final class BuiltInFunctions {

    private BuiltInFunctions() {
    }

    static FunctionRegistry.Builder registerAll(FunctionRegistry.Builder builder) {
        return builder
            // Math
            .register("abs", 1, 1, FormulaResultType.NUMBER, BuiltInFunctions::abs)
            .register("min", 1, VARIADIC, FormulaResultType.NUMBER, args -> extreme("min", args, -1))
            .register("max", 1, VARIADIC, FormulaResultType.NUMBER, args -> extreme("max", args, 1))
            .register("round", 1, 2, FormulaResultType.NUMBER, BuiltInFunctions::round)
            .register("sum", 0, VARIADIC, FormulaResultType.NUMBER, BuiltInFunctions::sum)
            .register("pow", 2, 2, FormulaResultType.NUMBER, BuiltInFunctions::pow)
            // Text
            .register("upper", 1, 1, FormulaResultType.TEXT,
                args -> mapText(args.get(0), s -> s.toUpperCase(Locale.ROOT)))
            .register("lower", 1, 1, FormulaResultType.TEXT,
                args -> mapText(args.get(0), s -> s.toLowerCase(Locale.ROOT)))
            .register("strip", 1, 1, FormulaResultType.TEXT, args -> mapText(args.get(0), String::strip))
            .register("concat", 0, VARIADIC, FormulaResultType.TEXT, BuiltInFunctions::concat)
            // Logic
            .register("if_else", 3, 3, FormulaResultType.UNKNOWN,
                args -> args.get(0).isTruthy() ? args.get(1) : args.get(2))
            .register("is_empty", 1, 1, FormulaResultType.BOOLEAN, args -> Value.of(isEmpty(args.get(0))))
            .register("coalesce", 0, VARIADIC, FormulaResultType.UNKNOWN, BuiltInFunctions::coalesce);
    }

    private static Value abs(List<Value> args) {
        Value x = args.get(0);
        if (x.isNull()) {
            return x;
        }
        return Value.of(Math.abs(number("abs", x)));
    }

    /**
     * Smallest (direction -1) or largest (direction 1) non-null argument.
     * Numbers compare with numbers, text with text.
     */
    private static Value extreme(String name, List<Value> args, int direction) {
        Value best = null;
        for (Value arg : args) {
            if (arg.isNull()) {
                continue;
            }
            if (best == null) {
                best = arg;
                continue;
            }
            if (compare(name, arg, best) * direction > 0) {
                best = arg;
            }
        }
        return best != null ? best : Value.nullValue();
    }

    private static int compare(String name, Value a, Value b) {
        if (a instanceof Value.NumberValue x && b instanceof Value.NumberValue y) {
            return Double.compare(x.value(), y.value());
        }
        if (a instanceof Value.TextValue x && b instanceof Value.TextValue y) {
            return x.value().compareTo(y.value());
        }
        throw new IllegalArgumentException(name + " cannot compare " + a.typeName() + " with " + b.typeName());
    }

    private static Value round(List<Value> args) {
        Value x = args.get(0);
        if (x.isNull()) {
            return x;
        }
        double value = number("round", x);
        int digits = 0;
        if (args.size() > 1) {
            double rawDigits = number("round", args.get(1));
            if (rawDigits != Math.rint(rawDigits)) {
                throw new IllegalArgumentException("round expects an integer number of digits, got " + rawDigits);
            }
            digits = (int) rawDigits;
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return x;
        }
        return Value.of(BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_EVEN).doubleValue());
    }

    private static Value sum(List<Value> args) {
        double total = 0;
        for (Value arg : args) {
            if (!arg.isNull()) {
                total += number("sum", arg);
            }
        }
        return Value.of(total);
    }

    private static Value pow(List<Value> args) {
        Value base = args.get(0);
        Value exponent = args.get(1);
        if (base.isNull() || exponent.isNull()) {
            return Value.nullValue();
        }
        return Value.of(Math.pow(number("pow", base), number("pow", exponent)));
    }

    private static Value concat(List<Value> args) {
        StringBuilder sb = new StringBuilder();
        for (Value arg : args) {
            sb.append(arg.asText());
        }
        return Value.of(sb.toString());
    }

    private static Value coalesce(List<Value> args) {
        for (Value arg : args) {
            if (!arg.isNull()) {
                return arg;
            }
        }
        return Value.nullValue();
    }

    private static boolean isEmpty(Value value) {
        if (value.isNull()) {
            return true;
        }
        return value instanceof Value.TextValue t && t.value().isBlank();
    }

    private static Value mapText(Value value, UnaryOperator<String> op) {
        if (value.isNull()) {
            return value;
        }
        return Value.of(op.apply(value.asText()));
    }

    private static double number(String function, Value value) {
        if (value instanceof Value.NumberValue n) {
            return n.value();
        }
        throw new IllegalArgumentException(function + " expects a number, got " + value.typeName());
    }
}
