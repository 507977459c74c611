package com.dochelper.core.formula;

import java.util.List;
import java.util.Objects;

/**
 * AST node types for the formula parser.
 * Nodes are immutable; a tree can be shared between threads and evaluated any number of times.
 */
public sealed interface AstNode {

    /**
     * Constant: number, string, boolean or null.
     */
    record Literal(Value value) implements AstNode {
        public Literal {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Reference to another field of the same entity, by field id.
     */
    record FieldReference(String name) implements AstNode {
        public FieldReference {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Binary operation: arithmetic ({@code + - * / % **}), comparison
     * ({@code == != < <= > >=}) or logical ({@code and or}).
     */
    record BinaryOp(String operator, AstNode left, AstNode right) implements AstNode {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /**
     * Prefix operation: {@code -x}, {@code +x}, {@code not x}.
     */
    record UnaryOp(String operator, AstNode operand) implements AstNode {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }
    }

    /**
     * Function call: {@code name(arg, ...)}. Arguments are copied into an immutable list.
     */
    record FunctionCall(String name, List<AstNode> args) implements AstNode {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }
    }
}
