package com.dochelper.core.formula;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the field ids a formula reads.
 *
 * The walk never executes anything and visits every branch, including the right side of
 * {@code and}/{@code or} and all function arguments, so the result is a superset of what
 * any single evaluation touches.
 */
public final class DependencyTracker {

    private DependencyTracker() {
    }

    /**
     * All field ids referenced anywhere in the tree, in first-occurrence order.
     */
    public static Set<String> extractDependencies(AstNode ast) {
        Set<String> fields = new LinkedHashSet<>();
        collect(ast, fields);
        return Collections.unmodifiableSet(fields);
    }

    /**
     * Parse then extract. A blank or unparseable formula has no dependencies.
     */
    public static Set<String> extractDependencies(String formula) {
        if (formula == null || formula.isBlank()) {
            return Set.of();
        }
        Parser.ParseResult result = new Parser().parse(formula);
        return result.success() ? extractDependencies(result.ast()) : Set.of();
    }

    private static void collect(AstNode root, Set<String> fields) {
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            AstNode node = pending.pop();
            if (node instanceof AstNode.FieldReference f) {
                fields.add(f.name());
            } else if (node instanceof AstNode.BinaryOp b) {
                // pushed right first so the left side is visited first
                pending.push(b.right());
                pending.push(b.left());
            } else if (node instanceof AstNode.UnaryOp u) {
                pending.push(u.operand());
            } else if (node instanceof AstNode.FunctionCall c) {
                List<AstNode> args = c.args();
                for (int i = args.size() - 1; i >= 0; i--) {
                    pending.push(args.get(i));
                }
            }
            // Literals have no dependencies
        }
    }
}
