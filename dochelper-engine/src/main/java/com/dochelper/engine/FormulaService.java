package com.dochelper.engine;

import com.dochelper.core.formula.AstNode;
import com.dochelper.core.formula.EvaluationContext;
import com.dochelper.core.formula.FormulaCache;
import com.dochelper.core.formula.FormulaEvaluator;
import com.dochelper.core.formula.FunctionRegistry;
import com.dochelper.core.formula.Parser;

/**
 * Parses formula text, through a {@link FormulaCache} when enabled, and evaluates the result.
 */
public class FormulaService {

    private final FormulaEvaluator evaluator;
    private final FormulaCache cache;
    private final int maxDepth;

    public FormulaService(EngineConfig config) {
        this(config, FunctionRegistry.builtIns());
    }

    public FormulaService(EngineConfig config, FunctionRegistry functions) {
        this.maxDepth = config.getMaxDepth();
        this.evaluator = new FormulaEvaluator(functions, maxDepth);
        this.cache = config.isCacheEnabled() ? new FormulaCache(config.getCacheMaxEntries(), maxDepth) : null;
    }

    public Parser.ParseResult parse(String formula) {
        return cache != null ? cache.parse(formula) : new Parser(maxDepth).parse(formula);
    }

    public FormulaOutcome evaluate(AstNode ast, EvaluationContext context) {
        return FormulaOutcome.of(evaluator.evaluate(ast, context));
    }

    public FormulaOutcome evaluate(String formula, EvaluationContext context) {
        Parser.ParseResult parsed = parse(formula);
        if (!parsed.success()) {
            return FormulaOutcome.failed(parsed.error());
        }
        return evaluate(parsed.ast(), context);
    }

    public FunctionRegistry getFunctions() {
        return evaluator.getFunctions();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Number of cached parse results, zero when caching is off.
     */
    public int cachedFormulaCount() {
        return cache != null ? cache.size() : 0;
    }
}
