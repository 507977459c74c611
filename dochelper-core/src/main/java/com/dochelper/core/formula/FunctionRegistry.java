package com.dochelper.core.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable table of the functions formulas may call.
 *
 * Built once through {@link Builder} and handed to the evaluator; there is no global mutable
 * registry. {@link #builtIns()} holds the standard function set.
 */
public final class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    /** Marker for functions accepting any number of arguments. */
    public static final int VARIADIC = -1;

    private static final FunctionRegistry BUILT_INS = BuiltInFunctions.registerAll(builder()).build();

    private final Map<String, FunctionDefinition> functions;

    private FunctionRegistry(Map<String, FunctionDefinition> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    public static FunctionRegistry builtIns() {
        return BUILT_INS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-populated with this registry's functions.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        functions.values().forEach(builder::register);
        return builder;
    }

    public Optional<FunctionDefinition> get(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    public int size() {
        return functions.size();
    }

    /**
     * A registered function with its accepted arity and declared result type.
     *
     * @param maxArgs upper bound, or {@link #VARIADIC}
     */
    public record FunctionDefinition(String name, int minArgs, int maxArgs,
                                     FormulaResultType returnType, FormulaFunction implementation) {
        public FunctionDefinition {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(returnType, "returnType");
            Objects.requireNonNull(implementation, "implementation");
            if (minArgs < 0 || (maxArgs != VARIADIC && maxArgs < minArgs)) {
                throw new IllegalArgumentException("Invalid arity for " + name + ": " + minArgs + ".." + maxArgs);
            }
        }

        public boolean acceptsArgCount(int count) {
            return count >= minArgs && (maxArgs == VARIADIC || count <= maxArgs);
        }

        public String describeArity() {
            if (maxArgs == VARIADIC) {
                return "at least " + minArgs + " argument" + (minArgs == 1 ? "" : "s");
            }
            if (minArgs == maxArgs) {
                return minArgs + " argument" + (minArgs == 1 ? "" : "s");
            }
            return minArgs + " to " + maxArgs + " arguments";
        }
    }

    public static final class Builder {
        private final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a function. A later registration under the same name replaces the earlier one.
         */
        public Builder register(FunctionDefinition definition) {
            if (functions.put(definition.name(), definition) != null) {
                log.debug("Replaced formula function: {}", definition.name());
            }
            return this;
        }

        public Builder register(String name, int minArgs, int maxArgs,
                                FormulaResultType returnType, FormulaFunction implementation) {
            return register(new FunctionDefinition(name, minArgs, maxArgs, returnType, implementation));
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(functions);
        }
    }
}
