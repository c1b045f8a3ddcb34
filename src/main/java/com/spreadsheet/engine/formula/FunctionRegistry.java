package com.spreadsheet.engine.formula;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name -> function table consulted by the evaluator.
 * Names are case-insensitive and stored upper-case.
 */
public class FunctionRegistry {

    /** Marks a function that takes any number of trailing arguments. */
    public static final int VARIADIC = -1;

    private final Map<String, FunctionDefinition> functions = new TreeMap<>();

    /**
     * Registry preloaded with the built-in library.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        BuiltinFunctions.register(registry);
        return registry;
    }

    /**
     * Registers a function taking only single values.
     */
    public void register(String name, int minArgs, int maxArgs, SpreadsheetFunction function) {
        put(new FunctionDefinition(name.toUpperCase(), minArgs, maxArgs, false, function));
    }

    /**
     * Registers a function whose arguments may also be ranges (SUM-style aggregates).
     */
    public void registerAggregate(String name, int minArgs, int maxArgs, SpreadsheetFunction function) {
        put(new FunctionDefinition(name.toUpperCase(), minArgs, maxArgs, true, function));
    }

    private void put(FunctionDefinition definition) {
        if (definition.maxArgs != VARIADIC && definition.maxArgs < definition.minArgs) {
            throw new IllegalArgumentException("maxArgs < minArgs for " + definition.name);
        }
        functions.put(definition.name, definition);
    }

    public FunctionDefinition get(String name) {
        return functions.get(name.toUpperCase());
    }

    public boolean contains(String name) {
        return functions.containsKey(name.toUpperCase());
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public static final class FunctionDefinition {
        private final String name;
        private final int minArgs;
        private final int maxArgs;
        private final boolean acceptsRanges;
        private final SpreadsheetFunction function;

        FunctionDefinition(String name, int minArgs, int maxArgs, boolean acceptsRanges, SpreadsheetFunction function) {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.acceptsRanges = acceptsRanges;
            this.function = function;
        }

        public String getName() {
            return name;
        }

        public int getMinArgs() {
            return minArgs;
        }

        public int getMaxArgs() {
            return maxArgs;
        }

        public boolean acceptsRanges() {
            return acceptsRanges;
        }

        public boolean acceptsArgumentCount(int count) {
            return maxArgs == VARIADIC || count <= maxArgs;
        }

        EvaluationResult invoke(List<FunctionArgument> args) {
            try {
                return function.apply(args);
            } catch (FunctionArgumentException e) {
                return EvaluationResult.error(e.getError());
            }
        }
    }
}
