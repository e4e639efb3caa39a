package com.dynamoexpr.eval;

import java.util.Arrays;
import java.util.Optional;

/**
 * Functions available in condition expressions.
 */
public enum ConditionFunction {
    ATTRIBUTE_EXISTS("attribute_exists", 1, true),
    ATTRIBUTE_NOT_EXISTS("attribute_not_exists", 1, true),
    ATTRIBUTE_TYPE("attribute_type", 2, true),
    BEGINS_WITH("begins_with", 2, true),
    CONTAINS("contains", 2, true),
    SIZE("size", 1, false);

    private final String functionName;
    private final int arity;
    private final boolean condition;

    ConditionFunction(String functionName, int arity, boolean condition) {
        this.functionName = functionName;
        this.arity = arity;
        this.condition = condition;
    }

    public String getFunctionName() {
        return functionName;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Whether the function yields a boolean (usable as a condition) rather than a value.
     */
    public boolean isCondition() {
        return condition;
    }

    public static Optional<ConditionFunction> fromName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.functionName.equals(name))
                .findFirst();
    }
}
