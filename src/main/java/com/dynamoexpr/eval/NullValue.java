package com.dynamoexpr.eval;

/**
 * Stands for an attribute that is present with a null value, which DynamoDB treats as type NULL.
 */
public enum NullValue {
    INSTANCE;

    @Override
    public String toString() {
        return "NULL";
    }
}
