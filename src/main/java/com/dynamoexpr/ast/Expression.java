package com.dynamoexpr.ast;

/**
 * Marker for nodes that produce a value or a condition.
 */
public interface Expression extends Node {
}
