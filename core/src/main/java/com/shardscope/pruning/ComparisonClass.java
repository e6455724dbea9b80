package com.shardscope.pruning;

import com.shardscope.expression.BinaryExpression;

/**
 * The role a comparison operator plays in the ordering of its operands.
 */
public enum ComparisonClass {
    LESS,
    LESS_EQUAL,
    EQUAL,
    GREATER_EQUAL,
    GREATER,
    NOT_EQUAL,
    UNKNOWN;

    /**
     * Classifies a comparison operator.
     *
     * @param operator the operator
     * @return the class, {@link #UNKNOWN} for non-comparison operators
     */
    public static ComparisonClass of(BinaryExpression.Operator operator) {
        return switch (operator) {
            case LESS_THAN -> LESS;
            case LESS_THAN_OR_EQUAL -> LESS_EQUAL;
            case EQUAL -> EQUAL;
            case GREATER_THAN_OR_EQUAL -> GREATER_EQUAL;
            case GREATER_THAN -> GREATER;
            case NOT_EQUAL -> NOT_EQUAL;
            default -> UNKNOWN;
        };
    }

    /**
     * Returns whether a restriction of this class bounds the column's value.
     *
     * @return false for {@link #NOT_EQUAL} and {@link #UNKNOWN}
     */
    public boolean isBound() {
        return this != NOT_EQUAL && this != UNKNOWN;
    }
}
