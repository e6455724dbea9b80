package com.shardscope.expression;

import com.shardscope.types.BooleanType;
import com.shardscope.types.DataType;

import java.util.Objects;

/**
 * Expression comparing a scalar against every element of an array.
 *
 * <p>SQL form: {@code expr op ANY(array)} (true if the comparison holds for
 * some element) or {@code expr op ALL(array)} (true if it holds for every
 * element). {@code col IN (1, 2, 3)} is planned as
 * {@code col = ANY(ARRAY[1, 2, 3])}.
 */
public final class ArrayComparison implements Expression {

    private final Expression left;
    private final BinaryExpression.Operator operator;
    private final Expression array;
    private final boolean any;

    /**
     * Creates an array comparison.
     *
     * @param left the scalar operand
     * @param operator the comparison operator applied per element
     * @param array the array operand
     * @param any true for ANY, false for ALL
     * @throws IllegalArgumentException if operator is not a comparison
     */
    public ArrayComparison(Expression left, BinaryExpression.Operator operator,
                           Expression array, boolean any) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.array = Objects.requireNonNull(array, "array must not be null");
        if (!operator.isComparison()) {
            throw new IllegalArgumentException("Array comparison requires a comparison operator, got: " + operator);
        }
        this.any = any;
    }

    public Expression left() {
        return left;
    }

    public BinaryExpression.Operator operator() {
        return operator;
    }

    public Expression array() {
        return array;
    }

    public boolean isAny() {
        return any;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return left.nullable() || array.nullable();
    }

    @Override
    public String toSQL() {
        return String.format("(%s %s %s(%s))", left.toSQL(), operator.symbol(),
            any ? "ANY" : "ALL", array.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayComparison)) return false;
        ArrayComparison that = (ArrayComparison) obj;
        return any == that.any &&
               operator == that.operator &&
               Objects.equals(left, that.left) &&
               Objects.equals(array, that.array);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, array, any);
    }

    public static ArrayComparison any(Expression left, BinaryExpression.Operator operator, Expression array) {
        return new ArrayComparison(left, operator, array, true);
    }

    public static ArrayComparison all(Expression left, BinaryExpression.Operator operator, Expression array) {
        return new ArrayComparison(left, operator, array, false);
    }
}
