package com.shardscope.expression;

import com.shardscope.types.BooleanType;
import com.shardscope.types.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing an IN clause (or NOT IN clause).
 *
 * <p>SQL form: expr IN (val1, val2, val3)
 * <p>SQL form (negated): expr NOT IN (val1, val2, val3)
 *
 * <p>An IN list whose values are all literals is equivalent to
 * {@code expr = ANY(ARRAY[val1, val2, val3])}; {@link #asArrayComparison()}
 * performs that rewrite so both spellings are pruned the same way.
 */
public final class InExpression implements Expression {

    private final Expression testExpr;
    private final List<Expression> values;
    private final boolean negated;

    /**
     * Creates an IN expression.
     *
     * @param testExpr the expression being tested
     * @param values the values to test against
     * @param negated true for NOT IN, false for IN
     * @throws IllegalArgumentException if values is empty
     */
    public InExpression(Expression testExpr, List<Expression> values, boolean negated) {
        Objects.requireNonNull(testExpr, "testExpr must not be null");
        Objects.requireNonNull(values, "values must not be null");

        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN clause requires at least one value");
        }

        this.testExpr = testExpr;
        this.values = new ArrayList<>(values);
        this.negated = negated;
    }

    public InExpression(Expression testExpr, List<Expression> values) {
        this(testExpr, values, false);
    }

    public Expression testExpr() {
        return testExpr;
    }

    /**
     * Returns the values in the IN list.
     *
     * @return an unmodifiable list of value expressions
     */
    public List<Expression> values() {
        return Collections.unmodifiableList(values);
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * Rewrites a non-negated IN list of literals as {@code expr = ANY(array)}.
     *
     * <p>Returns null when the rewrite does not apply: the list is negated, a
     * value is not a literal, or the literals have different types.
     *
     * @return the equivalent array comparison, or null
     */
    public ArrayComparison asArrayComparison() {
        if (negated) {
            return null;
        }
        DataType elementType = null;
        List<Object> elements = new ArrayList<>(values.size());
        for (Expression value : values) {
            if (!(value instanceof Literal literal)) {
                return null;
            }
            if (!literal.isNull()) {
                if (elementType == null) {
                    elementType = literal.dataType();
                } else if (!elementType.equals(literal.dataType())) {
                    return null;
                }
            }
            elements.add(literal.value());
        }
        if (elementType == null) {
            elementType = values.get(0).dataType();
        }
        return ArrayComparison.any(testExpr, BinaryExpression.Operator.EQUAL,
            Literal.array(elementType, elements));
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        if (testExpr.nullable()) {
            return true;
        }
        return values.stream().anyMatch(Expression::nullable);
    }

    @Override
    public String toSQL() {
        return testExpr.toSQL() + (negated ? " NOT IN (" : " IN (") +
            values.stream().map(Expression::toSQL).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated &&
               Objects.equals(testExpr, that.testExpr) &&
               Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values, negated);
    }

    @Override
    public String toString() {
        String op = negated ? "NOT IN" : "IN";
        return "InExpression(" + testExpr + " " + op + " " + values.size() + " values)";
    }
}
