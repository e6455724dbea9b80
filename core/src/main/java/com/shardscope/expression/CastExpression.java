package com.shardscope.expression;

import com.shardscope.types.DataType;

import java.util.Objects;

/**
 * Expression that casts another expression to a different data type.
 *
 * <p>Casts are either written by the user ({@code CAST(a AS BIGINT)}) or
 * inserted by the planner to make operand types line up, in which case they
 * are <em>implicit</em>. Implicit casts do not change which column a
 * predicate restricts and are looked through by {@link #stripImplicitCasts}.
 *
 * <p>Examples:
 * <pre>
 *   CAST(amount AS DECIMAL(10,2))     -- explicit
 *   int_col = 5::bigint               -- implicit cast of int_col to bigint
 * </pre>
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final DataType targetType;
    private final boolean implicit;

    /**
     * Creates a cast expression.
     *
     * @param expression the expression to cast
     * @param targetType the target data type
     * @param implicit true if the cast was inserted by the planner
     */
    public CastExpression(Expression expression, DataType targetType, boolean implicit) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
        this.implicit = implicit;
    }

    /**
     * Creates an explicit cast expression.
     *
     * @param expression the expression to cast
     * @param targetType the target data type
     */
    public CastExpression(Expression expression, DataType targetType) {
        this(expression, targetType, false);
    }

    public Expression expression() {
        return expression;
    }

    public DataType targetType() {
        return targetType;
    }

    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public DataType dataType() {
        return targetType;
    }

    @Override
    public boolean nullable() {
        return expression.nullable();
    }

    @Override
    public String toSQL() {
        if (implicit) {
            return expression.toSQL();
        }
        return String.format("CAST(%s AS %s)", expression.toSQL(), targetType.typeName().toUpperCase());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return implicit == that.implicit &&
               Objects.equals(expression, that.expression) &&
               Objects.equals(targetType, that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType, implicit);
    }

    /**
     * Removes any number of implicit casts wrapped around an expression.
     *
     * @param expr the expression
     * @return the innermost expression that is not an implicit cast
     */
    public static Expression stripImplicitCasts(Expression expr) {
        Expression current = expr;
        while (current instanceof CastExpression cast && cast.isImplicit()) {
            current = cast.expression();
        }
        return current;
    }

    /**
     * Creates an implicit cast, as the planner would insert it.
     *
     * @param expression the expression to cast
     * @param targetType the target data type
     * @return the implicit cast
     */
    public static CastExpression implicit(Expression expression, DataType targetType) {
        return new CastExpression(expression, targetType, true);
    }
}
