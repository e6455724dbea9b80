package com.shardscope.expression;

import com.shardscope.types.BooleanType;
import com.shardscope.types.DataType;

import java.util.Objects;

/**
 * Expression representing a unary operation (operation with one operand).
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>Arithmetic negation: -a</li>
 *   <li>Logical negation: NOT a</li>
 *   <li>IS NULL: a IS NULL</li>
 *   <li>IS NOT NULL: a IS NOT NULL</li>
 * </ul>
 *
 * <p>The shard pruner interprets none of these; a {@code NOT} in a filter is
 * treated as an unknown restriction no matter what it wraps.
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-", "negation"),
        NOT("NOT", "logical NOT"),
        IS_NULL("IS NULL", "null check"),
        IS_NOT_NULL("IS NOT NULL", "not null check");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }

        public boolean isPrefix() {
            return this == NEGATE || this == NOT;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        if (operator == Operator.NEGATE) {
            return operand.dataType();
        }
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        if (operator == Operator.IS_NULL || operator == Operator.IS_NOT_NULL) {
            return false;
        }
        return operand.nullable();
    }

    @Override
    public String toSQL() {
        if (operator == Operator.NEGATE) {
            return String.format("(%s%s)", operator.symbol(), operand.toSQL());
        }
        if (operator.isPrefix()) {
            return String.format("(%s %s)", operator.symbol(), operand.toSQL());
        }
        return String.format("(%s %s)", operand.toSQL(), operator.symbol());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }
}
