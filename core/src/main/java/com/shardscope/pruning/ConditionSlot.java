package com.shardscope.pruning;

import com.shardscope.expression.Expression;
import com.shardscope.expression.Literal;

import java.util.Objects;

/**
 * One leaf of a {@link PruneNode}: either a restriction the pruner
 * understands, or an opaque marker for a predicate it does not.
 *
 * @param kind what the leaf restricts
 * @param expression the predicate as it appeared in the query
 * @param comparisonClass the operator's class, {@link ComparisonClass#UNKNOWN} for opaque leaves
 * @param constant the constant operand (an array literal for membership), null for opaque leaves
 */
public record ConditionSlot(Kind kind, Expression expression, ComparisonClass comparisonClass, Literal constant) {

    /**
     * Kinds of leaves.
     */
    public enum Kind {
        /** {@code col op constant} on the partition column. */
        COMPARISON,
        /** {@code col = ANY(array)} or {@code col IN (...)} on the partition column. */
        MEMBERSHIP,
        /** Restriction on the reserved pre-hashed column. */
        PRE_HASHED,
        /** Anything the pruner cannot interpret. */
        OPAQUE
    }

    public ConditionSlot {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(comparisonClass, "comparisonClass must not be null");
        if (kind != Kind.OPAQUE && constant == null) {
            throw new IllegalArgumentException("Classified condition requires a constant: " + expression.toSQL());
        }
    }

    public boolean isOpaque() {
        return kind == Kind.OPAQUE;
    }

    public boolean isClassified() {
        return kind != Kind.OPAQUE;
    }

    @Override
    public String toString() {
        return isOpaque() ? "<opaque " + expression.toSQL() + ">" : expression.toSQL();
    }

    // ==================== Factory Methods ====================

    public static ConditionSlot comparison(Expression expression, ComparisonClass comparisonClass, Literal constant) {
        return new ConditionSlot(Kind.COMPARISON, expression, comparisonClass, constant);
    }

    public static ConditionSlot membership(Expression expression, Literal array) {
        return new ConditionSlot(Kind.MEMBERSHIP, expression, ComparisonClass.EQUAL, array);
    }

    public static ConditionSlot preHashed(Expression expression, ComparisonClass comparisonClass, Literal hashValue) {
        return new ConditionSlot(Kind.PRE_HASHED, expression, comparisonClass, hashValue);
    }

    public static ConditionSlot opaque(Expression expression) {
        return new ConditionSlot(Kind.OPAQUE, expression, ComparisonClass.UNKNOWN, null);
    }
}
