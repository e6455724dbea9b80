package com.shardscope.pruning;

import com.shardscope.expression.ArrayComparison;
import com.shardscope.expression.BinaryExpression;
import com.shardscope.expression.CastExpression;
import com.shardscope.expression.ColumnReference;
import com.shardscope.expression.Expression;
import com.shardscope.expression.InExpression;
import com.shardscope.expression.Literal;
import com.shardscope.types.ArrayType;
import com.shardscope.types.OrderingFamily;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a single predicate restricts the partition column in a way
 * the pruner can use.
 *
 * <p>Usable predicates are:
 * <ul>
 *   <li>{@code col op constant} and {@code constant op col} for the ordering
 *       operators {@code <, <=, =, >=, >}; the constant side is commuted to
 *       the right</li>
 *   <li>{@code col = ANY(array constant)} and {@code col IN (constants)}</li>
 *   <li>{@code >=} and {@code =} on the reserved pre-hashed column, when the
 *       table is hash-distributed</li>
 * </ul>
 *
 * <p>Implicit casts around the column are ignored. The constant's type,
 * including implicit casts, must belong to the partition column's ordering
 * family, so that comparing it against shard boundaries orders values the
 * way the column does. A constant implicitly cast from another family is
 * converted to the cast's type first.
 * Everything else becomes an opaque leaf; classification never fails.
 */
public final class ConstraintClassifier {

    private final ColumnReference partitionColumn;
    private final ColumnReference hashedColumn;
    private final OrderingFamily partitionFamily;

    /**
     * Creates a classifier.
     *
     * @param partitionColumn the partition column as referenced in the query
     * @param hashedColumn the pre-hashed column, or null if the table is not hash-distributed
     */
    public ConstraintClassifier(ColumnReference partitionColumn, ColumnReference hashedColumn) {
        this.partitionColumn = Objects.requireNonNull(partitionColumn, "partitionColumn must not be null");
        this.hashedColumn = hashedColumn;
        this.partitionFamily = partitionColumn.dataType().orderingFamily();
    }

    public ColumnReference partitionColumn() {
        return partitionColumn;
    }

    /**
     * Classifies one non-boolean predicate.
     *
     * @param predicate the predicate
     * @return a classified slot, or an opaque slot if the predicate is not usable
     */
    public ConditionSlot classify(Expression predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (predicate instanceof BinaryExpression binary && binary.operator().isComparison()) {
            return classifyComparison(binary);
        }
        if (predicate instanceof ArrayComparison arrayComparison) {
            return classifyMembership(predicate, arrayComparison);
        }
        if (predicate instanceof InExpression in) {
            ArrayComparison rewritten = in.asArrayComparison();
            if (rewritten != null) {
                return classifyMembership(predicate, rewritten);
            }
        }
        return ConditionSlot.opaque(predicate);
    }

    private ConditionSlot classifyComparison(BinaryExpression comparison) {
        Expression left = CastExpression.stripImplicitCasts(comparison.left());
        Expression right = CastExpression.stripImplicitCasts(comparison.right());
        BinaryExpression.Operator operator = comparison.operator();

        Expression constantSide = comparison.right();
        ColumnReference column;
        Literal constant;
        if (left instanceof ColumnReference leftColumn && right instanceof Literal rightLiteral) {
            column = leftColumn;
            constant = rightLiteral;
        } else if (left instanceof Literal leftLiteral && right instanceof ColumnReference rightColumn) {
            column = rightColumn;
            constant = leftLiteral;
            constantSide = comparison.left();
            operator = operator.commute();
        } else {
            return ConditionSlot.opaque(comparison);
        }

        if (constant.isNull()) {
            return ConditionSlot.opaque(comparison);
        }

        ComparisonClass comparisonClass = ComparisonClass.of(operator);
        if (hashedColumn != null && hashedColumn.refersToSameColumn(column)) {
            boolean usable = (comparisonClass == ComparisonClass.GREATER_EQUAL ||
                              comparisonClass == ComparisonClass.EQUAL) &&
                             constant.value() instanceof Integer;
            return usable ? ConditionSlot.preHashed(comparison, comparisonClass, constant)
                          : ConditionSlot.opaque(comparison);
        }

        if (!partitionColumn.refersToSameColumn(column) ||
            !comparisonClass.isBound() ||
            !sameFamily(constantSide.dataType().orderingFamily())) {
            return ConditionSlot.opaque(comparison);
        }
        Literal columnConstant = asColumnConstant(constant, constant.dataType().orderingFamily(), constantSide);
        if (columnConstant == null) {
            return ConditionSlot.opaque(comparison);
        }
        return ConditionSlot.comparison(comparison, comparisonClass, columnConstant);
    }

    private ConditionSlot classifyMembership(Expression predicate, ArrayComparison membership) {
        if (!membership.isAny() || membership.operator() != BinaryExpression.Operator.EQUAL) {
            return ConditionSlot.opaque(predicate);
        }
        Expression left = CastExpression.stripImplicitCasts(membership.left());
        Expression array = CastExpression.stripImplicitCasts(membership.array());
        if (!(left instanceof ColumnReference column) || !partitionColumn.refersToSameColumn(column)) {
            return ConditionSlot.opaque(predicate);
        }
        if (!(array instanceof Literal arrayLiteral) || !(arrayLiteral.value() instanceof List) ||
            !(membership.array().dataType() instanceof ArrayType arrayType) ||
            !sameFamily(arrayType.elementType().orderingFamily()) ||
            !(arrayLiteral.dataType() instanceof ArrayType literalType)) {
            return ConditionSlot.opaque(predicate);
        }
        Literal columnArray = asColumnConstant(
            arrayLiteral, literalType.elementType().orderingFamily(), membership.array());
        if (columnArray == null) {
            return ConditionSlot.opaque(predicate);
        }
        return ConditionSlot.membership(predicate, columnArray);
    }

    /**
     * Returns the constant with the value the partition column is compared
     * against. A literal from another family, such as an integer implicitly
     * cast to decimal, is converted to the cast's type so that it hashes and
     * compares like the column's values.
     *
     * @return the constant, or null if its cast cannot be evaluated
     */
    private Literal asColumnConstant(Literal literal, OrderingFamily literalFamily, Expression castSide) {
        if (literalFamily == partitionFamily) {
            return literal;
        }
        return literal.coerceTo(castSide.dataType()).orElse(null);
    }

    private boolean sameFamily(OrderingFamily constantFamily) {
        return partitionFamily.isOrdered() && partitionFamily == constantFamily;
    }
}
