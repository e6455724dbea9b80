package com.shardscope.expression;

import com.shardscope.types.DataType;

/**
 * Base interface for all expressions handed to the shard pruner.
 *
 * <p>Expressions are produced by the query planner and describe the filter
 * predicates of a query, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references</li>
 *   <li>Comparison operations (a > b, a = b)</li>
 *   <li>Logical operations (a AND b, NOT a)</li>
 *   <li>Membership tests (a IN (1, 2), a = ANY(array))</li>
 *   <li>Function calls, which the pruner never interprets</li>
 * </ul>
 *
 * <p>All concrete implementations are immutable and {@code final}, so a
 * predicate tree can be shared freely between concurrent pruning calls.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Converts this expression to its SQL string representation.
     *
     * <p>Used for diagnostics and error messages only.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
