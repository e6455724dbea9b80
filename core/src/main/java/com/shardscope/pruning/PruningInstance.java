package com.shardscope.pruning;

import com.shardscope.expression.Expression;
import com.shardscope.expression.Literal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one AND-branch says about the partition column.
 *
 * <p>Filled in by the {@link ConstraintAccumulator}, read by the
 * {@link ShardSearchEngine}. Each bound holds the most restrictive constant
 * seen for its operator.
 */
public final class PruningInstance {

    private Literal lessBound;
    private Literal lessEqualBound;
    private Literal equalBound;
    private Literal greaterEqualBound;
    private Literal greaterBound;
    private List<Literal> equalityValues;
    private Literal hashedEqualBound;
    private final List<Expression> residuals = new ArrayList<>();

    private boolean hasValidConstraint;
    private boolean evaluatesToFalse;
    private boolean partial;

    PruningInstance() {}

    /**
     * Creates a bag for a branch the pruner could not understand.
     *
     * @param residuals the branch's uninterpreted predicates
     * @return a bag without a valid constraint
     */
    static PruningInstance unconstrained(List<Expression> residuals) {
        PruningInstance instance = new PruningInstance();
        instance.residuals.addAll(residuals);
        return instance;
    }

    public Literal lessBound() {
        return lessBound;
    }

    public Literal lessEqualBound() {
        return lessEqualBound;
    }

    public Literal equalBound() {
        return equalBound;
    }

    public Literal greaterEqualBound() {
        return greaterEqualBound;
    }

    public Literal greaterBound() {
        return greaterBound;
    }

    /**
     * Returns the values of membership restrictions.
     *
     * @return the values, empty if every element was NULL, or null if the
     *         branch has no membership restriction
     */
    public List<Literal> equalityValues() {
        return equalityValues == null ? null : Collections.unmodifiableList(equalityValues);
    }

    /**
     * Returns the restriction on the pre-hashed column.
     *
     * @return the hash token literal, or null
     */
    public Literal hashedEqualBound() {
        return hashedEqualBound;
    }

    public List<Expression> residuals() {
        return Collections.unmodifiableList(residuals);
    }

    public boolean hasValidConstraint() {
        return hasValidConstraint;
    }

    /**
     * Returns whether the branch can never be true, because it requires the
     * partition column to equal two different constants.
     *
     * @return true if the branch matches no rows
     */
    public boolean evaluatesToFalse() {
        return evaluatesToFalse;
    }

    /**
     * Returns whether the bag is still being filled in. Partial bags are
     * never used for pruning.
     *
     * @return true while folding is in progress
     */
    public boolean isPartial() {
        return partial;
    }

    public boolean hasRangeBound() {
        return lessBound != null || lessEqualBound != null ||
               greaterEqualBound != null || greaterBound != null;
    }

    /**
     * Returns whether the bag restricts the column to a finite set of values,
     * the only kind of restriction a hash-distributed table can use.
     *
     * @return true if an equality, membership, or pre-hashed restriction exists
     */
    public boolean hasEqualityConstraint() {
        return equalBound != null || equalityValues != null || hashedEqualBound != null;
    }

    void setLessBound(Literal bound) {
        this.lessBound = bound;
        this.hasValidConstraint = true;
    }

    void setLessEqualBound(Literal bound) {
        this.lessEqualBound = bound;
        this.hasValidConstraint = true;
    }

    void setEqualBound(Literal bound) {
        this.equalBound = bound;
        this.hasValidConstraint = true;
    }

    void setGreaterEqualBound(Literal bound) {
        this.greaterEqualBound = bound;
        this.hasValidConstraint = true;
    }

    void setGreaterBound(Literal bound) {
        this.greaterBound = bound;
        this.hasValidConstraint = true;
    }

    void addEqualityValues(List<Literal> values) {
        if (equalityValues == null) {
            equalityValues = new ArrayList<>();
        }
        equalityValues.addAll(values);
        this.hasValidConstraint = true;
    }

    void setHashedEqualBound(Literal bound) {
        this.hashedEqualBound = bound;
        this.hasValidConstraint = true;
    }

    void addResidual(Expression expression) {
        residuals.add(expression);
    }

    void markEvaluatesToFalse() {
        this.evaluatesToFalse = true;
    }

    void setPartial(boolean partial) {
        this.partial = partial;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PruningInstance(");
        if (!hasValidConstraint) {
            sb.append("unconstrained");
        }
        append(sb, "<", lessBound);
        append(sb, "<=", lessEqualBound);
        append(sb, "=", equalBound);
        append(sb, ">=", greaterEqualBound);
        append(sb, ">", greaterBound);
        if (equalityValues != null) {
            sb.append(" IN ").append(equalityValues);
        }
        append(sb, "hash =", hashedEqualBound);
        if (evaluatesToFalse) {
            sb.append(" false");
        }
        if (!residuals.isEmpty()) {
            sb.append(" residuals=").append(residuals.size());
        }
        return sb.append(")").toString();
    }

    private static void append(StringBuilder sb, String label, Literal bound) {
        if (bound != null) {
            sb.append(' ').append(label).append(' ').append(bound.toSQL());
        }
    }
}
