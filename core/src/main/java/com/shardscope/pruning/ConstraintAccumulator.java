package com.shardscope.pruning;

import com.shardscope.expression.Expression;
import com.shardscope.expression.Literal;
import com.shardscope.types.ArrayType;
import com.shardscope.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds each AND-branch of a normalized tree into a {@link PruningInstance}.
 *
 * <p>Folding keeps the tightest bound per operator: the smaller of two upper
 * bounds, the larger of two lower bounds. Two different equality constants
 * make the branch unsatisfiable. A branch without any classified leaf
 * yields an instance without a valid constraint.
 */
public final class ConstraintAccumulator {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintAccumulator.class);

    private final PruningContext context;

    public ConstraintAccumulator(PruningContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * Builds one instance per branch.
     *
     * @param normalized the output of {@link PredicateNormalizer#normalize(List)}
     * @return the instances; a single unconstrained instance if the tree has no branch
     * @throws IllegalStateException if a branch restricts the pre-hashed column twice
     */
    public List<PruningInstance> accumulate(PruneNode normalized) {
        if (!normalized.isOr() || !normalized.conditions().isEmpty()) {
            throw new IllegalStateException("Expected an OR of AND-branches, got: " + normalized);
        }

        List<PruningInstance> instances = new ArrayList<>();
        for (PruneNode branch : normalized.children()) {
            if (!branch.isAnd() || !branch.children().isEmpty()) {
                throw new IllegalStateException("Expected an AND-branch of conditions, got: " + branch);
            }
            instances.add(accumulateBranch(branch.conditions()));
        }
        if (instances.isEmpty()) {
            instances.add(PruningInstance.unconstrained(List.of()));
        }
        return instances;
    }

    PruningInstance accumulateBranch(List<ConditionSlot> conditions) {
        if (conditions.stream().noneMatch(ConditionSlot::isClassified)) {
            List<Expression> residuals = new ArrayList<>();
            conditions.forEach(condition -> residuals.add(condition.expression()));
            return PruningInstance.unconstrained(residuals);
        }

        PruningInstance instance = new PruningInstance();
        instance.setPartial(true);
        for (ConditionSlot condition : conditions) {
            switch (condition.kind()) {
                case COMPARISON -> addComparison(instance, condition);
                case MEMBERSHIP -> addMembership(instance, condition.constant());
                case PRE_HASHED -> addPreHashed(instance, condition);
                case OPAQUE -> instance.addResidual(condition.expression());
            }
        }
        instance.setPartial(false);

        logger.debug("Accumulated branch {} into {}", conditions, instance);
        return instance;
    }

    private void addComparison(PruningInstance instance, ConditionSlot condition) {
        Literal constant = condition.constant();
        switch (condition.comparisonClass()) {
            case LESS -> {
                if (instance.lessBound() == null || isLess(constant, instance.lessBound())) {
                    instance.setLessBound(constant);
                }
            }
            case LESS_EQUAL -> {
                if (instance.lessEqualBound() == null || isLess(constant, instance.lessEqualBound())) {
                    instance.setLessEqualBound(constant);
                }
            }
            case EQUAL -> {
                if (instance.equalBound() == null) {
                    instance.setEqualBound(constant);
                } else if (context.compareValues(constant.value(), instance.equalBound().value()) != 0) {
                    instance.markEvaluatesToFalse();
                }
            }
            case GREATER_EQUAL -> {
                if (instance.greaterEqualBound() == null || isLess(instance.greaterEqualBound(), constant)) {
                    instance.setGreaterEqualBound(constant);
                }
            }
            case GREATER -> {
                if (instance.greaterBound() == null || isLess(instance.greaterBound(), constant)) {
                    instance.setGreaterBound(constant);
                }
            }
            default -> instance.addResidual(condition.expression());
        }
    }

    private boolean isLess(Literal left, Literal right) {
        return context.compareValues(left.value(), right.value()) < 0;
    }

    private static void addMembership(PruningInstance instance, Literal array) {
        DataType elementType = ((ArrayType) array.dataType()).elementType();
        List<Literal> values = new ArrayList<>();
        for (Object element : array.elements()) {
            // NULL never equals anything
            if (element != null) {
                values.add(new Literal(element, elementType));
            }
        }
        instance.addEqualityValues(values);
    }

    private static void addPreHashed(PruningInstance instance, ConditionSlot condition) {
        if (instance.hashedEqualBound() != null) {
            throw new IllegalStateException(
                "Branch restricts the pre-hashed column more than once: " + condition.expression().toSQL());
        }
        instance.setHashedEqualBound(condition.constant());
    }
}
