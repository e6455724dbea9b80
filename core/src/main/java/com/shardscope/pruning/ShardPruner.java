package com.shardscope.pruning;

import com.shardscope.exception.ShardPruningException;
import com.shardscope.expression.ColumnReference;
import com.shardscope.expression.Expression;
import com.shardscope.expression.Literal;
import com.shardscope.metadata.DistributedTableMetadata;
import com.shardscope.metadata.PartitionMethod;
import com.shardscope.metadata.ShardInterval;
import com.shardscope.runtime.PruningConfig;
import com.shardscope.runtime.PruningDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of shard pruning: selects the shards of a distributed table
 * that may hold rows matching a query's filter predicates.
 *
 * <p>The result is always a superset of the shards holding matching rows.
 * Predicates the pruner does not understand make it keep more shards, never
 * fewer.
 *
 * <p>Pruning runs in three stages:
 * <ol>
 *   <li>{@link PredicateNormalizer}: predicates to an OR of AND-branches</li>
 *   <li>{@link ConstraintAccumulator}: each branch to a {@link PruningInstance}</li>
 *   <li>{@link ShardSearchEngine}: each instance to shards, unioned by shard id</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>
 *   ShardPruner pruner = new ShardPruner();
 *   PruningResult result = pruner.prune(orders, "o", List.of(
 *       BinaryExpression.equal(orders.partitionColumn("o"), Literal.of(42L))));
 *   result.shards();          // the shard holding order 42
 *   result.partitionValue();  // Optional[42]
 * </pre>
 *
 * <p>Instances are stateless and thread-safe.
 */
public final class ShardPruner {

    private static final Logger logger = LoggerFactory.getLogger(ShardPruner.class);

    private final int maxDistributedBranches;

    public ShardPruner() {
        this(PruningConfig.DEFAULT_MAX_DISTRIBUTED_BRANCHES);
    }

    /**
     * Creates a pruner with a custom bound on distributed branches.
     *
     * @param maxDistributedBranches the bound, normalized with
     *        {@link PruningConfig#normalizeMaxBranches(int)}
     */
    public ShardPruner(int maxDistributedBranches) {
        this.maxDistributedBranches = PruningConfig.normalizeMaxBranches(maxDistributedBranches);
    }

    /**
     * Prunes the shards of a table.
     *
     * @param table the table's partition metadata, not modified
     * @param qualifier the alias of the table in the query (may be null); only
     *        restrictions on columns with this qualifier are used
     * @param predicates the filter predicates, implicitly ANDed
     * @return the selected shards and the single partition value, if any
     * @throws ShardPruningException if the metadata lacks a comparator or hash
     *         function, or a comparator fails
     */
    public PruningResult prune(DistributedTableMetadata table, String qualifier, List<Expression> predicates) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(predicates, "predicates must not be null");

        if (table.shardCount() == 0) {
            logger.debug("{} has no shards", table.relationName());
            return PruningResult.empty();
        }
        if (containsFalseClause(predicates)) {
            logger.debug("Predicates on {} contain a false constant", table.relationName());
            return PruningResult.empty();
        }
        if (table.isReferenceTable()) {
            return new PruningResult(copyOf(table.sortedShardIntervals()), null);
        }

        PruningContext context = new PruningContext(table);
        ColumnReference hashedColumn = table.partitionMethod() == PartitionMethod.HASH
            ? ColumnReference.hashedPartitionColumn(qualifier)
            : null;
        ConstraintClassifier classifier = new ConstraintClassifier(table.partitionColumn(qualifier), hashedColumn);

        PruneNode normalized = new PredicateNormalizer(classifier, maxDistributedBranches).normalize(predicates);
        List<PruningInstance> instances = new ConstraintAccumulator(context).accumulate(normalized);
        ShardSearchEngine searchEngine = new ShardSearchEngine(context);

        Map<Long, ShardInterval> selected = new LinkedHashMap<>();
        PartitionValueTracker partitionValue = new PartitionValueTracker(context);
        for (PruningInstance instance : instances) {
            if (instance.isPartial()) {
                continue;
            }
            if (isUnconstrained(instance, context)) {
                if (PruningDiagnostics.isLogShardPruning()) {
                    logger.info("Shard pruning for {}: branch {} is unconstrained, keeping all {} shards",
                        table.relationName(), instance, table.shardCount());
                }
                return new PruningResult(copyOf(table.sortedShardIntervals()), null);
            }

            for (ShardInterval interval : searchEngine.search(instance)) {
                selected.putIfAbsent(interval.shardId(), interval);
            }
            if (!instance.evaluatesToFalse()) {
                partitionValue.observe(instance);
            }
        }

        PruningResult result = new PruningResult(copyOf(selected.values()), partitionValue.value());
        if (PruningDiagnostics.isLogShardPruning()) {
            logger.info("Shard pruning for {}: {} of {} shards selected {}",
                table.relationName(), result.shards().size(), table.shardCount(), result.shardIds());
        }
        return result;
    }

    /**
     * Returns whether a top-level predicate is the boolean constant false,
     * in which case no row can match.
     *
     * @param predicates the predicates, implicitly ANDed
     * @return true if some predicate is a {@code false} literal
     */
    public static boolean containsFalseClause(List<Expression> predicates) {
        for (Expression predicate : predicates) {
            if (predicate instanceof Literal literal && literal.isFalse()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUnconstrained(PruningInstance instance, PruningContext context) {
        if (!instance.hasValidConstraint()) {
            return true;
        }
        // range bounds tell nothing about hash tokens
        return context.isHashPartitioned() &&
               !instance.evaluatesToFalse() &&
               !instance.hasEqualityConstraint();
    }

    private static List<ShardInterval> copyOf(Iterable<ShardInterval> intervals) {
        List<ShardInterval> copies = new ArrayList<>();
        for (ShardInterval interval : intervals) {
            copies.add(interval.copy());
        }
        return copies;
    }

    /**
     * Tracks whether every satisfiable branch pins the partition column to
     * the same constant.
     */
    private static final class PartitionValueTracker {
        private final PruningContext context;
        private Literal value;
        private boolean ambiguous;

        PartitionValueTracker(PruningContext context) {
            this.context = context;
        }

        void observe(PruningInstance instance) {
            if (ambiguous) {
                return;
            }
            Literal branchValue = singleValue(instance);
            if (branchValue == null ||
                (value != null && context.compareValues(value.value(), branchValue.value()) != 0)) {
                ambiguous = true;
                value = null;
            } else if (value == null) {
                value = branchValue;
            }
        }

        Literal value() {
            return ambiguous ? null : value;
        }

        private Literal singleValue(PruningInstance instance) {
            if (instance.equalBound() != null) {
                return instance.equalBound();
            }
            List<Literal> values = instance.equalityValues();
            if (values == null || values.isEmpty()) {
                return null;
            }
            Literal first = values.get(0);
            for (Literal other : values) {
                if (context.compareValues(first.value(), other.value()) != 0) {
                    return null;
                }
            }
            return first;
        }
    }
}
