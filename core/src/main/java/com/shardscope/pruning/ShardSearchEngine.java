package com.shardscope.pruning;

import com.shardscope.expression.Literal;
import com.shardscope.metadata.DistributedTableMetadata;
import com.shardscope.metadata.ShardInterval;
import com.shardscope.runtime.PruningDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Finds the shards a single {@link PruningInstance} cannot exclude.
 *
 * <p>Strategies, cheapest first:
 * <ol>
 *   <li>equality or membership lookup by binary search</li>
 *   <li>pre-hashed lookup by binary search, intersected with the above</li>
 *   <li>range search: binary search for the first and last qualifying interval</li>
 *   <li>exhaustive scan testing every interval against every bound</li>
 * </ol>
 * Binary search is only used when the intervals do not overlap and all of
 * them have both boundaries; otherwise the scan is used.
 *
 * <p>For hash-distributed tables equality and membership values are hashed
 * before they are looked up, and range bounds are ignored.
 */
public final class ShardSearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(ShardSearchEngine.class);

    private final PruningContext context;
    private final List<ShardInterval> intervals;
    private final boolean binarySearchable;

    public ShardSearchEngine(PruningContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        DistributedTableMetadata table = context.table();
        this.intervals = table.sortedShardIntervals();
        this.binarySearchable = !table.hasOverlappingShardInterval() && !table.hasUninitializedShardInterval();
    }

    /**
     * Returns the shards that may hold rows matching the instance.
     *
     * @param instance a complete instance with a valid constraint
     * @return the shards, in interval order, never null
     */
    public List<ShardInterval> search(PruningInstance instance) {
        if (instance.isPartial()) {
            throw new IllegalStateException("Cannot search with a partial pruning instance");
        }
        if (instance.evaluatesToFalse()) {
            trace("branch is always false", instance);
            return List.of();
        }
        if (!instance.hasValidConstraint() ||
            (context.isHashPartitioned() && !instance.hasEqualityConstraint())) {
            trace("branch is unconstrained", instance);
            return intervals;
        }

        if (!binarySearchable) {
            trace("exhaustive scan over overlapping or uninitialized intervals", instance);
            return exhaustiveSearch(intervals, instance);
        }

        TreeSet<Integer> candidates = null;
        if (instance.equalBound() != null) {
            int index = findIndex(equalityKey(instance.equalBound()));
            if (index == ShardBoundarySearch.INVALID_SHARD_INDEX) {
                trace("equality value is outside every shard", instance);
                return List.of();
            }
            candidates = new TreeSet<>(List.of(index));
        } else if (instance.equalityValues() != null) {
            candidates = new TreeSet<>();
            for (Literal value : instance.equalityValues()) {
                int index = findIndex(equalityKey(value));
                if (index != ShardBoundarySearch.INVALID_SHARD_INDEX) {
                    candidates.add(index);
                }
            }
            if (candidates.isEmpty()) {
                trace("no membership value falls inside a shard", instance);
                return List.of();
            }
        }

        if (instance.hashedEqualBound() != null) {
            int index = findIndex(instance.hashedEqualBound().value());
            if (index == ShardBoundarySearch.INVALID_SHARD_INDEX ||
                (candidates != null && !candidates.contains(index))) {
                trace("pre-hashed value selects no shard", instance);
                return List.of();
            }
            trace("pre-hashed lookup", instance);
            return List.of(intervals.get(index));
        }

        if (candidates != null) {
            List<ShardInterval> found = new ArrayList<>(candidates.size());
            candidates.forEach(index -> found.add(intervals.get(index)));
            trace("equality lookup", instance);
            return context.isHashPartitioned() ? found : exhaustiveSearch(found, instance);
        }

        if (instance.hasRangeBound() && !context.isHashPartitioned()) {
            trace("range binary search", instance);
            return rangeSearch(instance);
        }

        trace("exhaustive scan", instance);
        return exhaustiveSearch(intervals, instance);
    }

    // ==================== Range search ====================

    private List<ShardInterval> rangeSearch(PruningInstance instance) {
        int lower = 0;
        Literal greater = instance.greaterBound();
        Literal greaterEqual = instance.greaterEqualBound();
        if (greater != null || greaterEqual != null) {
            // on equal values the strict bound is tighter
            boolean strict = greaterEqual == null ||
                (greater != null && context.compareValues(greater.value(), greaterEqual.value()) >= 0);
            Object bound = strict ? greater.value() : greaterEqual.value();
            lower = ShardBoundarySearch.lowerShardBoundary(
                bound, intervals, context.boundaryComparator(), !strict);
        }

        int upper = intervals.size() - 1;
        Literal less = instance.lessBound();
        Literal lessEqual = instance.lessEqualBound();
        if (less != null || lessEqual != null) {
            boolean strict = lessEqual == null ||
                (less != null && context.compareValues(less.value(), lessEqual.value()) <= 0);
            Object bound = strict ? less.value() : lessEqual.value();
            upper = ShardBoundarySearch.upperShardBoundary(
                bound, intervals, context.boundaryComparator(), !strict);
        }

        if (lower == ShardBoundarySearch.INVALID_SHARD_INDEX ||
            upper == ShardBoundarySearch.INVALID_SHARD_INDEX ||
            lower > upper) {
            return List.of();
        }
        return intervals.subList(lower, upper + 1);
    }

    // ==================== Exhaustive scan ====================

    private List<ShardInterval> exhaustiveSearch(List<ShardInterval> candidates, PruningInstance instance) {
        List<ShardInterval> remaining = new ArrayList<>();
        for (ShardInterval interval : candidates) {
            if (!excludes(instance, interval)) {
                remaining.add(interval);
            }
        }
        return remaining;
    }

    /**
     * Returns whether the instance proves that no matching row can lie in
     * the interval. A missing boundary never excludes.
     */
    boolean excludes(PruningInstance instance, ShardInterval interval) {
        if (instance.equalBound() != null &&
            outside(equalityKey(instance.equalBound()), interval)) {
            return true;
        }
        if (instance.equalityValues() != null &&
            instance.equalityValues().stream().allMatch(value -> outside(equalityKey(value), interval))) {
            return true;
        }
        if (instance.hashedEqualBound() != null && context.isHashPartitioned() &&
            outside(instance.hashedEqualBound().value(), interval)) {
            return true;
        }
        if (context.isHashPartitioned()) {
            return false;
        }

        if (interval.maxValueExists()) {
            Object max = interval.maxValue();
            if (instance.greaterEqualBound() != null &&
                context.compareToBoundary(instance.greaterEqualBound().value(), max) > 0) {
                return true;
            }
            if (instance.greaterBound() != null &&
                context.compareToBoundary(instance.greaterBound().value(), max) >= 0) {
                return true;
            }
        }
        if (interval.minValueExists()) {
            Object min = interval.minValue();
            if (instance.lessEqualBound() != null &&
                context.compareToBoundary(instance.lessEqualBound().value(), min) < 0) {
                return true;
            }
            if (instance.lessBound() != null &&
                context.compareToBoundary(instance.lessBound().value(), min) <= 0) {
                return true;
            }
        }
        return false;
    }

    private boolean outside(Object key, ShardInterval interval) {
        return (interval.minValueExists() && context.compareToBoundary(key, interval.minValue()) < 0) ||
               (interval.maxValueExists() && context.compareToBoundary(key, interval.maxValue()) > 0);
    }

    // ==================== Helpers ====================

    private Object equalityKey(Literal value) {
        return context.isHashPartitioned() ? (Object) context.hash(value.value()) : value.value();
    }

    private int findIndex(Object key) {
        return ShardBoundarySearch.findShardIntervalIndex(key, intervals, context.boundaryComparator());
    }

    private void trace(String decision, PruningInstance instance) {
        if (PruningDiagnostics.isLogShardPruning()) {
            logger.info("Shard pruning for {}: {} ({})", context.table().relationName(), decision, instance);
        } else {
            logger.debug("{}: {}", decision, instance);
        }
    }
}
