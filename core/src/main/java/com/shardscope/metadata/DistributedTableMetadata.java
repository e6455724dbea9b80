package com.shardscope.metadata;

import com.shardscope.exception.ShardPruningException;
import com.shardscope.expression.ColumnReference;
import com.shardscope.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Partition descriptor of a distributed table, as supplied by the metadata
 * cache.
 *
 * <p>The shard intervals are kept sorted by their minimum value using the
 * interval comparator; intervals with a missing minimum sort last. The
 * descriptor is immutable and may be shared by concurrent pruning calls.
 *
 * <p>Example:
 * <pre>
 *   DistributedTableMetadata orders = DistributedTableMetadata.builder("orders")
 *       .partitionMethod(PartitionMethod.RANGE)
 *       .partitionColumn("order_id", LongType.get())
 *       .comparators(PartitionComparators.natural())
 *       .shardIntervals(intervals)
 *       .build();
 * </pre>
 */
public final class DistributedTableMetadata {

    private static final Logger logger = LoggerFactory.getLogger(DistributedTableMetadata.class);

    private final String relationName;
    private final PartitionMethod partitionMethod;
    private final String partitionColumnName;
    private final DataType partitionColumnType;
    private final PartitionComparator valueComparator;
    private final PartitionComparator intervalComparator;
    private final PartitionHashFunction hashFunction;
    private final List<ShardInterval> sortedShardIntervals;
    private final boolean hasOverlappingShardInterval;
    private final boolean hasUninitializedShardInterval;

    private DistributedTableMetadata(Builder builder, List<ShardInterval> sortedShardIntervals,
                                     boolean hasOverlappingShardInterval,
                                     boolean hasUninitializedShardInterval) {
        this.relationName = builder.relationName;
        this.partitionMethod = builder.partitionMethod;
        this.partitionColumnName = builder.partitionColumnName;
        this.partitionColumnType = builder.partitionColumnType;
        this.valueComparator = builder.valueComparator;
        this.intervalComparator = builder.intervalComparator;
        this.hashFunction = builder.hashFunction;
        this.sortedShardIntervals = Collections.unmodifiableList(sortedShardIntervals);
        this.hasOverlappingShardInterval = hasOverlappingShardInterval;
        this.hasUninitializedShardInterval = hasUninitializedShardInterval;
    }

    public String relationName() {
        return relationName;
    }

    public PartitionMethod partitionMethod() {
        return partitionMethod;
    }

    /**
     * Returns the partition column's name.
     *
     * @return the column name, or null for reference tables
     */
    public String partitionColumnName() {
        return partitionColumnName;
    }

    public DataType partitionColumnType() {
        return partitionColumnType;
    }

    /**
     * Returns the partition column as it appears in a query.
     *
     * @param qualifier the alias of this table's occurrence in the query (may be null)
     * @return the column reference
     * @throws IllegalStateException for reference tables, which have no partition column
     */
    public ColumnReference partitionColumn(String qualifier) {
        if (partitionColumnName == null) {
            throw new IllegalStateException("Reference table has no partition column: " + relationName);
        }
        return ColumnReference.qualified(qualifier, partitionColumnName, partitionColumnType);
    }

    /**
     * Returns the comparator for partition column values, used to tighten
     * bounds against each other.
     *
     * @return the comparator, or null if the metadata lacks one
     */
    public PartitionComparator valueComparator() {
        return valueComparator;
    }

    /**
     * Returns the comparator for values against shard boundaries.
     *
     * @return the comparator, or null if the metadata lacks one
     */
    public PartitionComparator intervalComparator() {
        return intervalComparator;
    }

    /**
     * Returns the hash function of a hash-distributed table.
     *
     * @return the hash function, or null
     */
    public PartitionHashFunction hashFunction() {
        return hashFunction;
    }

    /**
     * Returns the shard intervals sorted by minimum value.
     *
     * @return an unmodifiable list
     */
    public List<ShardInterval> sortedShardIntervals() {
        return sortedShardIntervals;
    }

    public int shardCount() {
        return sortedShardIntervals.size();
    }

    public boolean isReferenceTable() {
        return partitionMethod == PartitionMethod.NONE;
    }

    /**
     * Returns whether two shard intervals may overlap. Binary search over the
     * intervals is only valid when this is false.
     *
     * @return true if any two intervals overlap or some interval is uninitialized
     */
    public boolean hasOverlappingShardInterval() {
        return hasOverlappingShardInterval;
    }

    /**
     * Returns whether some interval lacks a minimum or maximum value.
     *
     * @return true if any interval is not fully initialized
     */
    public boolean hasUninitializedShardInterval() {
        return hasUninitializedShardInterval;
    }

    @Override
    public String toString() {
        return "DistributedTableMetadata(" + relationName + ", " + partitionMethod +
            (partitionColumnName == null ? "" : ", " + partitionColumnName) +
            ", shards=" + sortedShardIntervals.size() + ")";
    }

    // ==================== Factory Methods ====================

    public static Builder builder(String relationName) {
        return new Builder(relationName);
    }

    /**
     * Creates a reference table with a single, unbounded shard.
     *
     * @param relationName the table name
     * @param shardId the id of its only shard
     * @return the metadata
     */
    public static DistributedTableMetadata referenceTable(String relationName, long shardId) {
        return builder(relationName)
            .partitionMethod(PartitionMethod.NONE)
            .shardIntervals(List.of(new ShardInterval(shardId, relationName, null, null)))
            .build();
    }

    /**
     * Creates a hash-distributed table whose shards split the hash space
     * uniformly, using murmur3 hashing and natural ordering.
     *
     * @param relationName the table name
     * @param columnName the partition column
     * @param columnType the partition column type
     * @param firstShardId id of the first shard
     * @param shardCount number of shards
     * @return the metadata
     */
    public static DistributedTableMetadata hashDistributed(String relationName, String columnName,
                                                           DataType columnType, long firstShardId,
                                                           int shardCount) {
        return builder(relationName)
            .partitionMethod(PartitionMethod.HASH)
            .partitionColumn(columnName, columnType)
            .comparators(PartitionComparators.natural())
            .hashFunction(PartitionHashFunction.murmur3())
            .shardIntervals(HashRanges.uniform(relationName, firstShardId, shardCount))
            .build();
    }

    /**
     * Builder for {@link DistributedTableMetadata}.
     */
    public static final class Builder {
        private final String relationName;
        private PartitionMethod partitionMethod = PartitionMethod.HASH;
        private String partitionColumnName;
        private DataType partitionColumnType;
        private PartitionComparator valueComparator;
        private PartitionComparator intervalComparator;
        private PartitionHashFunction hashFunction;
        private List<ShardInterval> shardIntervals = List.of();
        private Boolean hasOverlappingShardInterval;

        private Builder(String relationName) {
            this.relationName = Objects.requireNonNull(relationName, "relationName must not be null");
        }

        public Builder partitionMethod(PartitionMethod partitionMethod) {
            this.partitionMethod = Objects.requireNonNull(partitionMethod, "partitionMethod must not be null");
            return this;
        }

        public Builder partitionColumn(String columnName, DataType columnType) {
            this.partitionColumnName = Objects.requireNonNull(columnName, "columnName must not be null");
            this.partitionColumnType = Objects.requireNonNull(columnType, "columnType must not be null");
            return this;
        }

        public Builder valueComparator(PartitionComparator comparator) {
            this.valueComparator = comparator;
            return this;
        }

        public Builder intervalComparator(PartitionComparator comparator) {
            this.intervalComparator = comparator;
            return this;
        }

        /**
         * Uses one comparator for both values and shard boundaries.
         */
        public Builder comparators(PartitionComparator comparator) {
            this.valueComparator = comparator;
            this.intervalComparator = comparator;
            return this;
        }

        public Builder hashFunction(PartitionHashFunction hashFunction) {
            this.hashFunction = hashFunction;
            return this;
        }

        public Builder shardIntervals(List<ShardInterval> shardIntervals) {
            this.shardIntervals = List.copyOf(
                Objects.requireNonNull(shardIntervals, "shardIntervals must not be null"));
            return this;
        }

        /**
         * Overrides the overlap flag. When not set, it is computed from the
         * sorted intervals.
         */
        public Builder overlapping(boolean hasOverlappingShardInterval) {
            this.hasOverlappingShardInterval = hasOverlappingShardInterval;
            return this;
        }

        /**
         * Sorts the intervals and builds the descriptor.
         *
         * @return the metadata
         * @throws IllegalArgumentException if a distributed table has no partition
         *         column, or a reference table has more than one shard
         * @throws ShardPruningException if the interval comparator fails while sorting
         */
        public DistributedTableMetadata build() {
            if (partitionMethod == PartitionMethod.NONE) {
                if (shardIntervals.size() > 1) {
                    throw new IllegalArgumentException(
                        "Reference table " + relationName + " must have at most one shard, got: " +
                        shardIntervals.size());
                }
            } else if (partitionColumnName == null) {
                throw new IllegalArgumentException(
                    "Distributed table " + relationName + " requires a partition column");
            }

            boolean uninitialized = shardIntervals.stream().anyMatch(interval -> !interval.isInitialized());
            List<ShardInterval> sorted = new ArrayList<>(shardIntervals);
            if (intervalComparator != null) {
                sorted.sort(this::compareByMinValue);
            }

            boolean overlapping;
            if (hasOverlappingShardInterval != null) {
                overlapping = hasOverlappingShardInterval;
            } else {
                overlapping = computeOverlap(sorted, uninitialized);
            }

            logger.debug("Loaded metadata for {}: {} shards, overlapping={}, uninitialized={}",
                relationName, sorted.size(), overlapping, uninitialized);
            return new DistributedTableMetadata(this, sorted, overlapping, uninitialized);
        }

        private int compareByMinValue(ShardInterval left, ShardInterval right) {
            if (!left.minValueExists() || !right.minValueExists()) {
                return Boolean.compare(!left.minValueExists(), !right.minValueExists());
            }
            return compare(left.minValue(), right.minValue());
        }

        private boolean computeOverlap(List<ShardInterval> sorted, boolean uninitialized) {
            if (sorted.size() < 2) {
                return false;
            }
            if (uninitialized || intervalComparator == null) {
                return true;
            }
            for (int index = 1; index < sorted.size(); index++) {
                if (compare(sorted.get(index - 1).maxValue(), sorted.get(index).minValue()) >= 0) {
                    return true;
                }
            }
            return false;
        }

        private int compare(Object left, Object right) {
            Integer result = intervalComparator.compare(left, right);
            if (result == null) {
                throw ShardPruningException.nullResult(relationName, intervalComparator.name());
            }
            return result;
        }
    }
}
