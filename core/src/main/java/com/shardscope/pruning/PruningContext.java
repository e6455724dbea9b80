package com.shardscope.pruning;

import com.shardscope.exception.ShardPruningException;
import com.shardscope.metadata.DistributedTableMetadata;
import com.shardscope.metadata.PartitionComparator;
import com.shardscope.metadata.PartitionHashFunction;
import com.shardscope.metadata.PartitionMethod;

import java.util.Comparator;
import java.util.Objects;

/**
 * Per-call access to the functions of a table's partition metadata.
 *
 * <p>Every comparator invocation goes through this class, which turns a
 * missing result into a {@link ShardPruningException}.
 */
public final class PruningContext {

    private final DistributedTableMetadata table;
    private final PartitionComparator valueComparator;
    private final PartitionComparator intervalComparator;
    private final PartitionHashFunction hashFunction;
    private final Comparator<Object> boundaryComparator;

    /**
     * Creates a context for one pruning call.
     *
     * @param table the table being pruned
     * @throws ShardPruningException if the metadata lacks a required function
     */
    public PruningContext(DistributedTableMetadata table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.valueComparator = table.valueComparator();
        this.intervalComparator = table.intervalComparator();
        this.hashFunction = table.hashFunction();

        if (intervalComparator == null) {
            throw ShardPruningException.missingFunction(table.relationName(), "shard interval comparator");
        }
        if (valueComparator == null) {
            throw ShardPruningException.missingFunction(table.relationName(), "partition column value comparator");
        }
        if (table.partitionMethod() == PartitionMethod.HASH && hashFunction == null) {
            throw ShardPruningException.missingFunction(table.relationName(), "partition column hash function");
        }
        this.boundaryComparator = this::compareToBoundary;
    }

    public DistributedTableMetadata table() {
        return table;
    }

    public boolean isHashPartitioned() {
        return table.partitionMethod() == PartitionMethod.HASH;
    }

    /**
     * Compares two constants with the value comparator.
     *
     * @return negative, zero or positive as {@code left} is less than, equal to or greater than {@code right}
     * @throws ShardPruningException if the comparator returns no result
     */
    public int compareValues(Object left, Object right) {
        return invoke(valueComparator, left, right);
    }

    /**
     * Compares a constant against a shard boundary with the interval comparator.
     *
     * @return negative, zero or positive as {@code value} is less than, equal to or greater than {@code boundary}
     * @throws ShardPruningException if the comparator returns no result
     */
    public int compareToBoundary(Object value, Object boundary) {
        return invoke(intervalComparator, value, boundary);
    }

    /**
     * Returns {@link #compareToBoundary(Object, Object)} as a comparator, for
     * the search functions in {@link ShardBoundarySearch}.
     *
     * @return the boundary comparator
     */
    public Comparator<Object> boundaryComparator() {
        return boundaryComparator;
    }

    /**
     * Returns the hash token of a partition value. Only valid for
     * hash-distributed tables.
     *
     * @param value the value
     * @return the hash token
     */
    public int hash(Object value) {
        return hashFunction.hash(value);
    }

    private int invoke(PartitionComparator comparator, Object left, Object right) {
        Integer result = comparator.compare(left, right);
        if (result == null) {
            throw ShardPruningException.nullResult(table.relationName(), comparator.name());
        }
        return result;
    }
}
