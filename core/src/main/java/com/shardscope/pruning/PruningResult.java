package com.shardscope.pruning;

import com.shardscope.expression.Literal;
import com.shardscope.metadata.ShardInterval;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of pruning one table: the shards that must be queried, and the
 * partition value the predicates pin the table to, if there is exactly one.
 */
public final class PruningResult {

    private static final PruningResult EMPTY = new PruningResult(List.of(), null);

    private final List<ShardInterval> shards;
    private final Literal partitionValue;

    /**
     * Creates a result.
     *
     * @param shards the selected shards, owned by the result
     * @param partitionValue the single partition value, or null
     */
    public PruningResult(List<ShardInterval> shards, Literal partitionValue) {
        this.shards = Collections.unmodifiableList(
            Objects.requireNonNull(shards, "shards must not be null"));
        this.partitionValue = partitionValue;
    }

    public static PruningResult empty() {
        return EMPTY;
    }

    /**
     * Returns the selected shards, copies independent of the metadata cache.
     *
     * @return the shards, deduplicated by shard id
     */
    public List<ShardInterval> shards() {
        return shards;
    }

    public List<Long> shardIds() {
        return shards.stream().map(ShardInterval::shardId).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return shards.isEmpty();
    }

    /**
     * Returns the single value every satisfiable branch requires the
     * partition column to equal. Used by the planner to route a query to one
     * shard.
     *
     * @return the value, or empty if none or several values were found
     */
    public Optional<Literal> partitionValue() {
        return Optional.ofNullable(partitionValue);
    }

    @Override
    public String toString() {
        return "PruningResult(shards=" + shardIds() +
            (partitionValue == null ? "" : ", partitionValue=" + partitionValue.toSQL()) + ")";
    }
}
