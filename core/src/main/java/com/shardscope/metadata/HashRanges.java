package com.shardscope.metadata;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the shard intervals of a hash-distributed table.
 *
 * <p>The 32-bit hash token space is split into {@code shardCount} equally
 * sized, contiguous ranges; the last range absorbs the remainder so that the
 * intervals cover every token exactly once.
 */
public final class HashRanges {

    /** Number of distinct hash tokens. */
    public static final long HASH_TOKEN_COUNT = 1L << 32;

    private HashRanges() {}

    /**
     * Creates uniformly split hash intervals, sorted by token.
     *
     * @param relationName the distributed table
     * @param firstShardId shard id of the first interval; ids are consecutive
     * @param shardCount the number of shards
     * @return the sorted intervals with {@link Integer} boundaries
     */
    public static List<ShardInterval> uniform(String relationName, long firstShardId, int shardCount) {
        Preconditions.checkArgument(shardCount > 0, "shardCount must be positive, got: %s", shardCount);

        long increment = HASH_TOKEN_COUNT / shardCount;
        List<ShardInterval> intervals = new ArrayList<>(shardCount);
        for (int index = 0; index < shardCount; index++) {
            long min = Integer.MIN_VALUE + index * increment;
            long max = index == shardCount - 1 ? Integer.MAX_VALUE : min + increment - 1;
            intervals.add(new ShardInterval(firstShardId + index, relationName, (int) min, (int) max));
        }
        return intervals;
    }
}
