package com.shardscope.metadata;

import java.util.Arrays;
import java.util.Objects;

/**
 * The range of partition values (or hash tokens) owned by one shard.
 *
 * <p>A missing boundary is represented as {@code null} and means the shard
 * has no known bound on that side; such a shard can never be excluded by a
 * range test. Boundaries of hash-distributed tables are {@link Integer} hash
 * tokens; all other tables use values of the partition column's type.
 *
 * <p>Instances are immutable; {@link #copy()} still produces a distinct
 * instance, so a pruning result never aliases the metadata cache.
 */
public final class ShardInterval {

    private final long shardId;
    private final String relationName;
    private final Object minValue;
    private final Object maxValue;

    /**
     * Creates a shard interval.
     *
     * @param shardId the shard identifier
     * @param relationName the distributed table the shard belongs to
     * @param minValue the inclusive lower boundary, or null if unknown
     * @param maxValue the inclusive upper boundary, or null if unknown
     */
    public ShardInterval(long shardId, String relationName, Object minValue, Object maxValue) {
        this.shardId = shardId;
        this.relationName = Objects.requireNonNull(relationName, "relationName must not be null");
        this.minValue = copyValue(minValue);
        this.maxValue = copyValue(maxValue);
    }

    public long shardId() {
        return shardId;
    }

    public String relationName() {
        return relationName;
    }

    public Object minValue() {
        return minValue;
    }

    public Object maxValue() {
        return maxValue;
    }

    public boolean minValueExists() {
        return minValue != null;
    }

    public boolean maxValueExists() {
        return maxValue != null;
    }

    /**
     * Returns whether both boundaries are known.
     *
     * @return true if min and max exist
     */
    public boolean isInitialized() {
        return minValue != null && maxValue != null;
    }

    /**
     * Returns an independent copy of this interval.
     *
     * @return the copy
     */
    public ShardInterval copy() {
        return new ShardInterval(shardId, relationName, minValue, maxValue);
    }

    private static Object copyValue(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ShardInterval)) return false;
        ShardInterval that = (ShardInterval) obj;
        return shardId == that.shardId &&
               relationName.equals(that.relationName) &&
               Objects.deepEquals(minValue, that.minValue) &&
               Objects.deepEquals(maxValue, that.maxValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shardId, relationName);
    }

    @Override
    public String toString() {
        return "ShardInterval(" + relationName + "_" + shardId + ", [" +
            render(minValue) + ", " + render(maxValue) + "])";
    }

    private static String render(Object value) {
        if (value == null) {
            return "unbounded";
        }
        if (value instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        }
        return value.toString();
    }
}
