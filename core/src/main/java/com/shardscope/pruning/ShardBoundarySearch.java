package com.shardscope.pruning;

import com.shardscope.metadata.ShardInterval;

import java.util.Comparator;
import java.util.List;

/**
 * Binary search over a sorted, non-overlapping array of fully initialized
 * shard intervals.
 *
 * <p>The comparator is always called as {@code compare(value, boundary)}.
 * Because the intervals do not overlap, both their minimum and maximum
 * values are ascending, which is what every search relies on.
 */
public final class ShardBoundarySearch {

    /** Returned when no interval qualifies. */
    public static final int INVALID_SHARD_INDEX = -1;

    private ShardBoundarySearch() {}

    /**
     * Finds the first interval that can hold a value greater than (or equal
     * to) {@code value}. A value between two intervals resolves to the
     * interval above it.
     *
     * @param value the lower bound
     * @param intervals the sorted intervals
     * @param comparator compares a value against a boundary
     * @param includeMax true for {@code >=}: an interval whose maximum equals the value qualifies
     * @return the index, or {@link #INVALID_SHARD_INDEX} if the value is above every interval
     */
    public static int lowerShardBoundary(Object value, List<ShardInterval> intervals,
                                         Comparator<Object> comparator, boolean includeMax) {
        int low = 0;
        int high = intervals.size();
        while (low < high) {
            int middle = (low + high) >>> 1;
            int cmp = comparator.compare(value, intervals.get(middle).maxValue());
            boolean qualifies = includeMax ? cmp <= 0 : cmp < 0;
            if (qualifies) {
                high = middle;
            } else {
                low = middle + 1;
            }
        }
        return low < intervals.size() ? low : INVALID_SHARD_INDEX;
    }

    /**
     * Finds the last interval that can hold a value less than (or equal to)
     * {@code value}. A value between two intervals resolves to the interval
     * below it.
     *
     * @param value the upper bound
     * @param intervals the sorted intervals
     * @param comparator compares a value against a boundary
     * @param includeMin true for {@code <=}: an interval whose minimum equals the value qualifies
     * @return the index, or {@link #INVALID_SHARD_INDEX} if the value is below every interval
     */
    public static int upperShardBoundary(Object value, List<ShardInterval> intervals,
                                         Comparator<Object> comparator, boolean includeMin) {
        int low = 0;
        int high = intervals.size();
        while (low < high) {
            int middle = (low + high) >>> 1;
            int cmp = comparator.compare(value, intervals.get(middle).minValue());
            boolean qualifies = includeMin ? cmp >= 0 : cmp > 0;
            if (qualifies) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        return low - 1;
    }

    /**
     * Finds the interval containing {@code value}.
     *
     * @param value the value
     * @param intervals the sorted intervals
     * @param comparator compares a value against a boundary
     * @return the index, or {@link #INVALID_SHARD_INDEX} if no interval contains the value
     */
    public static int findShardIntervalIndex(Object value, List<ShardInterval> intervals,
                                             Comparator<Object> comparator) {
        int low = 0;
        int high = intervals.size() - 1;
        while (low <= high) {
            int middle = (low + high) >>> 1;
            ShardInterval interval = intervals.get(middle);
            if (comparator.compare(value, interval.minValue()) < 0) {
                high = middle - 1;
            } else if (comparator.compare(value, interval.maxValue()) > 0) {
                low = middle + 1;
            } else {
                return middle;
            }
        }
        return INVALID_SHARD_INDEX;
    }
}
