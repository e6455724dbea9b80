package com.shardscope.metadata;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * A named comparison function supplied by the metadata cache.
 *
 * <p>Returns a negative number, zero, or a positive number as {@code left}
 * is less than, equal to, or greater than {@code right}. A {@code null}
 * result signals inconsistent metadata; callers treat it as fatal.
 */
public interface PartitionComparator {

    /**
     * Returns the function's name, used in diagnostics.
     *
     * @return the name
     */
    String name();

    /**
     * Compares two non-null partition values.
     *
     * @param left the left value
     * @param right the right value
     * @return the comparison result, or null if the function could not compare
     */
    Integer compare(Object left, Object right);

    /**
     * Wraps a function as a named comparator.
     *
     * @param name the function name
     * @param function the comparison function
     * @return the comparator
     */
    static PartitionComparator of(String name, BiFunction<Object, Object, Integer> function) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(function, "function must not be null");
        return new PartitionComparator() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Integer compare(Object left, Object right) {
                return function.apply(left, right);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
