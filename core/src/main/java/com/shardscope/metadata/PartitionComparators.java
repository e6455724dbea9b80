package com.shardscope.metadata;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * Built-in comparators for the value types the pruner understands.
 */
public final class PartitionComparators {

    private static final PartitionComparator NATURAL =
        PartitionComparator.of("natural_cmp", PartitionComparators::compareNatural);

    private PartitionComparators() {}

    /**
     * Returns a comparator using the natural order of the values.
     *
     * <p>Numbers of different classes are compared by value (so an
     * {@code Integer} column compares correctly against a {@code Long} or
     * {@code BigDecimal} constant), byte arrays compare unsigned
     * lexicographically, and other {@link Comparable} values use
     * {@code compareTo}. Values that cannot be compared yield {@code null}.
     *
     * @return the natural comparator
     */
    public static PartitionComparator natural() {
        return NATURAL;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Integer compareNatural(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r);
        }
        if (left instanceof byte[] l && right instanceof byte[] r) {
            return Arrays.compareUnsigned(l, r);
        }
        if (left instanceof Comparable comparable && left.getClass().isInstance(right)) {
            return Integer.signum(comparable.compareTo(right));
        }
        return null;
    }

    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        if ((left instanceof Double || left instanceof Float) &&
            (right instanceof Double || right instanceof Float)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Integer || value instanceof Long ||
               value instanceof Short || value instanceof Byte;
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (isIntegral(value)) {
            return BigDecimal.valueOf(value.longValue());
        }
        return BigDecimal.valueOf(value.doubleValue());
    }
}
