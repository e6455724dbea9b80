package com.shardscope.types;

/**
 * Ordering operator families.
 *
 * <p>A family groups the types whose values can be compared with each other
 * by a single set of ordering operators. Integral types of different widths
 * share {@link #INTEGER}; float and double share {@link #FLOAT}; date and
 * timestamp share {@link #DATETIME}. Comparisons across families require an
 * explicit cast and are not interpreted.
 */
public enum OrderingFamily {
    INTEGER("integer_ops"),
    FLOAT("float_ops"),
    NUMERIC("numeric_ops"),
    TEXT("text_ops"),
    DATETIME("datetime_ops"),
    BOOLEAN("bool_ops"),
    BYTEA("bytea_ops"),
    NONE("none");

    private final String familyName;

    OrderingFamily(String familyName) {
        this.familyName = familyName;
    }

    public String familyName() {
        return familyName;
    }

    /**
     * Returns whether values of this family have a total order.
     *
     * @return false only for {@link #NONE}
     */
    public boolean isOrdered() {
        return this != NONE;
    }
}
