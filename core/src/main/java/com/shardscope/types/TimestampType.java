package com.shardscope.types;

/**
 * Data type representing an instant with microsecond precision. Values are {@link java.time.Instant} or {@link java.time.LocalDateTime}.
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp";
    }

    @Override
    public OrderingFamily orderingFamily() {
        return OrderingFamily.DATETIME;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
