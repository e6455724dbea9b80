package com.shardscope.metadata;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Maps a partition column value to the 32-bit hash token that decides which
 * shard of a hash-distributed table owns the row.
 */
public interface PartitionHashFunction {

    /**
     * Returns the function's name, used in diagnostics.
     *
     * @return the name
     */
    String name();

    /**
     * Hashes a non-null partition value.
     *
     * @param value the partition value
     * @return the hash token
     * @throws IllegalArgumentException if the value cannot be hashed
     */
    int hash(Object value);

    /**
     * Wraps a function as a named hash function.
     *
     * @param name the function name
     * @param function the hash function
     * @return the hash function
     */
    static PartitionHashFunction of(String name, ToIntFunction<Object> function) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(function, "function must not be null");
        return new PartitionHashFunction() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int hash(Object value) {
                return function.applyAsInt(value);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    /**
     * Returns the default hash function, 32-bit murmur3.
     *
     * <p>Integral values hash by their 64-bit value, so the same number hashes
     * identically whatever its width. Decimals hash by their normalized text,
     * values of other types by their string form.
     *
     * @return the murmur3 partition hash
     */
    static PartitionHashFunction murmur3() {
        HashFunction murmur = Hashing.murmur3_32_fixed();
        return of("murmur3_32", value -> {
            if (value instanceof Integer || value instanceof Long ||
                value instanceof Short || value instanceof Byte) {
                return murmur.hashLong(((Number) value).longValue()).asInt();
            }
            if (value instanceof String text) {
                return murmur.hashString(text, StandardCharsets.UTF_8).asInt();
            }
            if (value instanceof BigDecimal decimal) {
                return murmur.hashString(decimal.stripTrailingZeros().toPlainString(),
                    StandardCharsets.UTF_8).asInt();
            }
            if (value instanceof Double || value instanceof Float) {
                return murmur.hashLong(Double.doubleToLongBits(((Number) value).doubleValue())).asInt();
            }
            if (value instanceof LocalDate date) {
                return murmur.hashLong(date.toEpochDay()).asInt();
            }
            if (value instanceof Boolean flag) {
                return murmur.hashInt(flag ? 1 : 0).asInt();
            }
            if (value instanceof byte[] bytes) {
                return murmur.hashBytes(bytes).asInt();
            }
            if (value == null) {
                throw new IllegalArgumentException("Cannot hash a NULL partition value");
            }
            return murmur.hashString(value.toString(), StandardCharsets.UTF_8).asInt();
        });
    }
}
