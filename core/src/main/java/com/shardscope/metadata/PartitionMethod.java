package com.shardscope.metadata;

/**
 * How rows of a distributed table are assigned to shards.
 */
public enum PartitionMethod {
    /** Reference table: a single shard replicated everywhere, no partition column. */
    NONE('n'),
    /** Shards own disjoint ranges of the partition column's hash token. */
    HASH('h'),
    /** Shards own disjoint ranges of the partition column's value. */
    RANGE('r'),
    /** Shards are appended over time; their value ranges may overlap. */
    APPEND('a');

    private final char code;

    PartitionMethod(char code) {
        this.code = code;
    }

    /**
     * Returns the single-character code used in catalog metadata.
     *
     * @return the method code
     */
    public char code() {
        return code;
    }

    /**
     * Parses a catalog method code.
     *
     * @param code one of {@code n}, {@code h}, {@code r}, {@code a}
     * @return the partition method
     * @throws IllegalArgumentException if the code is not recognized
     */
    public static PartitionMethod fromCode(char code) {
        for (PartitionMethod method : values()) {
            if (method.code == code) {
                return method;
            }
        }
        throw new IllegalArgumentException(
            "Unknown partition method code: '%s'. Valid values: n, h, r, a".formatted(code));
    }
}
