package com.shardscope.runtime;

/**
 * Configuration constants for predicate normalization.
 */
public final class PruningConfig {

    private PruningConfig() {} // Utility class

    /** Default bound on the number of AND-branches produced by distributing ANDs over ORs */
    public static final int DEFAULT_MAX_DISTRIBUTED_BRANCHES = 1024;

    /** Hard upper limit, the distributed tree grows multiplicatively */
    public static final int MAX_DISTRIBUTED_BRANCHES = 65536;

    /** Minimum bound, enough for a handful of two-way ORs */
    public static final int MIN_DISTRIBUTED_BRANCHES = 16;

    /**
     * Validate and normalize the branch bound to be within allowed bounds.
     *
     * @param requested the requested bound
     * @return normalized bound within [MIN_DISTRIBUTED_BRANCHES, MAX_DISTRIBUTED_BRANCHES]
     */
    public static int normalizeMaxBranches(int requested) {
        if (requested <= 0) return DEFAULT_MAX_DISTRIBUTED_BRANCHES;
        if (requested < MIN_DISTRIBUTED_BRANCHES) return MIN_DISTRIBUTED_BRANCHES;
        if (requested > MAX_DISTRIBUTED_BRANCHES) return MAX_DISTRIBUTED_BRANCHES;
        return requested;
    }
}
