package com.shardscope.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide switch for verbose shard pruning traces.
 *
 * <p>When enabled, the pruner logs the predicate tree after every
 * normalization pass and the strategy chosen for every AND-branch. The
 * switch never changes pruning results.
 *
 * <p>Initialized from the system property {@value #PROPERTY_NAME}; can be
 * changed at runtime via {@link #configure(boolean)}.
 */
public final class PruningDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(PruningDiagnostics.class);

    /** System property read at class initialization. */
    public static final String PROPERTY_NAME = "shardscope.log_shard_pruning";

    private static volatile boolean logShardPruning = initialValue();

    public static void configure(boolean enabled) {
        logShardPruning = enabled;
    }

    public static boolean isLogShardPruning() {
        return logShardPruning;
    }

    /**
     * Parse a boolean setting (case-insensitive).
     *
     * @param value "true", "on", "yes", "1", or "false", "off", "no", "0"
     * @return the parsed value; false for null
     * @throws IllegalArgumentException if value is not recognized
     */
    public static boolean parse(String value) {
        if (value == null) {
            return false;
        }
        return switch (value.trim().toLowerCase()) {
            case "true", "on", "yes", "1" -> true;
            case "false", "off", "no", "0", "" -> false;
            default -> throw new IllegalArgumentException(
                "Unknown value for %s: '%s'. Valid values: true, false, on, off, yes, no, 1, 0"
                    .formatted(PROPERTY_NAME, value));
        };
    }

    private static boolean initialValue() {
        String property = System.getProperty(PROPERTY_NAME);
        try {
            return parse(property);
        } catch (IllegalArgumentException e) {
            logger.warn("{}; shard pruning traces stay disabled", e.getMessage());
            return false;
        }
    }

    /**
     * Reset to the system property's value. Intended for tests only.
     */
    static void reset() {
        logShardPruning = initialValue();
    }

    private PruningDiagnostics() {}
}
