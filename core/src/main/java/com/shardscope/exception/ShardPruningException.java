package com.shardscope.exception;

/**
 * Exception thrown when shard pruning cannot proceed because the partition
 * metadata of a table is corrupt or inconsistent.
 *
 * <p>This is never caused by the predicates of a query: predicates the
 * pruner does not understand only widen the result. It is raised when a
 * function the metadata cache is supposed to supply is missing, or when such
 * a function fails to produce a result.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       PruningResult result = pruner.prune(table, "o", predicates);
 *   } catch (ShardPruningException e) {
 *       log.error(e.getUserMessage());
 *       log.error("Failed function: " + e.getFailedFunction());
 *   }
 * </pre>
 *
 * @see com.shardscope.pruning.ShardPruner
 */
public class ShardPruningException extends RuntimeException {

    /**
     * What went wrong with the metadata.
     */
    public enum Reason {
        /** A comparator or hash function is not defined for the table. */
        MISSING_FUNCTION,
        /** A comparator returned no result. */
        NULL_RESULT
    }

    private final Reason reason;
    private final String failedFunction;
    private final String relationName;

    /**
     * Creates a shard pruning exception.
     *
     * @param message the error message
     * @param reason what went wrong
     * @param failedFunction the name of the function that is missing or failed
     * @param relationName the distributed table being pruned
     */
    public ShardPruningException(String message, Reason reason, String failedFunction,
                                 String relationName) {
        super(message);
        this.reason = reason;
        this.failedFunction = failedFunction;
        this.relationName = relationName;
    }

    /**
     * Creates the exception raised when the metadata of {@code relationName}
     * lacks a required function.
     *
     * @param relationName the distributed table
     * @param functionRole the role of the missing function, e.g. "shard interval comparator"
     * @return the exception
     */
    public static ShardPruningException missingFunction(String relationName, String functionRole) {
        return new ShardPruningException(
            "could not find " + functionRole + " for relation \"" + relationName + "\"",
            Reason.MISSING_FUNCTION, functionRole, relationName);
    }

    /**
     * Creates the exception raised when a comparator returned {@code null}.
     *
     * @param relationName the distributed table
     * @param functionName the comparator's name
     * @return the exception
     */
    public static ShardPruningException nullResult(String relationName, String functionName) {
        return new ShardPruningException(
            "function " + functionName + " returned NULL",
            Reason.NULL_RESULT, functionName, relationName);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the name of the function that is missing or failed.
     *
     * @return the function name or role
     */
    public String getFailedFunction() {
        return failedFunction;
    }

    /**
     * Returns the distributed table whose metadata is inconsistent.
     *
     * @return the relation name, or null if not known
     */
    public String getRelationName() {
        return relationName;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String table = relationName == null ? "the table" : "table '" + relationName + "'";
        return switch (reason) {
            case MISSING_FUNCTION -> "Partition metadata of " + table + " has no " + failedFunction +
                ". Check that the partition column type has a default ordering.";
            case NULL_RESULT -> "Comparison function " + failedFunction + " failed while pruning shards of " +
                table + ". The shard metadata may be corrupt.";
        };
    }
}
