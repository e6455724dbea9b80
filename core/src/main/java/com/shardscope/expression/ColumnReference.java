package com.shardscope.expression;

import com.shardscope.types.DataType;
import com.shardscope.types.IntegerType;

import java.util.Objects;

/**
 * Expression representing a reference to a column of a table in the query.
 *
 * <p>The qualifier identifies which occurrence of a table in the query the
 * column belongs to (the table alias, or the table name when no alias is
 * used). Two references denote the same column only when both the name and
 * the qualifier match, which is what the pruner relies on when it looks for
 * restrictions on the partition column.
 *
 * <p>One column name is reserved: {@link #HASHED_COLUMN_NAME} stands for the
 * partition column's hash token. The planner emits restrictions on it when it
 * already knows which hash range, and therefore which shard, a query targets.
 */
public final class ColumnReference implements Expression {

    /** Reserved name of the pre-hashed partition column. */
    public static final String HASHED_COLUMN_NAME = "__shard_hash";

    private final String columnName;
    private final String qualifier;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a column reference with a qualifier.
     *
     * @param columnName the column name
     * @param qualifier the table or alias qualifier (may be null)
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     */
    public ColumnReference(String columnName, String qualifier, DataType dataType, boolean nullable) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.qualifier = qualifier;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    /**
     * Creates a nullable column reference without a qualifier.
     *
     * @param columnName the column name
     * @param dataType the data type of the column
     */
    public ColumnReference(String columnName, DataType dataType) {
        this(columnName, null, dataType, true);
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the qualifier (table or alias).
     *
     * @return the qualifier, or null if not qualified
     */
    public String qualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    /**
     * Returns whether this is a reference to the reserved pre-hashed column.
     *
     * @return true if the column name is {@link #HASHED_COLUMN_NAME}
     */
    public boolean isHashedPartitionColumn() {
        return HASHED_COLUMN_NAME.equals(columnName);
    }

    /**
     * Returns whether this reference and {@code other} denote the same column
     * of the same table occurrence. Type and nullability are not compared.
     *
     * @param other the other reference
     * @return true if name and qualifier are equal
     */
    public boolean refersToSameColumn(ColumnReference other) {
        return other != null &&
               columnName.equals(other.columnName) &&
               Objects.equals(qualifier, other.qualifier);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toSQL() {
        if (qualifier != null) {
            return SQLText.quoteIdentifierIfNeeded(qualifier) + "." +
                   SQLText.quoteIdentifierIfNeeded(columnName);
        }
        return SQLText.quoteIdentifierIfNeeded(columnName);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return nullable == that.nullable &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier, dataType, nullable);
    }

    // ==================== Factory Methods ====================

    public static ColumnReference of(String columnName, DataType dataType) {
        return new ColumnReference(columnName, dataType);
    }

    public static ColumnReference qualified(String qualifier, String columnName, DataType dataType) {
        return new ColumnReference(columnName, qualifier, dataType, true);
    }

    /**
     * Creates a reference to the reserved pre-hashed partition column of the
     * table occurrence identified by {@code qualifier}.
     *
     * @param qualifier the table or alias qualifier (may be null)
     * @return the column reference, typed as a 32-bit hash token
     */
    public static ColumnReference hashedPartitionColumn(String qualifier) {
        return new ColumnReference(HASHED_COLUMN_NAME, qualifier, IntegerType.get(), false);
    }
}
