package com.shardscope.types;

/**
 * Sealed interface for all data types known to the shard pruner.
 *
 * <p>Types describe partition columns and the constants compared against
 * them. The pruner only needs two things from a type: its name for
 * diagnostics, and the ordering operator family its values belong to.
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Integral and floating types: IntegerType, LongType, DoubleType, etc.</li>
 *   <li>Text and binary types: StringType, BinaryType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Array types, used for membership constants: ArrayType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, DecimalType, StringType,
            DateType, TimestampType, BinaryType, ArrayType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the ordering operator family of this type.
     *
     * <p>Two values can be compared with {@code <}, {@code =}, {@code >} and
     * friends only when their types belong to the same family. Types without
     * a total order return {@link OrderingFamily#NONE}.
     *
     * @return the ordering family, never null
     */
    OrderingFamily orderingFamily();
}
