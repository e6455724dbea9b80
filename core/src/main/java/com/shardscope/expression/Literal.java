package com.shardscope.expression;

import com.shardscope.types.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are the only operands the shard pruner can reason about. A
 * literal of {@link ArrayType} holds an unmodifiable {@link List} of element
 * values and is the constant operand of a membership test.
 *
 * <p>Examples in SQL:
 * <pre>
 *   42                     -- integer literal
 *   'hello'                -- string literal
 *   DATE '2024-01-15'      -- date literal
 *   ARRAY[1, 2, 3]         -- array literal
 *   NULL                   -- null literal
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        if (value instanceof List<?> list) {
            if (!(dataType instanceof ArrayType)) {
                throw new IllegalArgumentException("List value requires an array type, got: " + dataType);
            }
            this.value = Collections.unmodifiableList(new ArrayList<>(list));
        } else {
            this.value = value;
        }
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    /**
     * Returns whether this is a NULL literal.
     *
     * @return true if value is null, false otherwise
     */
    public boolean isNull() {
        return value == null;
    }

    /**
     * Returns whether this is the boolean constant {@code false}.
     *
     * @return true for a non-null boolean literal holding false
     */
    public boolean isFalse() {
        return dataType instanceof BooleanType && Boolean.FALSE.equals(value);
    }

    /**
     * Returns the elements of an array literal.
     *
     * @return the element values (elements may be null)
     * @throws IllegalStateException if this is not a non-null array literal
     */
    public List<Object> elements() {
        if (!(value instanceof List<?> list)) {
            throw new IllegalStateException("Not an array literal: " + toSQL());
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toSQL() {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof List<?> list) {
            DataType elementType = ((ArrayType) dataType).elementType();
            return list.stream()
                .map(element -> new Literal(element, elementType).toSQL())
                .collect(Collectors.joining(", ", "ARRAY[", "]"));
        }
        if (dataType instanceof StringType) {
            return SQLText.quoteLiteral(value.toString());
        }
        if (dataType instanceof BooleanType) {
            return value.toString().toUpperCase();
        }
        if (dataType instanceof DateType) {
            return "DATE '" + value + "'";
        }
        if (dataType instanceof TimestampType) {
            return "TIMESTAMP '" + value.toString().replace("T", " ") + "'";
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    /**
     * Converts this constant to another type the way an implicit cast would.
     *
     * <p>Integral values convert to decimal and floating point types, and
     * decimal and floating point values convert to each other. A constant
     * already in the target's ordering family is only retyped, which keeps
     * integral values of any width unchanged. Array literals convert element
     * by element; NULL stays NULL.
     *
     * @param targetType the type to convert to
     * @return the converted literal, or empty if the conversion is not supported
     */
    public Optional<Literal> coerceTo(DataType targetType) {
        Objects.requireNonNull(targetType, "targetType must not be null");
        if (value == null) {
            return Optional.of(new Literal(null, targetType));
        }
        if (value instanceof List<?> list) {
            if (!(targetType instanceof ArrayType arrayType)) {
                return Optional.empty();
            }
            List<Object> converted = new ArrayList<>(list.size());
            for (Object element : list) {
                Object coerced = element == null ? null : coerceValue(element, arrayType.elementType());
                if (element != null && coerced == null) {
                    return Optional.empty();
                }
                converted.add(coerced);
            }
            return Optional.of(new Literal(converted, targetType));
        }
        Object coerced = coerceValue(value, targetType);
        return coerced == null ? Optional.empty() : Optional.of(new Literal(coerced, targetType));
    }

    private Object coerceValue(Object element, DataType targetType) {
        OrderingFamily target = targetType.orderingFamily();
        if (element instanceof Byte || element instanceof Short ||
            element instanceof Integer || element instanceof Long) {
            long integral = ((Number) element).longValue();
            return switch (target) {
                case INTEGER -> element;
                case NUMERIC -> BigDecimal.valueOf(integral);
                case FLOAT -> floating(integral, targetType);
                default -> null;
            };
        }
        if (element instanceof BigDecimal decimal) {
            return switch (target) {
                case NUMERIC -> decimal;
                case FLOAT -> floating(decimal.doubleValue(), targetType);
                default -> null;
            };
        }
        if (element instanceof Float || element instanceof Double) {
            double number = ((Number) element).doubleValue();
            return switch (target) {
                case FLOAT -> floating(number, targetType);
                case NUMERIC -> Double.isFinite(number) ? BigDecimal.valueOf(number) : null;
                default -> null;
            };
        }
        OrderingFamily source = dataType instanceof ArrayType arrayType
            ? arrayType.elementType().orderingFamily()
            : dataType.orderingFamily();
        return source == target ? element : null;
    }

    private static Object floating(double value, DataType targetType) {
        if (targetType instanceof FloatType) {
            return (float) value;
        }
        return value;
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    public static Literal of(BigDecimal value) {
        return new Literal(value, new DecimalType(38, Math.max(0, Math.min(value.scale(), 38))));
    }

    public static Literal of(LocalDate value) {
        return new Literal(value, DateType.get());
    }

    /**
     * Creates an array literal.
     *
     * @param elementType the element type
     * @param elements the element values (may contain nulls)
     * @return the array literal
     */
    public static Literal array(DataType elementType, List<?> elements) {
        return new Literal(Objects.requireNonNull(elements, "elements must not be null"),
            new ArrayType(elementType));
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the NULL literal expression
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }
}
