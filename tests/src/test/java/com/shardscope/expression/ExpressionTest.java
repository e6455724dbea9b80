package com.shardscope.expression;

import com.shardscope.test.TestBase;
import com.shardscope.test.TestCategories;
import com.shardscope.types.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the expression model handed to the pruner.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Expression Tests")
public class ExpressionTest extends TestBase {

    private static final ColumnReference ID = ColumnReference.qualified("o", "id", LongType.get());

    // ==================== Literal Tests ====================

    @Nested
    @DisplayName("Literal Tests")
    class LiteralTests {

        @Test
        @DisplayName("Integer literal creates correct SQL")
        void testIntegerLiteral() {
            Literal literal = Literal.of(42);

            assertThat(literal.value()).isEqualTo(42);
            assertThat(literal.dataType()).isInstanceOf(IntegerType.class);
            assertThat(literal.nullable()).isFalse();
            assertThat(literal.toSQL()).isEqualTo("42");
        }

        @Test
        @DisplayName("String literal escapes quotes")
        void testStringLiteral() {
            assertThat(Literal.of("it's").toSQL()).isEqualTo("'it''s'");
        }

        @Test
        @DisplayName("Date and decimal literals")
        void testDateAndDecimal() {
            assertThat(Literal.of(LocalDate.of(2024, 1, 15)).toSQL()).isEqualTo("DATE '2024-01-15'");
            Literal decimal = Literal.of(new BigDecimal("12.50"));
            assertThat(decimal.dataType()).isEqualTo(new DecimalType(38, 2));
            assertThat(decimal.dataType().orderingFamily()).isEqualTo(OrderingFamily.NUMERIC);
        }

        @Test
        @DisplayName("NULL literal is null and nullable")
        void testNullLiteral() {
            Literal literal = Literal.nullValue(LongType.get());

            assertThat(literal.isNull()).isTrue();
            assertThat(literal.nullable()).isTrue();
            assertThat(literal.toSQL()).isEqualTo("NULL");
        }

        @Test
        @DisplayName("Only boolean false is a false literal")
        void testIsFalse() {
            assertThat(Literal.of(false).isFalse()).isTrue();
            assertThat(Literal.of(true).isFalse()).isFalse();
            assertThat(Literal.nullValue(BooleanType.get()).isFalse()).isFalse();
            assertThat(Literal.of(0).isFalse()).isFalse();
        }

        @Test
        @DisplayName("Array literal keeps elements including NULL")
        void testArrayLiteral() {
            Literal array = Literal.array(LongType.get(), Arrays.asList(1L, null, 3L));

            assertThat(array.dataType()).isEqualTo(new ArrayType(LongType.get()));
            assertThat(array.elements()).containsExactly(1L, null, 3L);
            assertThat(array.toSQL()).isEqualTo("ARRAY[1, NULL, 3]");
            assertThatThrownBy(() -> Literal.of(1).elements())
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("List value requires an array type")
        void testListRequiresArrayType() {
            assertThatThrownBy(() -> new Literal(List.of(1), IntegerType.get()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("array type");
        }

        @Test
        @DisplayName("Coercion converts numbers across families")
        void testCoerceNumbers() {
            DecimalType decimal = new DecimalType(10, 0);

            assertThat(Literal.of(5).coerceTo(decimal)).contains(new Literal(BigDecimal.valueOf(5), decimal));
            assertThat(Literal.of(5L).coerceTo(DoubleType.get())).contains(Literal.of(5.0));
            assertThat(Literal.of(2L).coerceTo(FloatType.get())).contains(new Literal(2.0f, FloatType.get()));
            assertThat(Literal.of(2.5).coerceTo(decimal)).contains(new Literal(new BigDecimal("2.5"), decimal));
            assertThat(Literal.of(5).coerceTo(LongType.get())).contains(new Literal(5, LongType.get()));
            assertThat(Literal.nullValue(IntegerType.get()).coerceTo(decimal)).contains(Literal.nullValue(decimal));
        }

        @Test
        @DisplayName("Coercion rejects conversions an implicit cast cannot make")
        void testCoerceUnsupported() {
            assertThat(Literal.of("5").coerceTo(new DecimalType(10, 0))).isEmpty();
            assertThat(Literal.of(new BigDecimal("5.5")).coerceTo(IntegerType.get())).isEmpty();
            assertThat(Literal.of(Double.NaN).coerceTo(new DecimalType(10, 0))).isEmpty();
            assertThat(Literal.of(5).coerceTo(new ArrayType(IntegerType.get()))).isEmpty();
        }

        @Test
        @DisplayName("Array coercion converts every element")
        void testCoerceArray() {
            Literal array = Literal.array(IntegerType.get(), Arrays.asList(1, null, 3));

            assertThat(array.coerceTo(new ArrayType(DoubleType.get())))
                .hasValueSatisfying(coerced -> assertThat(coerced.elements()).containsExactly(1.0, null, 3.0));
            assertThat(array.coerceTo(DoubleType.get())).isEmpty();
        }
    }

    // ==================== Column Reference Tests ====================

    @Nested
    @DisplayName("Column Reference Tests")
    class ColumnReferenceTests {

        @Test
        @DisplayName("Same name and qualifier refer to the same column")
        void testRefersToSameColumn() {
            ColumnReference sameColumnOtherType = ColumnReference.qualified("o", "id", IntegerType.get());

            assertThat(ID.refersToSameColumn(sameColumnOtherType)).isTrue();
            assertThat(ID.refersToSameColumn(ColumnReference.qualified("p", "id", LongType.get()))).isFalse();
            assertThat(ID.refersToSameColumn(ColumnReference.of("id", LongType.get()))).isFalse();
            assertThat(ID.refersToSameColumn(null)).isFalse();
        }

        @Test
        @DisplayName("Reserved identifiers are quoted")
        void testQuoting() {
            assertThat(ID.toSQL()).isEqualTo("o.id");
            assertThat(ColumnReference.of("order", LongType.get()).toSQL()).isEqualTo("\"order\"");
            assertThat(ColumnReference.of("my col", LongType.get()).toSQL()).isEqualTo("\"my col\"");
        }

        @Test
        @DisplayName("Pre-hashed column is an integer hash token")
        void testHashedColumn() {
            ColumnReference hashed = ColumnReference.hashedPartitionColumn("o");

            assertThat(hashed.isHashedPartitionColumn()).isTrue();
            assertThat(hashed.dataType()).isEqualTo(IntegerType.get());
            assertThat(hashed.nullable()).isFalse();
            assertThat(ID.isHashedPartitionColumn()).isFalse();
        }
    }

    // ==================== Operator Tests ====================

    @Nested
    @DisplayName("Operator Tests")
    class OperatorTests {

        @ParameterizedTest(name = "{0} commutes to {1}")
        @CsvSource({
            "EQUAL, EQUAL",
            "NOT_EQUAL, NOT_EQUAL",
            "LESS_THAN, GREATER_THAN",
            "LESS_THAN_OR_EQUAL, GREATER_THAN_OR_EQUAL",
            "GREATER_THAN, LESS_THAN",
            "GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL"
        })
        @DisplayName("Comparison operators commute")
        void testCommute(BinaryExpression.Operator operator, BinaryExpression.Operator commuted) {
            assertThat(operator.commute()).isEqualTo(commuted);
            assertThat(operator.commute().commute()).isEqualTo(operator);
        }

        @Test
        @DisplayName("Logical operators cannot be commuted as comparisons")
        void testCommuteLogical() {
            assertThatThrownBy(BinaryExpression.Operator.AND::commute)
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Comparisons and logical operators are boolean")
        void testDataTypes() {
            assertThat(BinaryExpression.lessThan(ID, Literal.of(5L)).dataType()).isEqualTo(BooleanType.get());
            assertThat(BinaryExpression.add(ID, Literal.of(5L)).dataType()).isEqualTo(LongType.get());
            assertThat(BinaryExpression.or(ID, Literal.of(5L)).dataType()).isEqualTo(BooleanType.get());
            assertThat(BinaryExpression.Operator.OR.isLogical()).isTrue();
            assertThat(BinaryExpression.Operator.ADD.isLogical()).isFalse();
            assertThat(BinaryExpression.and(Literal.of(true), Literal.of(false)).toSQL())
                .isEqualTo("(TRUE AND FALSE)");
        }
    }

    // ==================== Membership Tests ====================

    @Nested
    @DisplayName("Membership Tests")
    class MembershipTests {

        @Test
        @DisplayName("IN list of literals rewrites to = ANY(array)")
        void testInAsArrayComparison() {
            InExpression in = new InExpression(ID, List.of(Literal.of(1L), Literal.of(2L)));

            ArrayComparison rewritten = in.asArrayComparison();

            assertThat(rewritten).isNotNull();
            assertThat(rewritten.isAny()).isTrue();
            assertThat(rewritten.operator()).isEqualTo(BinaryExpression.Operator.EQUAL);
            assertThat(rewritten.toSQL()).isEqualTo("(o.id = ANY(ARRAY[1, 2]))");
        }

        @Test
        @DisplayName("IN list does not rewrite when negated, non-literal or mixed")
        void testInNotRewritten() {
            assertThat(new InExpression(ID, List.of(Literal.of(1L)), true).asArrayComparison()).isNull();
            assertThat(new InExpression(ID, List.of(Literal.of(1L), ID)).asArrayComparison()).isNull();
            assertThat(new InExpression(ID, List.of(Literal.of(1L), Literal.of("x"))).asArrayComparison()).isNull();
        }

        @Test
        @DisplayName("IN list keeps NULL elements")
        void testInWithNull() {
            InExpression in = new InExpression(ID, List.of(Literal.nullValue(LongType.get()), Literal.of(7L)));

            assertThat(((Literal) in.asArrayComparison().array()).elements()).containsExactly(null, 7L);
        }

        @Test
        @DisplayName("Empty IN list is rejected")
        void testEmptyIn() {
            assertThatThrownBy(() -> new InExpression(ID, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Array comparison requires a comparison operator")
        void testArrayComparisonOperator() {
            Literal array = Literal.array(LongType.get(), List.of(1L));

            assertThat(ArrayComparison.all(ID, BinaryExpression.Operator.LESS_THAN, array).toSQL())
                .isEqualTo("(o.id < ALL(ARRAY[1]))");
            assertThatThrownBy(() -> ArrayComparison.any(ID, BinaryExpression.Operator.ADD, array))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ==================== Cast Tests ====================

    @Nested
    @DisplayName("Cast Tests")
    class CastTests {

        @Test
        @DisplayName("Implicit casts are stripped, explicit casts are kept")
        void testStripImplicitCasts() {
            Expression nested = CastExpression.implicit(CastExpression.implicit(ID, LongType.get()), LongType.get());
            CastExpression explicit = new CastExpression(ID, StringType.get());

            assertThat(CastExpression.stripImplicitCasts(nested)).isSameAs(ID);
            assertThat(CastExpression.stripImplicitCasts(explicit)).isSameAs(explicit);
            assertThat(explicit.toSQL()).isEqualTo("CAST(o.id AS STRING)");
            assertThat(nested.toSQL()).isEqualTo("o.id");
        }

        @Test
        @DisplayName("Unary expressions render with their operator")
        void testUnary() {
            assertThat(UnaryExpression.not(BinaryExpression.equal(ID, Literal.of(1L))).toSQL())
                .isEqualTo("(NOT (o.id = 1))");
            assertThat(UnaryExpression.isNull(ID).toSQL()).isEqualTo("(o.id IS NULL)");
        }
    }
    // ==================== Type Tests ====================

    @Nested
    @DisplayName("Ordering families")
    class TypeTests {

        @Test
        @DisplayName("Integral widths share one family")
        void testIntegralFamily() {
            assertThat(List.of(ByteType.get(), ShortType.get(), IntegerType.get(), LongType.get()))
                .extracting(DataType::orderingFamily)
                .containsOnly(OrderingFamily.INTEGER);
            assertThat(List.of(ByteType.get(), ShortType.get(), IntegerType.get(), LongType.get()))
                .extracting(DataType::typeName)
                .containsExactly("byte", "short", "integer", "long");
        }

        @Test
        @DisplayName("Other types map to their own families")
        void testOtherFamilies() {
            assertThat(FloatType.get().orderingFamily()).isEqualTo(DoubleType.get().orderingFamily());
            assertThat(DateType.get().orderingFamily()).isEqualTo(TimestampType.get().orderingFamily());
            assertThat(BinaryType.get().orderingFamily()).isEqualTo(OrderingFamily.BYTEA);
            assertThat(StringType.get().orderingFamily().familyName()).isEqualTo("text_ops");
            assertThat(BooleanType.get().orderingFamily()).isNotEqualTo(OrderingFamily.INTEGER);
            assertThat(OrderingFamily.NONE.isOrdered()).isFalse();
        }
    }
}
