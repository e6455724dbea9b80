package com.shardscope.pruning;

import com.shardscope.expression.ArrayComparison;
import com.shardscope.expression.BinaryExpression;
import com.shardscope.expression.BinaryExpression.Operator;
import com.shardscope.expression.CastExpression;
import com.shardscope.expression.ColumnReference;
import com.shardscope.expression.Expression;
import com.shardscope.expression.FunctionCall;
import com.shardscope.expression.InExpression;
import com.shardscope.expression.Literal;
import com.shardscope.expression.UnaryExpression;
import com.shardscope.metadata.DistributedTableMetadata;
import com.shardscope.metadata.PartitionComparators;
import com.shardscope.metadata.PartitionHashFunction;
import com.shardscope.metadata.PartitionMethod;
import com.shardscope.metadata.ShardInterval;
import com.shardscope.test.PredicateEvaluator;
import com.shardscope.test.TestBase;
import com.shardscope.test.TestCategories;
import com.shardscope.types.ArrayType;
import com.shardscope.types.BooleanType;
import com.shardscope.types.DataType;
import com.shardscope.types.DecimalType;
import com.shardscope.types.DoubleType;
import com.shardscope.types.IntegerType;
import com.shardscope.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.LongFunction;
import java.util.stream.Stream;

import static com.shardscope.test.ShardFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Randomized checks that pruning never drops a shard holding a matching row.
 */
@TestCategories.Tier2
@TestCategories.Property
@DisplayName("ShardPruner Property Tests")
public class ShardPrunerPropertyTest extends TestBase {

    private static final long SEED = 20240611L;
    private static final int PREDICATE_SETS = 400;
    private static final int ROWS = 60;
    private static final long LOW = -30;
    private static final long HIGH = 430;

    private static final Operator[] COMPARISONS = {
        Operator.EQUAL, Operator.NOT_EQUAL, Operator.LESS_THAN,
        Operator.LESS_THAN_OR_EQUAL, Operator.GREATER_THAN, Operator.GREATER_THAN_OR_EQUAL
    };

    private Random random;

    /** The partition column the generated predicates restrict. */
    private ColumnReference key;

    /** Type the generated constants are implicitly cast to, null for plain long constants. */
    private DataType castType;

    /** Maps a generated number to the value a row stores in the partition column. */
    private LongFunction<Object> rowValue;

    @Override
    protected void doSetUp() {
        random = new Random(SEED);
        key = id();
        castType = null;
        rowValue = number -> number;
    }

    static Stream<Arguments> castColumnTypes() {
        return Stream.of(
            Arguments.of(new DecimalType(12, 0), (LongFunction<Object>) BigDecimal::valueOf),
            Arguments.of(DoubleType.get(), (LongFunction<Object>) number -> (double) number));
    }

    private void useCastColumn(DataType columnType, LongFunction<Object> toRowValue) {
        key = ColumnReference.qualified(ALIAS, "key", columnType);
        castType = columnType;
        rowValue = toRowValue;
    }

    /** A row and the shard that stores it. */
    private record Row(long shardId, Map<String, Object> values) {}

    // ==================== Soundness ====================

    @Test
    @DisplayName("Range table with gaps keeps every matching row's shard")
    void testRangeTableSoundness() {
        DistributedTableMetadata table = rangeTable(gappedIntervals());
        assertSound(table, placedRows(table), new ShardPruner());
    }

    @Test
    @DisplayName("Append table with overlapping and unknown boundaries keeps every matching row's shard")
    void testAppendTableSoundness() {
        DistributedTableMetadata table = appendTable(
            intervals(range(0L, 150L), range(100L, 250L), range(300L, null), range(null, null)));
        assertSound(table, placedRows(table), new ShardPruner());
    }

    @Test
    @DisplayName("Hash table keeps every matching row's shard")
    void testHashTableSoundness() {
        DistributedTableMetadata table = hashTable(8);
        assertSound(table, hashedRows(table), new ShardPruner());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("castColumnTypes")
    @DisplayName("Hash table with implicitly cast constants keeps every matching row's shard")
    void testCastConstantHashSoundness(DataType columnType, LongFunction<Object> toRowValue) {
        useCastColumn(columnType, toRowValue);
        DistributedTableMetadata table =
            DistributedTableMetadata.hashDistributed(RELATION, "key", columnType, FIRST_SHARD_ID, 8);

        assertSound(table, hashedRows(table), new ShardPruner());
    }

    @Test
    @DisplayName("Decimal range table with implicitly cast constants keeps every matching row's shard")
    void testCastConstantRangeSoundness() {
        DecimalType decimal = new DecimalType(12, 0);
        useCastColumn(decimal, BigDecimal::valueOf);
        List<ShardInterval> intervals = new ArrayList<>();
        for (ShardInterval interval : gappedIntervals()) {
            intervals.add(new ShardInterval(interval.shardId(), RELATION,
                BigDecimal.valueOf((Long) interval.minValue()), BigDecimal.valueOf((Long) interval.maxValue())));
        }
        DistributedTableMetadata table = DistributedTableMetadata.builder(RELATION)
            .partitionMethod(PartitionMethod.RANGE)
            .partitionColumn("key", decimal)
            .comparators(PartitionComparators.natural())
            .shardIntervals(intervals)
            .build();

        assertSound(table, placedRows(table), new ShardPruner());
    }

    @Test
    @DisplayName("A small branch bound stays sound")
    void testSmallBranchBound() {
        DistributedTableMetadata table = rangeTable(gappedIntervals());
        assertSound(table, placedRows(table), new ShardPruner(16));
    }

    // ==================== Overlap equivalence ====================

    @Test
    @DisplayName("Exhaustive scan selects the same shards as binary search")
    void testOverlappingEquivalence() {
        DistributedTableMetadata sorted = rangeTable(gappedIntervals());
        DistributedTableMetadata scanned = DistributedTableMetadata.builder(RELATION)
            .partitionMethod(PartitionMethod.RANGE)
            .partitionColumn("id", LongType.get())
            .comparators(PartitionComparators.natural())
            .shardIntervals(gappedIntervals())
            .overlapping(true)
            .build();
        assertThat(sorted.hasOverlappingShardInterval()).isFalse();
        ShardPruner pruner = new ShardPruner();

        for (int round = 0; round < PREDICATE_SETS; round++) {
            List<Expression> predicates = predicates();

            assertThat(pruner.prune(scanned, ALIAS, predicates).shardIds())
                .as("shards for %s", predicates)
                .containsExactlyInAnyOrderElementsOf(pruner.prune(sorted, ALIAS, predicates).shardIds());
        }
    }

    // ==================== Helpers ====================

    private void assertSound(DistributedTableMetadata table, List<Row> rows, ShardPruner pruner) {
        logStep("Pruning " + PREDICATE_SETS + " predicate sets over " + rows.size() + " rows of " + table);
        int matched = 0;
        for (int round = 0; round < PREDICATE_SETS; round++) {
            List<Expression> predicates = predicates();
            List<Long> selected = pruner.prune(table, ALIAS, predicates).shardIds();

            for (Row row : rows) {
                if (PredicateEvaluator.matches(predicates, row.values())) {
                    matched++;
                    assertThat(selected)
                        .as("row %s matching %s", row.values(), predicates)
                        .contains(row.shardId());
                }
            }
        }
        assertThat(matched).isPositive();
    }

    private static List<ShardInterval> gappedIntervals() {
        return intervals(range(0L, 99L), range(100L, 149L), range(200L, 299L), range(300L, 399L));
    }

    /** Places rows in random shards with ids inside the shard's boundaries. */
    private List<Row> placedRows(DistributedTableMetadata table) {
        List<ShardInterval> intervals = table.sortedShardIntervals();
        List<Row> rows = new ArrayList<>();
        for (int index = 0; index < ROWS; index++) {
            ShardInterval interval = intervals.get(random.nextInt(intervals.size()));
            long min = interval.minValueExists() ? ((Number) interval.minValue()).longValue() : LOW;
            long max = interval.maxValueExists() ? ((Number) interval.maxValue()).longValue() : HIGH;
            rows.add(new Row(interval.shardId(), rowValues(between(min, max))));
        }
        return rows;
    }

    /** Places rows in the shard owning the hash of their partition value. */
    private List<Row> hashedRows(DistributedTableMetadata table) {
        PartitionHashFunction hash = table.hashFunction();
        List<Row> rows = new ArrayList<>();
        for (int index = 0; index < ROWS; index++) {
            long number = between(LOW, HIGH);
            rows.add(new Row(owningShard(table, hash.hash(rowValue.apply(number))), rowValues(number)));
        }
        return rows;
    }

    private static long owningShard(DistributedTableMetadata table, int token) {
        for (ShardInterval interval : table.sortedShardIntervals()) {
            if ((Integer) interval.minValue() <= token && token <= (Integer) interval.maxValue()) {
                return interval.shardId();
            }
        }
        throw new IllegalStateException("No shard owns token " + token);
    }

    private Map<String, Object> rowValues(long number) {
        Map<String, Object> values = new HashMap<>();
        values.put(key.columnName(), rowValue.apply(number));
        values.put("amount", random.nextInt(10) == 0 ? null : between(LOW, HIGH));
        return values;
    }

    private long between(long min, long max) {
        return min + (long) random.nextInt((int) (max - min + 1));
    }

    private List<Expression> predicates() {
        List<Expression> predicates = new ArrayList<>();
        int count = 1 + random.nextInt(3);
        for (int index = 0; index < count; index++) {
            predicates.add(tree(3));
        }
        return predicates;
    }

    private Expression tree(int depth) {
        if (depth == 0 || random.nextInt(3) == 0) {
            return atom();
        }
        return switch (random.nextInt(5)) {
            case 0, 1 -> BinaryExpression.and(tree(depth - 1), tree(depth - 1));
            case 2, 3 -> BinaryExpression.or(tree(depth - 1), tree(depth - 1));
            default -> UnaryExpression.not(tree(depth - 1));
        };
    }

    private Expression atom() {
        Operator operator = COMPARISONS[random.nextInt(COMPARISONS.length)];
        return switch (random.nextInt(10)) {
            case 0, 1 -> new BinaryExpression(key, operator, constant());
            case 2 -> new BinaryExpression(constant(), operator, key);
            case 3 -> new InExpression(key, valueList(), random.nextInt(4) == 0);
            case 4 -> ArrayComparison.any(key, Operator.EQUAL, arrayConstant());
            case 5 -> new FunctionCall("is_even", List.of(key), BooleanType.get());
            case 6 -> new BinaryExpression(amount(), operator, Literal.of(between(LOW, HIGH)));
            case 7 -> new BinaryExpression(key, operator, amount());
            case 8 -> UnaryExpression.isNotNull(key);
            default -> BinaryExpression.equal(key, constant());
        };
    }

    /**
     * A constant for the partition column: a long, or for cast columns either
     * an integer implicitly cast to the column type or a value of that type.
     */
    private Expression constant() {
        long number = between(LOW, HIGH);
        if (castType == null) {
            return Literal.of(number);
        }
        return switch (random.nextInt(3)) {
            case 0 -> CastExpression.implicit(Literal.of((int) number), castType);
            case 1 -> CastExpression.implicit(Literal.of(number), castType);
            default -> new Literal(rowValue.apply(number), castType);
        };
    }

    private Expression arrayConstant() {
        if (castType == null) {
            return Literal.array(LongType.get(), arrayElements());
        }
        List<Integer> elements = new ArrayList<>();
        for (Long element : arrayElements()) {
            elements.add(element == null ? null : element.intValue());
        }
        return CastExpression.implicit(Literal.array(IntegerType.get(), elements), new ArrayType(castType));
    }

    private List<Expression> valueList() {
        List<Expression> values = new ArrayList<>();
        values.add(constant());
        int extra = random.nextInt(4);
        for (int index = 0; index < extra; index++) {
            values.add(random.nextInt(6) == 0 ? Literal.nullValue(key.dataType()) : constant());
        }
        return values;
    }

    private List<Long> arrayElements() {
        List<Long> elements = new ArrayList<>();
        int count = random.nextInt(4);
        for (int index = 0; index < count; index++) {
            elements.add(random.nextInt(6) == 0 ? null : between(LOW, HIGH));
        }
        return elements;
    }
}
