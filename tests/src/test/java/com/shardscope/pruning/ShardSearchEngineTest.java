package com.shardscope.pruning;

import com.shardscope.expression.ArrayComparison;
import com.shardscope.expression.ColumnReference;
import com.shardscope.expression.Expression;
import com.shardscope.expression.InExpression;
import com.shardscope.expression.Literal;
import com.shardscope.metadata.DistributedTableMetadata;
import com.shardscope.metadata.PartitionHashFunction;
import com.shardscope.metadata.PartitionMethod;
import com.shardscope.metadata.ShardInterval;
import com.shardscope.test.TestBase;
import com.shardscope.test.TestCategories;
import com.shardscope.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static com.shardscope.expression.BinaryExpression.*;
import static com.shardscope.test.ShardFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for strategy selection in the search engine. The range table has
 * shards [0,99] [100,199] [200,299] [300,399].
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ShardSearchEngine Tests")
public class ShardSearchEngineTest extends TestBase {

    private List<Long> search(DistributedTableMetadata table, Expression... predicates) {
        ColumnReference hashed = table.partitionMethod() == PartitionMethod.HASH
            ? ColumnReference.hashedPartitionColumn(ALIAS) : null;
        PruneNode normalized = new PredicateNormalizer(new ConstraintClassifier(id(), hashed))
            .normalize(List.of(predicates));
        PruningContext context = new PruningContext(table);
        List<PruningInstance> instances = new ConstraintAccumulator(context).accumulate(normalized);
        assertThat(instances).hasSize(1);
        return new ShardSearchEngine(context).search(instances.get(0)).stream()
            .map(ShardInterval::shardId)
            .toList();
    }

    private static Literal value(long value) {
        return Literal.of(value);
    }

    @Nested
    @DisplayName("Range-distributed table")
    class RangeTableTests {

        private final DistributedTableMetadata table = rangeTable(4);

        @Test
        @DisplayName("Equality selects the containing shard")
        void testEquality() {
            assertThat(search(table, equal(id(), value(150)))).isEqualTo(shards(1));
            assertThat(search(table, equal(id(), value(400)))).isEmpty();
        }

        @Test
        @DisplayName("Equality candidate is checked against range bounds")
        void testEqualityCandidateFiltered() {
            assertThat(search(table, equal(id(), value(150)), greaterThan(id(), value(199)))).isEmpty();
            assertThat(search(table, equal(id(), value(150)), greaterThan(id(), value(120)))).isEqualTo(shards(1));
        }

        @Test
        @DisplayName("Membership unions the containing shards")
        void testMembership() {
            Expression in = new InExpression(id(), List.of(value(5), value(250), value(1000), value(7)));

            assertThat(search(table, in)).isEqualTo(shards(0, 2));
        }

        @Test
        @DisplayName("Membership missing every shard is empty")
        void testMembershipMisses() {
            Expression in = new InExpression(id(), List.of(value(1000), value(-5)));

            assertThat(search(table, in)).isEmpty();
        }

        @Test
        @DisplayName("All-NULL membership is empty")
        void testAllNullMembership() {
            Expression any = ArrayComparison.any(id(), Operator.EQUAL,
                Literal.array(LongType.get(), Arrays.asList(null, null)));

            assertThat(search(table, any)).isEmpty();
        }

        @Test
        @DisplayName("Range bounds select the covering index range")
        void testRange() {
            assertThat(search(table, greaterThanOrEqual(id(), value(150)), lessThan(id(), value(300))))
                .isEqualTo(shards(1, 2));
            assertThat(search(table, greaterThan(id(), value(99)))).isEqualTo(shards(1, 2, 3));
            assertThat(search(table, lessThanOrEqual(id(), value(100)))).isEqualTo(shards(0, 1));
            assertThat(search(table, lessThan(id(), value(100)))).isEqualTo(shards(0));
        }

        @Test
        @DisplayName("Strict and inclusive bounds combine to the tighter one")
        void testCombinedBounds() {
            assertThat(search(table, greaterThanOrEqual(id(), value(150)), greaterThan(id(), value(250))))
                .isEqualTo(shards(2, 3));
            assertThat(search(table, greaterThanOrEqual(id(), value(200)), greaterThan(id(), value(199))))
                .isEqualTo(shards(2, 3));
            assertThat(search(table, lessThan(id(), value(300)), lessThanOrEqual(id(), value(299))))
                .isEqualTo(shards(0, 1, 2));
        }

        @Test
        @DisplayName("Out-of-range and empty ranges select nothing")
        void testEmptyRanges() {
            assertThat(search(table, greaterThan(id(), value(399)))).isEmpty();
            assertThat(search(table, lessThan(id(), value(0)))).isEmpty();
            assertThat(search(table, greaterThan(id(), value(250)), lessThan(id(), value(150)))).isEmpty();
        }

        @Test
        @DisplayName("Always-false and unconstrained instances")
        void testSpecialInstances() {
            assertThat(search(table, equal(id(), value(1)), equal(id(), value(2)))).isEmpty();
            assertThat(search(table, notEqual(id(), value(1)))).isEqualTo(shards(0, 1, 2, 3));
        }
    }

    @Nested
    @DisplayName("Overlapping and uninitialized intervals")
    class ExhaustiveTests {

        @Test
        @DisplayName("Overlapping intervals are scanned")
        void testOverlapping() {
            DistributedTableMetadata table = appendTable(
                intervals(range(0L, 150L), range(100L, 250L), range(300L, null)));

            assertThat(search(table, equal(id(), value(120)))).isEqualTo(shards(0, 1));
            assertThat(search(table, greaterThan(id(), value(260)))).isEqualTo(shards(2));
            assertThat(search(table, lessThanOrEqual(id(), value(100)))).isEqualTo(shards(0, 1));
        }

        @Test
        @DisplayName("Shards with unknown boundaries are kept")
        void testUnknownBoundaries() {
            DistributedTableMetadata table = appendTable(
                intervals(range(0L, 99L), range(null, null), range(200L, null)));

            assertThat(search(table, equal(id(), value(150))))
                .containsExactlyInAnyOrder(shard(1));
            assertThat(search(table, greaterThan(id(), value(1000))))
                .containsExactlyInAnyOrder(shard(1), shard(2));
        }

        @Test
        @DisplayName("Membership excludes a shard only if every value is outside")
        void testMembershipScan() {
            DistributedTableMetadata table = appendTable(
                intervals(range(0L, 99L), range(50L, 149L), range(200L, 299L)));

            Expression in = new InExpression(id(), List.of(value(10), value(120)));

            assertThat(search(table, in)).isEqualTo(shards(0, 1));
        }
    }

    @Nested
    @DisplayName("Hash-distributed table")
    class HashTableTests {

        private final DistributedTableMetadata table = hashTable(4);
        private final Comparator<Object> comparator = new PruningContext(table).boundaryComparator();

        private int shardIndexOf(long value) {
            int token = PartitionHashFunction.murmur3().hash(value);
            return ShardBoundarySearch.findShardIntervalIndex(token, table.sortedShardIntervals(), comparator);
        }

        @Test
        @DisplayName("Equality selects the shard owning the value's hash")
        void testEquality() {
            assertThat(search(table, equal(id(), value(42)))).isEqualTo(shards(shardIndexOf(42)));
        }

        @Test
        @DisplayName("Membership selects the shards owning each hash")
        void testMembership() {
            List<Long> expected = java.util.stream.LongStream.of(1, 2, 3)
                .mapToInt(this::shardIndexOf)
                .distinct()
                .sorted()
                .mapToObj(index -> shard(index))
                .toList();

            assertThat(search(table, new InExpression(id(), List.of(value(3), value(1), value(2)))))
                .isEqualTo(expected);
        }

        @Test
        @DisplayName("Range bounds do not prune hashed shards")
        void testRangeIgnored() {
            assertThat(search(table, greaterThan(id(), value(42)))).hasSize(4);
        }

        @Test
        @DisplayName("Pre-hashed token selects its shard")
        void testPreHashed() {
            ColumnReference hashed = ColumnReference.hashedPartitionColumn(ALIAS);

            assertThat(search(table, greaterThanOrEqual(hashed, Literal.of(0)))).isEqualTo(shards(2));
            assertThat(search(table, equal(hashed, Literal.of(Integer.MIN_VALUE)))).isEqualTo(shards(0));
        }

        @Test
        @DisplayName("Pre-hashed token must agree with the equality shard")
        void testPreHashedWithEquality() {
            ColumnReference hashed = ColumnReference.hashedPartitionColumn(ALIAS);
            int index = shardIndexOf(42);
            int agreeing = (Integer) table.sortedShardIntervals().get(index).minValue();
            int disagreeing = (Integer) table.sortedShardIntervals().get((index + 1) % 4).minValue();

            assertThat(search(table, equal(id(), value(42)), equal(hashed, Literal.of(agreeing))))
                .isEqualTo(shards(index));
            assertThat(search(table, equal(id(), value(42)), equal(hashed, Literal.of(disagreeing))))
                .isEmpty();
        }
    }
}
