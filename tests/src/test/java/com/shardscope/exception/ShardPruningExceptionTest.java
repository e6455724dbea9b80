package com.shardscope.exception;

import com.shardscope.test.TestBase;
import com.shardscope.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ShardPruningException Tests")
public class ShardPruningExceptionTest extends TestBase {

    @Test
    @DisplayName("Missing function names the role and relation")
    void testMissingFunction() {
        ShardPruningException e = ShardPruningException.missingFunction("orders", "partition column hash function");

        assertThat(e.getMessage()).isEqualTo("could not find partition column hash function for relation \"orders\"");
        assertThat(e.getReason()).isEqualTo(ShardPruningException.Reason.MISSING_FUNCTION);
        assertThat(e.getFailedFunction()).isEqualTo("partition column hash function");
        assertThat(e.getRelationName()).isEqualTo("orders");
        assertThat(e.getUserMessage())
            .startsWith("Partition metadata of table 'orders' has no partition column hash function.");
    }

    @Test
    @DisplayName("NULL result names the function")
    void testNullResult() {
        ShardPruningException e = ShardPruningException.nullResult(null, "int8_cmp");

        assertThat(e.getMessage()).isEqualTo("function int8_cmp returned NULL");
        assertThat(e.getReason()).isEqualTo(ShardPruningException.Reason.NULL_RESULT);
        assertThat(e.getRelationName()).isNull();
        assertThat(e.getUserMessage()).contains("int8_cmp").contains("the table");
    }
}
