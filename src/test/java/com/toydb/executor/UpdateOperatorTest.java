package com.toydb.executor;

import com.toydb.executor.operator.UpdateOperator;
import com.toydb.parser.predicate.ComparisonOperator;
import com.toydb.parser.predicate.Predicate;
import com.toydb.storage.table.Row;
import com.toydb.storage.table.RowKeyException;
import com.toydb.storage.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.toydb.executor.OperatorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * UpdateOperatorTest - UPDATE算子测试
 *
 * - 带WHERE只修改匹配的行
 * - 无WHERE修改所有行
 * - SET可以新增列
 * - 中途失败时前面的修改保留
 */
@DisplayName("UPDATE 算子测试")
class UpdateOperatorTest {

    private final PredicateEvaluator evaluator = new PredicateEvaluator();

    private Table table;

    @BeforeEach
    void setUp() {
        table = usersTable();
    }

    @Test
    @DisplayName("只修改匹配的行,其他行不变")
    void testUpdateWithWhere() {
        UpdateOperator update = new UpdateOperator(table, Map.of("age", "40"),
                new Predicate("id", ComparisonOperator.EQUAL, "1"), evaluator);

        assertEquals(1, update.execute());

        assertEquals(List.of("40", "25", "35", "25"), column(table.fullTableScan(), "age"));
    }

    @Test
    @DisplayName("没有WHERE时修改所有行")
    void testUpdateAll() {
        Map<String, String> assignments = new LinkedHashMap<>();
        assignments.put("age", "0");
        assignments.put("name", "'x'");

        assertEquals(4, new UpdateOperator(table, assignments, null, evaluator).execute());

        for (Row row : table.fullTableScan()) {
            assertEquals("0", row.getValue("age"));
            assertEquals("'x'", row.getValue("name"));
        }
    }

    @Test
    @DisplayName("SET 不存在的列时新增该列")
    void testUpdateCreatesColumn() {
        new UpdateOperator(table, Map.of("email", "'a@b'"),
                new Predicate("id", ComparisonOperator.EQUAL, "2"), evaluator).execute();

        assertTrue(table.fullTableScan().get(1).hasColumn("email"));
        assertFalse(table.fullTableScan().get(0).hasColumn("email"));
    }

    @Test
    @DisplayName("中途遇到缺列的行失败,前面已修改的行保留")
    void testPartialUpdateOnFailure() {
        table.insertRow(Row.of(List.of("id"), List.of("5")));
        table.insertRow(Row.of(List.of("id", "age"), List.of("6", "50")));
        UpdateOperator update = new UpdateOperator(table, Map.of("name", "'z'"),
                new Predicate("age", ComparisonOperator.GREATER_EQUAL, "30"), evaluator);

        assertThrows(RowKeyException.class, update::execute);

        List<Row> rows = table.fullTableScan();
        assertEquals("'z'", rows.get(0).getValue("name"));
        assertEquals("'z'", rows.get(2).getValue("name"));
        assertFalse(rows.get(5).hasColumn("name"));
    }

    @Test
    @DisplayName("只能执行一次")
    void testExecuteOnce() {
        UpdateOperator update = new UpdateOperator(table, Map.of("age", "1"), null, evaluator);
        update.execute();

        assertThrows(IllegalStateException.class, update::execute);
    }
}
