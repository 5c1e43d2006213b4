package com.toydb.executor;

import com.toydb.executor.operator.DeleteOperator;
import com.toydb.parser.predicate.ComparisonOperator;
import com.toydb.parser.predicate.Predicate;
import com.toydb.storage.table.Row;
import com.toydb.storage.table.RowKeyException;
import com.toydb.storage.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.toydb.executor.OperatorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DELETE 算子测试")
class DeleteOperatorTest {

    private final PredicateEvaluator evaluator = new PredicateEvaluator();

    private Table table;

    @BeforeEach
    void setUp() {
        table = usersTable();
    }

    @Test
    @DisplayName("删除匹配的行,剩余行保持相对顺序")
    void testDeleteWithWhere() {
        DeleteOperator delete = new DeleteOperator(table,
                new Predicate("age", ComparisonOperator.EQUAL, "25"), evaluator);

        assertEquals(2, delete.execute());
        assertEquals(2, delete.getAffectedRows());
        assertEquals(List.of("1", "3"), column(table.fullTableScan(), "id"));
    }

    @Test
    @DisplayName("没有WHERE时删除所有行")
    void testDeleteAll() {
        assertEquals(4, new DeleteOperator(table, null, evaluator).execute());

        assertTrue(table.isEmpty());
    }

    @Test
    @DisplayName("没有匹配的行时表不变")
    void testDeleteNoMatch() {
        assertEquals(0, new DeleteOperator(table,
                new Predicate("id", ComparisonOperator.EQUAL, "42"), evaluator).execute());

        assertEquals(4, table.getRowCount());
    }

    @Test
    @DisplayName("求值失败时一行都不删除")
    void testDeleteIsAllOrNothing() {
        table.insertRow(Row.of(List.of("id"), List.of("5")));
        DeleteOperator delete = new DeleteOperator(table,
                new Predicate("age", ComparisonOperator.LESS_THAN, "30"), evaluator);

        assertThrows(RowKeyException.class, delete::execute);

        assertEquals(5, table.getRowCount());
    }
}
