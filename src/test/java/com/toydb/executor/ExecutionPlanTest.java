package com.toydb.executor;

import com.toydb.executor.operator.DeleteOperator;
import com.toydb.executor.operator.FilterOperator;
import com.toydb.executor.operator.InsertOperator;
import com.toydb.executor.operator.ProjectOperator;
import com.toydb.executor.operator.ScanOperator;
import com.toydb.executor.operator.SortOperator;
import com.toydb.executor.operator.UpdateOperator;
import com.toydb.parser.SQLParser;
import com.toydb.parser.predicate.ComparisonOperator;
import com.toydb.parser.predicate.Predicate;
import com.toydb.storage.StorageEngine;
import com.toydb.storage.TableNotFoundException;
import com.toydb.storage.impl.MemoryStorageEngine;
import com.toydb.storage.table.Row;
import com.toydb.storage.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutionPlanTest - 执行计划构建测试
 *
 * 检查每种语句生成的算子树形状,以及表查找规则。
 */
@DisplayName("执行计划构建测试")
class ExecutionPlanTest {

    private final SQLParser parser = new SQLParser();

    private StorageEngine storageEngine;

    @BeforeEach
    void setUp() {
        storageEngine = new MemoryStorageEngine();
        storageEngine.createTable("users", List.of("id", "name"))
                .insertRow(Row.of(List.of("id", "name"), List.of("1", "'Alice'")));
        storageEngine.createTable("empty", List.of("id"));
    }

    private Operator plan(String sql) {
        return ExecutionPlan.build(parser.parse(sql), storageEngine, true);
    }

    @Test
    @DisplayName("SELECT * 只有扫描")
    void testSelectAllPlan() {
        assertInstanceOf(ScanOperator.class, plan("SELECT * FROM users"));
    }

    @Test
    @DisplayName("SELECT 完整管道: Project ← Sort ← Filter ← Scan")
    void testFullSelectPlan() {
        Operator root = plan("SELECT name, id FROM users WHERE id = 1 ORDER BY name");

        assertInstanceOf(ProjectOperator.class, root);
        assertEquals(List.of("name", "id"), ((ProjectOperator) root).getProjectedColumns());
        assertTrue(root.toString().contains("SortOperator{orderColumn=name"));
        assertTrue(root.toString().contains("FilterOperator"));
    }

    @Test
    @DisplayName("WHERE 生成过滤算子,数据来自全表扫描")
    void testFilterPlan() {
        Operator root = plan("SELECT * FROM users WHERE id = 1");

        assertInstanceOf(FilterOperator.class, root);
        FilterOperator filter = (FilterOperator) root;
        assertEquals(new Predicate("id", ComparisonOperator.EQUAL, "1"), filter.getPredicate());

        assertInstanceOf(ScanOperator.class, filter.getChild());
        assertSame(storageEngine.getTable("users"), ((ScanOperator) filter.getChild()).getTable());
    }

    @Test
    @DisplayName("ORDER BY 生成排序算子")
    void testSortPlan() {
        Operator root = plan("SELECT * FROM users ORDER BY id");

        assertInstanceOf(SortOperator.class, root);
        assertEquals("id", ((SortOperator) root).getOrderColumn());
    }

    @Test
    @DisplayName("修改语句生成对应算子,作用于语句中的表")
    void testModificationPlans() {
        Table users = storageEngine.getTable("users");

        Operator insert = plan("INSERT INTO users (id) VALUES (2)");
        assertInstanceOf(InsertOperator.class, insert);
        assertSame(users, ((InsertOperator) insert).getTable());

        Operator update = plan("UPDATE users SET id = 2");
        assertInstanceOf(UpdateOperator.class, update);
        assertSame(users, ((UpdateOperator) update).getTable());

        Operator delete = plan("DELETE FROM users");
        assertInstanceOf(DeleteOperator.class, delete);
        assertSame(users, ((DeleteOperator) delete).getTable());
    }

    @Test
    @DisplayName("表不存在")
    void testMissingTable() {
        TableNotFoundException e = assertThrows(TableNotFoundException.class,
                () -> plan("SELECT * FROM ghost"));

        assertEquals("ghost", e.getTableName());
    }

    @Test
    @DisplayName("空表: SELECT/UPDATE/DELETE 视为不存在, INSERT 可以")
    void testEmptyTableAsMissing() {
        assertThrows(TableNotFoundException.class, () -> plan("SELECT * FROM empty"));
        assertThrows(TableNotFoundException.class, () -> plan("UPDATE empty SET id = 1"));
        assertThrows(TableNotFoundException.class, () -> plan("DELETE FROM empty"));
        assertInstanceOf(InsertOperator.class, plan("INSERT INTO empty (id) VALUES (1)"));
    }

    @Test
    @DisplayName("关闭空表规则后只检查存在性")
    void testEmptyTableAllowed() {
        Operator root = ExecutionPlan.build(parser.parse("SELECT * FROM empty"), storageEngine, false);

        assertFalse(root.hasNext());
    }
}
