package com.toydb.executor;

import com.toydb.executor.operator.DeleteOperator;
import com.toydb.executor.operator.FilterOperator;
import com.toydb.executor.operator.InsertOperator;
import com.toydb.executor.operator.ProjectOperator;
import com.toydb.executor.operator.ScanOperator;
import com.toydb.executor.operator.SortOperator;
import com.toydb.executor.operator.UpdateOperator;
import com.toydb.parser.Statement;
import com.toydb.parser.statements.DeleteStatement;
import com.toydb.parser.statements.InsertStatement;
import com.toydb.parser.statements.SelectStatement;
import com.toydb.parser.statements.UpdateStatement;
import com.toydb.storage.StorageEngine;
import com.toydb.storage.TableNotFoundException;
import com.toydb.storage.table.Table;

/**
 * ExecutionPlan - 查询执行计划
 *
 * 负责将Parser解析的Statement转换为可执行的Operator树。
 *
 * 核心功能:
 * 1. 构建Operator树: 根据Statement类型生成对应的算子树
 * 2. 表名解析: 将表名解析为Table对象
 * 3. 求值器注入: 为需要WHERE的算子提供PredicateEvaluator
 *
 * 表查找规则:
 * - INSERT: 表存在即可(空表也可以插入)
 * - SELECT/UPDATE/DELETE: emptyTableAsMissing为true时,空表与不存在的表
 *   同样报TableNotFoundException;为false时只检查存在性
 *
 * 数据流:
 * Statement → ExecutionPlan.build() → Operator树 → VolcanoExecutor → QueryResult
 *
 * 使用示例:
 * <pre>
 * Statement stmt = parser.parse("SELECT * FROM users WHERE age > 18");
 * Operator plan = ExecutionPlan.build(stmt, storageEngine, true);
 * </pre>
 */
public class ExecutionPlan {

    /**
     * 根据Statement构建Operator树
     *
     * @param statement SQL语句
     * @param storageEngine 存储引擎
     * @param emptyTableAsMissing SELECT/UPDATE/DELETE是否把空表视为不存在
     * @return Operator树的根节点
     * @throws TableNotFoundException 表不存在
     */
    public static Operator build(Statement statement,
                                 StorageEngine storageEngine,
                                 boolean emptyTableAsMissing) {
        if (statement == null) {
            throw new IllegalArgumentException("Statement cannot be null");
        }

        if (storageEngine == null) {
            throw new IllegalArgumentException("StorageEngine cannot be null");
        }

        // 根据Statement类型分发
        switch (statement.getType()) {
            case SELECT:
                return buildSelectPlan((SelectStatement) statement, storageEngine, emptyTableAsMissing);

            case INSERT:
                return buildInsertPlan((InsertStatement) statement, storageEngine);

            case UPDATE:
                return buildUpdatePlan((UpdateStatement) statement, storageEngine, emptyTableAsMissing);

            case DELETE:
                return buildDeletePlan((DeleteStatement) statement, storageEngine, emptyTableAsMissing);

            default:
                throw new IllegalArgumentException(
                        "Unsupported statement type: " + statement.getType()
                );
        }
    }

    /**
     * 构建SELECT查询计划
     *
     * 执行计划: Scan → Filter(可选) → Sort(可选) → Project(可选)
     *
     * 先过滤再排序最后投影,所以ORDER BY的列不必出现在SELECT列表中。
     */
    private static Operator buildSelectPlan(SelectStatement statement,
                                            StorageEngine storageEngine,
                                            boolean emptyTableAsMissing) {
        Table table = getTable(storageEngine, statement.getTableName(), emptyTableAsMissing);

        Operator current = new ScanOperator(table);

        if (statement.getWhereClause().isPresent()) {
            current = new FilterOperator(current, statement.getWhereClause().get(), new PredicateEvaluator());
        }

        if (statement.getOrderBy().isPresent()) {
            current = new SortOperator(current, statement.getOrderBy().get());
        }

        // SELECT * 不需要ProjectOperator
        if (!statement.isSelectAll()) {
            current = new ProjectOperator(current, statement.getColumns());
        }

        return current;
    }

    /**
     * 构建INSERT插入计划
     */
    private static Operator buildInsertPlan(InsertStatement statement, StorageEngine storageEngine) {
        Table table = getTable(storageEngine, statement.getTableName(), false);

        return new InsertOperator(table, statement.getColumnNames(), statement.getValues());
    }

    /**
     * 构建UPDATE更新计划
     *
     * 执行计划: UpdateOperator(内部使用全表扫描)
     */
    private static Operator buildUpdatePlan(UpdateStatement statement,
                                            StorageEngine storageEngine,
                                            boolean emptyTableAsMissing) {
        Table table = getTable(storageEngine, statement.getTableName(), emptyTableAsMissing);

        return new UpdateOperator(
                table,
                statement.getAssignments(),
                statement.getWhereClause().orElse(null),
                new PredicateEvaluator()
        );
    }

    /**
     * 构建DELETE删除计划
     *
     * 执行计划: DeleteOperator(内部使用全表扫描)
     */
    private static Operator buildDeletePlan(DeleteStatement statement,
                                            StorageEngine storageEngine,
                                            boolean emptyTableAsMissing) {
        Table table = getTable(storageEngine, statement.getTableName(), emptyTableAsMissing);

        return new DeleteOperator(
                table,
                statement.getWhereClause().orElse(null),
                new PredicateEvaluator()
        );
    }

    /**
     * 从StorageEngine获取Table对象
     *
     * @param storageEngine 存储引擎
     * @param tableName 表名
     * @param emptyAsMissing 空表是否视为不存在
     * @return Table对象
     * @throws TableNotFoundException 表不存在(或为空且emptyAsMissing)
     */
    private static Table getTable(StorageEngine storageEngine, String tableName, boolean emptyAsMissing) {
        Table table = storageEngine.getTable(tableName);

        if (table == null || (emptyAsMissing && table.isEmpty())) {
            throw new TableNotFoundException(tableName);
        }

        return table;
    }
}
