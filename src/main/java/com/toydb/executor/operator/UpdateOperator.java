package com.toydb.executor.operator;

import com.toydb.executor.Operator;
import com.toydb.executor.PredicateEvaluator;
import com.toydb.parser.predicate.Predicate;
import com.toydb.storage.table.Row;
import com.toydb.storage.table.Table;

import java.util.Map;

/**
 * UpdateOperator - UPDATE更新算子
 *
 * 负责执行UPDATE语句,原地更新表中符合WHERE条件的数据行。
 *
 * 核心功能:
 * 1. 全表扫描: 按表中顺序遍历所有行
 * 2. WHERE条件过滤: 没有WHERE时所有行都更新
 * 3. 原地赋值: row.setValue(),列不存在时新增该列
 * 4. 返回影响行数
 *
 * 数据流:
 * Table.fullTableScan() → WHERE过滤 → row.setValue() → 影响行数
 *
 * 注意事项:
 * - 没有WHERE子句会更新所有行!
 * - 不支持事务: 扫描中途某行缺少WHERE引用的列时抛RowKeyException,
 *   之前已更新的行保持已更新状态,不回滚
 */
public class UpdateOperator implements Operator {

    /** 表对象 */
    private final Table table;

    /** 更新映射(列名 → 新值文本) */
    private final Map<String, String> assignments;

    /** WHERE条件(为null表示更新所有行) */
    private final Predicate whereClause;

    /** 谓词求值器 */
    private final PredicateEvaluator evaluator;

    /** 是否已执行 */
    private boolean executed = false;

    /** 受影响的行数 */
    private int affectedRows = 0;

    /**
     * 创建UPDATE算子
     *
     * @param table 表对象
     * @param assignments 更新映射(列名 → 新值文本)
     * @param whereClause WHERE条件(为null表示更新所有行)
     * @param evaluator 谓词求值器
     */
    public UpdateOperator(Table table,
                          Map<String, String> assignments,
                          Predicate whereClause,
                          PredicateEvaluator evaluator) {
        if (table == null) {
            throw new IllegalArgumentException("Table cannot be null");
        }
        if (assignments == null || assignments.isEmpty()) {
            throw new IllegalArgumentException("Assignments cannot be null or empty");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("PredicateEvaluator cannot be null");
        }

        this.table = table;
        this.assignments = assignments;
        this.whereClause = whereClause;
        this.evaluator = evaluator;
    }

    @Override
    public boolean hasNext() {
        return false;
    }

    @Override
    public Row next() {
        throw new UnsupportedOperationException(
                "UpdateOperator does not support iteration. Use execute() instead."
        );
    }

    /**
     * 执行UPDATE操作
     *
     * @return 受影响的行数
     */
    public int execute() {
        if (executed) {
            throw new IllegalStateException("UpdateOperator can only be executed once");
        }

        executed = true;
        affectedRows = 0;

        for (Row row : table.fullTableScan()) {
            if (whereClause != null && !evaluator.evaluate(whereClause, row)) {
                continue;
            }

            for (Map.Entry<String, String> assignment : assignments.entrySet()) {
                row.setValue(assignment.getKey(), assignment.getValue());
            }
            affectedRows++;
        }

        return affectedRows;
    }

    public int getAffectedRows() {
        if (!executed) {
            throw new IllegalStateException("UpdateOperator has not been executed yet");
        }
        return affectedRows;
    }

    public Table getTable() {
        return table;
    }

    @Override
    public String toString() {
        return "UpdateOperator{" +
                "table=" + table.getTableName() +
                ", assignments=" + assignments.keySet() +
                ", whereClause=" + (whereClause != null ? whereClause : "absent") +
                '}';
    }
}
