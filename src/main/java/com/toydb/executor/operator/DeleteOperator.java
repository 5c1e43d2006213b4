package com.toydb.executor.operator;

import com.toydb.executor.Operator;
import com.toydb.executor.PredicateEvaluator;
import com.toydb.parser.predicate.Predicate;
import com.toydb.storage.table.Row;
import com.toydb.storage.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * DeleteOperator - DELETE删除算子
 *
 * 负责执行DELETE语句,删除表中符合WHERE条件的数据行。
 *
 * 算法:
 * 1. 全表扫描,对每一行求值WHERE条件
 * 2. 收集不满足条件的行(保持原有相对顺序)
 * 3. 用收集到的行整体替换表内容
 *
 * 注意: 先完成所有求值,再一次性替换,求值失败时表保持原样。
 *
 * 注意事项:
 * - 没有WHERE子句会删除所有行!
 * - 删除操作不可逆
 */
public class DeleteOperator implements Operator {

    /** 表对象 */
    private final Table table;

    /** WHERE条件(为空表示删除所有行) */
    private final Predicate whereClause;

    /** 谓词求值器 */
    private final PredicateEvaluator evaluator;

    /** 是否已执行 */
    private boolean executed = false;

    /** 受影响的行数 */
    private int affectedRows = 0;

    /**
     * 创建DELETE算子
     *
     * @param table 表对象
     * @param whereClause WHERE条件(为null表示删除所有行)
     * @param evaluator 谓词求值器
     */
    public DeleteOperator(Table table,
                          Predicate whereClause,
                          PredicateEvaluator evaluator) {
        if (table == null) {
            throw new IllegalArgumentException("Table cannot be null");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("PredicateEvaluator cannot be null");
        }

        this.table = table;
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
                "DeleteOperator does not support iteration. Use execute() instead."
        );
    }

    /**
     * 执行DELETE操作
     *
     * @return 受影响的行数
     */
    public int execute() {
        if (executed) {
            throw new IllegalStateException("DeleteOperator can only be executed once");
        }

        executed = true;

        List<Row> allRows = table.fullTableScan();
        List<Row> survivors = new ArrayList<>();

        for (Row row : allRows) {
            boolean matches = whereClause == null || evaluator.evaluate(whereClause, row);
            if (!matches) {
                survivors.add(row);
            }
        }

        affectedRows = allRows.size() - survivors.size();
        table.replaceRows(survivors);

        return affectedRows;
    }

    public int getAffectedRows() {
        if (!executed) {
            throw new IllegalStateException("DeleteOperator has not been executed yet");
        }
        return affectedRows;
    }

    public Table getTable() {
        return table;
    }

    @Override
    public String toString() {
        return "DeleteOperator{" +
                "table=" + table.getTableName() +
                ", whereClause=" + (whereClause != null ? whereClause : "absent") +
                '}';
    }
}
