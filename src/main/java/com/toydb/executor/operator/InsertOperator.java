package com.toydb.executor.operator;

import com.toydb.executor.ColumnValueMismatchException;
import com.toydb.executor.Operator;
import com.toydb.storage.table.Row;
import com.toydb.storage.table.Table;

import java.util.List;

/**
 * InsertOperator - INSERT插入算子
 *
 * 负责执行INSERT语句,把一行数据追加到表尾。
 *
 * 核心功能:
 * 1. 列数检查: 列名数量必须等于值数量,否则抛ColumnValueMismatchException
 * 2. 按位置配对: columns[i] → values[i]
 * 3. 追加: Table.insertRow()
 *
 * 设计原则:
 * - 先校验再修改: 检查失败时表保持原样
 * - 不校验列名是否在建表声明中(声明只是元数据)
 * - 值保持原始文本,不做类型转换
 *
 * 使用示例:
 * <pre>
 * // INSERT INTO users (id, name) VALUES (1, 'Alice')
 * InsertOperator insertOp = new InsertOperator(table, List.of("id", "name"), List.of("1", "'Alice'"));
 * int affectedRows = insertOp.execute(); // 1
 * </pre>
 */
public class InsertOperator implements Operator {

    /** 表对象 */
    private final Table table;

    /** 列名列表 */
    private final List<String> columnNames;

    /** 值列表(原始文本) */
    private final List<String> values;

    /** 是否已执行 */
    private boolean executed = false;

    /** 受影响的行数 */
    private int affectedRows = 0;

    public InsertOperator(Table table, List<String> columnNames, List<String> values) {
        if (table == null) {
            throw new IllegalArgumentException("Table cannot be null");
        }
        if (columnNames == null || values == null) {
            throw new IllegalArgumentException("Column names and values cannot be null");
        }

        this.table = table;
        this.columnNames = columnNames;
        this.values = values;
    }

    /**
     * INSERT算子不支持迭代模式,调用方应该使用execute()。
     */
    @Override
    public boolean hasNext() {
        return false;
    }

    @Override
    public Row next() {
        throw new UnsupportedOperationException(
                "InsertOperator does not support iteration. Use execute() instead."
        );
    }

    /**
     * 执行INSERT操作
     *
     * @return 受影响的行数(1)
     * @throws ColumnValueMismatchException 列数与值数不一致
     */
    public int execute() {
        if (executed) {
            throw new IllegalStateException("InsertOperator can only be executed once");
        }

        executed = true;

        if (columnNames.size() != values.size()) {
            throw new ColumnValueMismatchException(columnNames.size(), values.size());
        }

        table.insertRow(Row.of(columnNames, values));
        affectedRows = 1;

        return affectedRows;
    }

    public int getAffectedRows() {
        if (!executed) {
            throw new IllegalStateException("InsertOperator has not been executed yet");
        }
        return affectedRows;
    }

    public Table getTable() {
        return table;
    }

    @Override
    public String toString() {
        return "InsertOperator{" +
                "table=" + table.getTableName() +
                ", columnNames=" + columnNames +
                '}';
    }
}
