package com.toydb.parser.statements;

import com.toydb.parser.Statement;

import java.util.List;

/**
 * InsertStatement - INSERT插入语句
 *
 * 语法示例:
 * <pre>
 * INSERT INTO users (id, name, age) VALUES (1, 'Alice', 30);
 * </pre>
 *
 * 列名与值按位置配对。值是原始文本,引号不去除。
 * 列数与值数是否相等在执行时检查,解析器不检查。
 */
public class InsertStatement implements Statement {

    /** 表名 */
    private final String tableName;

    /** 列名列表 */
    private final List<String> columnNames;

    /** 值列表(原始文本) */
    private final List<String> values;

    public InsertStatement(String tableName, List<String> columnNames, List<String> values) {
        this.tableName = tableName;
        this.columnNames = List.copyOf(columnNames);
        this.values = List.copyOf(values);
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public StatementType getType() {
        return StatementType.INSERT;
    }

    @Override
    public String toString() {
        return "InsertStatement{" +
                "tableName='" + tableName + '\'' +
                ", columnNames=" + columnNames +
                ", values=" + values +
                '}';
    }
}
