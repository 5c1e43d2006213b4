package com.toydb.storage.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Table - 内存表
 *
 * 一张表就是一个按插入顺序排列的Row列表。
 *
 * 核心功能:
 * 1. 追加行(INSERT)
 * 2. 全表扫描(SELECT/UPDATE/DELETE)
 * 3. 整体替换行列表(DELETE重建)
 *
 * 设计原则:
 * - 建表时声明的列只是元数据,执行时从不参考
 * - 没有索引,所有访问都是O(N)全表扫描
 * - 没有锁,调用方负责串行化访问
 *
 * "实用主义": 不实现主键、类型、约束
 */
public class Table {

    /** 表名 */
    private final String tableName;

    /** 建表时声明的列(仅记录) */
    private final List<String> columns;

    /** 行数据(插入顺序) */
    private List<Row> rows;

    /**
     * 创建空表
     *
     * @param tableName 表名
     * @param columns 声明的列
     */
    public Table(String tableName, List<String> columns) {
        if (tableName == null || tableName.trim().isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        this.tableName = tableName;
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        this.rows = new ArrayList<>();
    }

    /**
     * 追加一行到表尾
     *
     * @param row 行数据
     */
    public void insertRow(Row row) {
        if (row == null) {
            throw new IllegalArgumentException("Row cannot be null");
        }
        rows.add(row);
    }

    /**
     * 全表扫描
     *
     * 返回只读列表,但列表中的Row是表中的实际对象,UPDATE直接修改它们。
     *
     * @return 所有行(插入顺序)
     */
    public List<Row> fullTableScan() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * 用新的行列表替换表内容
     *
     * @param newRows 新的行列表
     */
    public void replaceRows(List<Row> newRows) {
        if (newRows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        this.rows = new ArrayList<>(newRows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int getRowCount() {
        return rows.size();
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return "Table{" +
                "tableName='" + tableName + '\'' +
                ", columns=" + columns +
                ", rowCount=" + rows.size() +
                '}';
    }
}
