package com.toydb.executor.operator;

import com.toydb.executor.Operator;
import com.toydb.storage.table.Row;
import com.toydb.storage.table.Table;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * ScanOperator - 全表扫描算子
 *
 * 最基础的算子,负责从表中读取所有行数据。
 * 作为算子树的叶子节点,为上层算子提供数据源。
 *
 * 设计原则:
 * - "Good taste": 简单直接,没有特殊情况
 * - 快照: 构造时复制行列表,扫描期间表被替换也不影响本次查询
 *
 * 性能特点:
 * - O(N)时间复杂度,需要读取所有行
 */
public class ScanOperator implements Operator {

    /** 表对象 */
    private final Table table;

    /** 行数据迭代器 */
    private final Iterator<Row> rowIterator;

    /**
     * 创建全表扫描算子
     *
     * @param table 要扫描的表
     */
    public ScanOperator(Table table) {
        if (table == null) {
            throw new IllegalArgumentException("Table cannot be null");
        }

        this.table = table;

        List<Row> snapshot = new ArrayList<>(table.fullTableScan());
        this.rowIterator = snapshot.iterator();
    }

    @Override
    public boolean hasNext() {
        return rowIterator.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new java.util.NoSuchElementException("No more rows");
        }
        return rowIterator.next();
    }

    public Table getTable() {
        return table;
    }

    @Override
    public String toString() {
        return "ScanOperator{" +
                "table=" + table.getTableName() +
                '}';
    }
}
