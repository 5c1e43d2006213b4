package com.toydb.executor.operator;

import com.toydb.executor.Operator;
import com.toydb.storage.table.Row;

import java.util.List;

/**
 * ProjectOperator - 列投影算子
 *
 * 实现SELECT col1, col2 的列投影: 为每一行创建只包含指定列的新Row,按指定顺序。
 * SELECT * 不经过此算子。
 *
 * 设计原则:
 * - 不可变性: 不修改原始Row,创建新的Row对象
 * - 某行缺少被请求的列时抛RowKeyException,整条查询失败
 *
 * 数据流:
 * 子Operator → Row(全部列) → 提取指定列 → NewRow(投影列)
 */
public class ProjectOperator implements Operator {

    /** 子算子(数据源) */
    private final Operator child;

    /** 投影列 */
    private final List<String> columns;

    /**
     * 创建投影算子
     *
     * @param child 子算子(数据源)
     * @param columns 投影列(按输出顺序)
     */
    public ProjectOperator(Operator child, List<String> columns) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Projected columns cannot be null or empty");
        }

        this.child = child;
        this.columns = List.copyOf(columns);
    }

    @Override
    public boolean hasNext() {
        return child.hasNext();
    }

    @Override
    public Row next() {
        return child.next().project(columns);
    }

    public List<String> getProjectedColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return "ProjectOperator{" +
                "columns=" + columns +
                ", child=" + child +
                '}';
    }
}
