package com.toydb.executor.operator;

import com.toydb.executor.Operator;
import com.toydb.storage.table.Row;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * SortOperator - ORDER BY排序算子
 *
 * 阻塞算子: 第一次hasNext()时拉取子算子的全部行,按指定列的文本值升序排序。
 *
 * 排序规则:
 * - 字典序(String.compareTo),不做数字转换
 * - 稳定排序(List.sort),值相同的行保持原有相对顺序
 * - 只排序查询结果,不改变表中存储的顺序
 * - 某行缺少排序列时抛RowKeyException
 */
public class SortOperator implements Operator {

    /** 子算子(数据源) */
    private final Operator child;

    /** 排序列 */
    private final String orderColumn;

    /** 排序后的迭代器(首次hasNext()时构建) */
    private Iterator<Row> sortedIterator;

    public SortOperator(Operator child, String orderColumn) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        if (orderColumn == null) {
            throw new IllegalArgumentException("Order column cannot be null");
        }
        this.child = child;
        this.orderColumn = orderColumn;
    }

    @Override
    public boolean hasNext() {
        if (sortedIterator == null) {
            sortedIterator = sortChildRows().iterator();
        }
        return sortedIterator.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new java.util.NoSuchElementException("No more rows");
        }
        return sortedIterator.next();
    }

    private List<Row> sortChildRows() {
        List<Row> rows = new ArrayList<>();
        while (child.hasNext()) {
            rows.add(child.next());
        }
        rows.sort(Comparator.comparing((Row row) -> row.getValue(orderColumn)));
        return rows;
    }

    public String getOrderColumn() {
        return orderColumn;
    }

    @Override
    public String toString() {
        return "SortOperator{" +
                "orderColumn=" + orderColumn +
                ", child=" + child +
                '}';
    }
}
