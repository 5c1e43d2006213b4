package com.toydb.storage.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row - 行数据
 *
 * Row表示表中的一行数据: 列名 → 文本值的有序映射。
 *
 * 值的存储:
 * - 所有值保持语句中的原始文本,不做类型转换
 * - 'Alice' 的引号原样保留, 30 就是字符串 "30"
 * - 列顺序为插入时的列顺序
 *
 * 设计原则:
 * - 同一张表的各行可以有不同的列集合,不做校验
 * - 读取不存在的列直接抛 {@link RowKeyException},不返回null
 * - UPDATE原地修改,setValue可以新增列
 *
 * "Good taste": 没有schema,也就没有"列不匹配"这种特殊情况
 */
public class Row {

    /** 列名 → 值(保持插入顺序) */
    private final Map<String, String> values;

    /**
     * 创建空行
     */
    public Row() {
        this.values = new LinkedHashMap<>();
    }

    /**
     * 从映射创建行(复制)
     *
     * @param values 列名 → 值
     */
    public Row(Map<String, String> values) {
        if (values == null) {
            throw new IllegalArgumentException("Values cannot be null");
        }
        this.values = new LinkedHashMap<>(values);
    }

    /**
     * 按位置配对列名和值
     *
     * @param columnNames 列名列表
     * @param values 值列表(长度必须与columnNames相同)
     * @return 新行
     */
    public static Row of(List<String> columnNames, List<String> values) {
        if (columnNames == null || values == null) {
            throw new IllegalArgumentException("Column names and values cannot be null");
        }
        if (columnNames.size() != values.size()) {
            throw new IllegalArgumentException(
                    "Column count mismatch: columns=" + columnNames.size() +
                    ", values=" + values.size());
        }

        Row row = new Row();
        for (int i = 0; i < columnNames.size(); i++) {
            row.setValue(columnNames.get(i), values.get(i));
        }
        return row;
    }

    /**
     * 获取列值
     *
     * @param columnName 列名(大小写敏感)
     * @return 列值
     * @throws RowKeyException 行中没有该列
     */
    public String getValue(String columnName) {
        if (!values.containsKey(columnName)) {
            throw new RowKeyException(columnName);
        }
        return values.get(columnName);
    }

    /**
     * 设置列值,列不存在时新增
     */
    public void setValue(String columnName, String value) {
        if (columnName == null) {
            throw new IllegalArgumentException("Column name cannot be null");
        }
        values.put(columnName, value);
    }

    public boolean hasColumn(String columnName) {
        return values.containsKey(columnName);
    }

    /**
     * 获取列名(按插入顺序)
     */
    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(values.keySet()));
    }

    public int getColumnCount() {
        return values.size();
    }

    /**
     * 投影: 只保留指定列,按指定顺序
     *
     * @param columnNames 要保留的列
     * @return 新行
     * @throws RowKeyException 某列在本行中不存在
     */
    public Row project(List<String> columnNames) {
        Row projected = new Row();
        for (String columnName : columnNames) {
            projected.setValue(columnName, getValue(columnName));
        }
        return projected;
    }

    /**
     * 复制行,修改副本不影响原行
     */
    public Row copy() {
        return new Row(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        Row other = (Row) o;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
