package com.toydb.result;

import com.toydb.parser.Statement.StatementType;
import com.toydb.storage.table.Row;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * QueryResult - 语句执行结果
 *
 * SELECT: 结果行(副本,修改不影响表)
 * INSERT/UPDATE/DELETE: 受影响的行数,没有结果行
 *
 * 设计原则:
 * - "Good taste": 简单的数据容器,没有复杂逻辑
 * - 不可变性: 创建后不可修改
 */
public class QueryResult {

    /** 语句类型 */
    private final StatementType statementType;

    /** 行数据(非查询语句为空) */
    private final List<Row> rows;

    /** 受影响的行数(查询语句为0) */
    private final int affectedRows;

    private QueryResult(StatementType statementType, List<Row> rows, int affectedRows) {
        this.statementType = statementType;
        this.rows = List.copyOf(rows);
        this.affectedRows = affectedRows;
    }

    /**
     * 查询结果
     *
     * @param rows 结果行
     */
    public static QueryResult ofRows(List<Row> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        return new QueryResult(StatementType.SELECT, rows, 0);
    }

    /**
     * 修改语句结果
     *
     * @param statementType INSERT/UPDATE/DELETE
     * @param affectedRows 受影响的行数
     */
    public static QueryResult ofAffectedRows(StatementType statementType, int affectedRows) {
        if (statementType == StatementType.SELECT) {
            throw new IllegalArgumentException("SELECT produces rows, not an affected-row count");
        }
        return new QueryResult(statementType, List.of(), affectedRows);
    }

    /**
     * 是否为查询结果(有结果行)
     */
    public boolean isQuery() {
        return statementType == StatementType.SELECT;
    }

    public StatementType getStatementType() {
        return statementType;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getAffectedRows() {
        return affectedRows;
    }

    /**
     * 结果中出现过的列名(按首次出现顺序)
     *
     * 各行的列集合可能不同,这里取并集。
     */
    public List<String> getColumnNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Row row : rows) {
            names.addAll(row.getColumnNames());
        }
        return new ArrayList<>(names);
    }

    @Override
    public String toString() {
        if (!isQuery()) {
            return statementType + " OK, " + affectedRows + " row(s) affected";
        }
        return rows.size() + " row(s) in set " + rows;
    }
}
