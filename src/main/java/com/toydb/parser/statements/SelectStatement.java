package com.toydb.parser.statements;

import com.toydb.CommonConstant;
import com.toydb.parser.Statement;
import com.toydb.parser.predicate.Predicate;

import java.util.List;
import java.util.Optional;

/**
 * SelectStatement - SELECT查询语句
 *
 * 表示查询数据的SQL语句。
 *
 * 语法示例:
 * <pre>
 * SELECT * FROM users;
 * SELECT id, name FROM users WHERE age > 18 ORDER BY name;
 * </pre>
 *
 * 设计原则:
 * - SELECT列表是列名列表,["*"]表示全部列
 * - WHERE条件(可选)在解析时已编译为Predicate
 * - ORDER BY只支持单列升序
 * - 不支持JOIN、GROUP BY等高级特性(保持简单)
 */
public class SelectStatement implements Statement {

    /** SELECT列表(["*"]表示SELECT *) */
    private final List<String> columns;

    /** 表名 */
    private final String tableName;

    /** WHERE条件(如果没有WHERE子句则为null) */
    private final Predicate whereClause;

    /** WHERE子句原始文本 */
    private final String whereText;

    /** ORDER BY列(可选) */
    private final String orderBy;

    public SelectStatement(List<String> columns,
                           String tableName,
                           Predicate whereClause,
                           String whereText,
                           String orderBy) {
        this.columns = List.copyOf(columns);
        this.tableName = tableName;
        this.whereClause = whereClause;
        this.whereText = whereText;
        this.orderBy = orderBy;
    }

    /**
     * 判断是否为SELECT *
     *
     * 只有列表恰好是 ["*"] 才算。
     */
    public boolean isSelectAll() {
        return columns.size() == 1 && CommonConstant.SELECT_ALL.equals(columns.get(0));
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    public Optional<Predicate> getWhereClause() {
        return Optional.ofNullable(whereClause);
    }

    public Optional<String> getWhereText() {
        return Optional.ofNullable(whereText);
    }

    public Optional<String> getOrderBy() {
        return Optional.ofNullable(orderBy);
    }

    @Override
    public StatementType getType() {
        return StatementType.SELECT;
    }

    @Override
    public String toString() {
        return "SelectStatement{" +
                "columns=" + columns +
                ", tableName='" + tableName + '\'' +
                ", whereClause=" + whereClause +
                ", orderBy=" + orderBy +
                '}';
    }
}
