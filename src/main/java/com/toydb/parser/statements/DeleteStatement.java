package com.toydb.parser.statements;

import com.toydb.parser.Statement;
import com.toydb.parser.predicate.Predicate;

import java.util.Optional;

/**
 * DeleteStatement - DELETE删除语句
 *
 * 语法示例:
 * <pre>
 * DELETE FROM users WHERE age &lt; 30;
 * DELETE FROM users;
 * </pre>
 *
 * 注意: 没有WHERE子句会删除所有行!
 */
public class DeleteStatement implements Statement {

    /** 表名 */
    private final String tableName;

    /** WHERE条件(为空表示删除所有行) */
    private final Predicate whereClause;

    /** WHERE子句原始文本 */
    private final String whereText;

    public DeleteStatement(String tableName, Predicate whereClause, String whereText) {
        this.tableName = tableName;
        this.whereClause = whereClause;
        this.whereText = whereText;
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

    @Override
    public StatementType getType() {
        return StatementType.DELETE;
    }

    @Override
    public String toString() {
        return "DeleteStatement{" +
                "tableName='" + tableName + '\'' +
                ", whereClause=" + whereClause +
                '}';
    }
}
