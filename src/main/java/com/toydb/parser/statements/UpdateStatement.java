package com.toydb.parser.statements;

import com.toydb.parser.Statement;
import com.toydb.parser.predicate.Predicate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * UpdateStatement - UPDATE更新语句
 *
 * 语法示例:
 * <pre>
 * UPDATE users SET age=40 WHERE id=1;
 * UPDATE users SET age=40, name='Al';
 * </pre>
 *
 * 赋值值是原始文本。同一列重复赋值时后者生效。
 */
public class UpdateStatement implements Statement {

    /** 表名 */
    private final String tableName;

    /** 更新映射(列名 → 新值文本) */
    private final Map<String, String> assignments;

    /** WHERE条件(为空表示更新所有行) */
    private final Predicate whereClause;

    /** WHERE子句原始文本 */
    private final String whereText;

    public UpdateStatement(String tableName,
                           Map<String, String> assignments,
                           Predicate whereClause,
                           String whereText) {
        this.tableName = tableName;
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        this.whereClause = whereClause;
        this.whereText = whereText;
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    public Map<String, String> getAssignments() {
        return assignments;
    }

    public Optional<Predicate> getWhereClause() {
        return Optional.ofNullable(whereClause);
    }

    public Optional<String> getWhereText() {
        return Optional.ofNullable(whereText);
    }

    @Override
    public StatementType getType() {
        return StatementType.UPDATE;
    }

    @Override
    public String toString() {
        return "UpdateStatement{" +
                "tableName='" + tableName + '\'' +
                ", assignments=" + assignments +
                ", whereClause=" + whereClause +
                '}';
    }
}
