package com.toydb.parser.predicate;

import java.util.Objects;

/**
 * Predicate - 编译后的WHERE条件
 *
 * 单一比较条件: 列名、运算符、右操作数文本。
 * 只是数据,求值交给 {@link com.toydb.executor.PredicateEvaluator}。
 *
 * 语法示例:
 * <pre>
 * age > 30        → (age, GREATER_THAN, "30")
 * name = 'Alice'  → (name, EQUAL, "'Alice'")
 * </pre>
 *
 * 右操作数保持原始文本(包括引号),从不转换为数字。
 */
public final class Predicate {

    /** 左侧列名 */
    private final String column;

    /** 比较运算符 */
    private final ComparisonOperator operator;

    /** 右侧字面量(原始文本) */
    private final String literal;

    public Predicate(String column, ComparisonOperator operator, String literal) {
        if (column == null || operator == null || literal == null) {
            throw new IllegalArgumentException("Column, operator and literal cannot be null");
        }
        this.column = column;
        this.operator = operator;
        this.literal = literal;
    }

    public String getColumn() {
        return column;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public String getLiteral() {
        return literal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Predicate)) {
            return false;
        }
        Predicate other = (Predicate) o;
        return column.equals(other.column)
                && operator == other.operator
                && literal.equals(other.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, literal);
    }

    @Override
    public String toString() {
        return column + " " + operator + " " + literal;
    }
}
