package com.toydb.parser.predicate;

/**
 * UnsupportedOperatorException - WHERE条件使用了不支持的运算符
 *
 * 例如 {@code age <> 30}、{@code id == 1}。
 */
public class UnsupportedOperatorException extends PredicateException {

    /** 出错的运算符文本 */
    private final String operator;

    public UnsupportedOperatorException(String operator, String condition) {
        super("Unsupported operator in WHERE condition: " + operator + " (in: " + condition + ")");
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
