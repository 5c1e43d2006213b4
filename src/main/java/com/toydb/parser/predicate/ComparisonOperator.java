package com.toydb.parser.predicate;

/**
 * ComparisonOperator - 比较运算符
 *
 * WHERE条件支持的六种比较运算符。
 */
public enum ComparisonOperator {
    /** 等于 */
    EQUAL("="),
    /** 不等于 */
    NOT_EQUAL("!="),
    /** 小于 */
    LESS_THAN("<"),
    /** 小于等于 */
    LESS_EQUAL("<="),
    /** 大于 */
    GREATER_THAN(">"),
    /** 大于等于 */
    GREATER_EQUAL(">=");

    /** 运算符字符串表示 */
    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 根据符号获取运算符
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
