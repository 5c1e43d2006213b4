package com.toydb.executor;

import com.toydb.parser.predicate.Predicate;
import com.toydb.storage.table.Row;

/**
 * PredicateEvaluator - WHERE条件求值器
 *
 * 对一行数据求值编译后的 {@link Predicate}。
 *
 * 比较规则:
 * - 取行中该列的文本值,与谓词右操作数文本做字典序比较(String.compareTo)
 * - 从不做数字转换: "9" &lt; "10" 为false,"40" &gt; "30" 为true
 * - 行中没有该列时抛 {@link com.toydb.storage.table.RowKeyException},不当作false
 *
 * 设计原则:
 * - 零状态: 纯函数式求值,可以在多个算子间共享
 * - 穷举分发: 一个switch覆盖全部六种运算符
 *
 * 使用示例:
 * <pre>
 * Row row = ...; // {id=1, name='Alice', age=30}
 * Predicate p = new Predicate("age", ComparisonOperator.GREATER_THAN, "25");
 * boolean matches = evaluator.evaluate(p, row); // true
 * </pre>
 */
public class PredicateEvaluator {

    /**
     * 求值谓词
     *
     * @param predicate 谓词
     * @param row 行数据
     * @return 行是否满足条件
     * @throws com.toydb.storage.table.RowKeyException 行中没有谓词引用的列
     */
    public boolean evaluate(Predicate predicate, Row row) {
        if (predicate == null) {
            throw new IllegalArgumentException("Predicate cannot be null");
        }
        if (row == null) {
            throw new IllegalArgumentException("Row cannot be null");
        }

        String left = row.getValue(predicate.getColumn());
        int cmp = left.compareTo(predicate.getLiteral());

        switch (predicate.getOperator()) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case LESS_THAN:
                return cmp < 0;
            case LESS_EQUAL:
                return cmp <= 0;
            case GREATER_THAN:
                return cmp > 0;
            case GREATER_EQUAL:
                return cmp >= 0;
            default:
                throw new ExecutionException("Unsupported operator: " + predicate.getOperator());
        }
    }
}
