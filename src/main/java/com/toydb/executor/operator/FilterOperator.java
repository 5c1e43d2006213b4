package com.toydb.executor.operator;

import com.toydb.executor.Operator;
import com.toydb.executor.PredicateEvaluator;
import com.toydb.parser.predicate.Predicate;
import com.toydb.storage.table.Row;

/**
 * FilterOperator - WHERE条件过滤算子
 *
 * 包装子算子,过滤不符合WHERE条件的行。
 *
 * 设计原则:
 * - 责任链模式: 包装子Operator,形成处理管道
 * - 懒加载: 只在hasNext()时才求值谓词,跳过不符合条件的行
 *
 * 数据流:
 * 子Operator → Row → PredicateEvaluator.evaluate()
 * → true → 返回Row
 * → false → 跳过,继续hasNext()
 *
 * 实现细节:
 * - hasNext()会跳过所有不符合条件的行,直到找到符合条件的行或到达末尾
 * - next()直接返回hasNext()找到的符合条件的行
 * - 行中缺少谓词引用的列时,RowKeyException直接抛出,整条查询失败
 */
public class FilterOperator implements Operator {

    /** 子算子(数据源) */
    private final Operator child;

    /** WHERE条件 */
    private final Predicate predicate;

    /** 谓词求值器 */
    private final PredicateEvaluator evaluator;

    /** 当前行(缓存hasNext()找到的符合条件的行) */
    private Row currentRow;

    /** 是否已经找到下一行(用于hasNext()/next()协同) */
    private boolean hasNextRow;

    /**
     * 创建过滤算子
     *
     * @param child 子算子(数据源)
     * @param predicate WHERE条件
     * @param evaluator 谓词求值器
     */
    public FilterOperator(Operator child, Predicate predicate, PredicateEvaluator evaluator) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("WHERE condition cannot be null");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("PredicateEvaluator cannot be null");
        }

        this.child = child;
        this.predicate = predicate;
        this.evaluator = evaluator;
        this.hasNextRow = false;
    }

    @Override
    public boolean hasNext() {
        if (hasNextRow) {
            return true;
        }

        while (child.hasNext()) {
            Row row = child.next();

            if (evaluator.evaluate(predicate, row)) {
                currentRow = row;
                hasNextRow = true;
                return true;
            }
        }

        return false;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new java.util.NoSuchElementException("No more rows matching WHERE condition");
        }

        hasNextRow = false;
        return currentRow;
    }

    public Operator getChild() {
        return child;
    }

    public Predicate getPredicate() {
        return predicate;
    }

    @Override
    public String toString() {
        return "FilterOperator{" +
                "predicate=" + predicate +
                ", child=" + child +
                '}';
    }
}
