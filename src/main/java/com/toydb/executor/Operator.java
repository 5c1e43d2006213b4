package com.toydb.executor;

import com.toydb.storage.table.Row;

/**
 * Operator - 执行算子接口
 *
 * 定义所有执行算子的统一接口,基于火山模型(Volcano Model)的迭代器模式。
 *
 * 核心概念:
 * - 每个算子实现 hasNext() + next() 方法
 * - 算子可以串联形成执行管道(Operator Tree)
 * - 数据流从下往上: Scan → Filter → Sort → Project
 *
 * 设计原则:
 * - "Good taste": 所有算子统一接口,消除if-else判断
 * - 迭代器模式: 按需拉取数据
 * - 可组合: 任何算子都可以包装另一个算子
 *
 * 使用示例:
 * <pre>
 * Operator scan = new ScanOperator(table);
 * Operator filter = new FilterOperator(scan, predicate, evaluator);
 * Operator project = new ProjectOperator(filter, List.of("id", "name"));
 *
 * while (project.hasNext()) {
 *     Row row = project.next();
 * }
 * </pre>
 */
public interface Operator {

    /**
     * 检查是否还有下一行数据
     *
     * @return 如果还有下一行返回true,否则返回false
     */
    boolean hasNext();

    /**
     * 获取下一行数据
     *
     * 调用前必须先调用hasNext()检查。
     *
     * @return 行数据
     * @throws java.util.NoSuchElementException 如果没有下一行
     */
    Row next();
}
