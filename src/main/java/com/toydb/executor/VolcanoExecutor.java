package com.toydb.executor;

import com.toydb.executor.operator.DeleteOperator;
import com.toydb.executor.operator.InsertOperator;
import com.toydb.executor.operator.UpdateOperator;
import com.toydb.parser.Statement;
import com.toydb.result.QueryResult;
import com.toydb.storage.StorageEngine;
import com.toydb.storage.table.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * VolcanoExecutor - 火山模型执行器
 *
 * 基于火山模型(Volcano Model)的SQL执行引擎,使用迭代器模式构建算子树。
 *
 * 核心概念:
 * - 每个算子实现 hasNext() + next() 接口
 * - SELECT: 算子串联形成执行管道 Scan → Filter → Sort → Project
 * - INSERT/UPDATE/DELETE: 单个修改算子,execute()返回影响行数
 *
 * 设计原则:
 * - "Good taste": 统一的执行流程,ExecutionPlan负责构建,这里只负责驱动
 * - 实用主义: 不实现查询优化器,不实现索引,所有操作都是全表扫描
 *
 * 使用示例:
 * <pre>
 * StorageEngine storageEngine = new MemoryStorageEngine();
 * VolcanoExecutor executor = new VolcanoExecutor(storageEngine);
 *
 * Statement stmt = parser.parse("SELECT id, name FROM users WHERE age > 18");
 * QueryResult result = executor.execute(stmt);
 * </pre>
 *
 * 错误处理:
 * - 所有异常原样抛给调用方,不重试,不记录后吞掉
 * - 每条语句失败只影响这一条语句
 *
 * 并发:
 * - 不加锁。多个线程共享同一个执行器时,调用方必须串行化execute()
 */
public class VolcanoExecutor {

    private static final Logger logger = LoggerFactory.getLogger(VolcanoExecutor.class);

    /** 存储引擎(用于获取表) */
    private final StorageEngine storageEngine;

    /** SELECT/UPDATE/DELETE是否把空表视为不存在 */
    private final boolean emptyTableAsMissing;

    /**
     * 创建火山模型执行器(空表视为不存在)
     *
     * @param storageEngine 存储引擎
     */
    public VolcanoExecutor(StorageEngine storageEngine) {
        this(storageEngine, true);
    }

    /**
     * 创建火山模型执行器
     *
     * @param storageEngine 存储引擎
     * @param emptyTableAsMissing SELECT/UPDATE/DELETE是否把空表视为不存在
     */
    public VolcanoExecutor(StorageEngine storageEngine, boolean emptyTableAsMissing) {
        if (storageEngine == null) {
            throw new IllegalArgumentException("StorageEngine cannot be null");
        }
        this.storageEngine = storageEngine;
        this.emptyTableAsMissing = emptyTableAsMissing;
    }

    /**
     * 执行SQL语句
     *
     * @param statement SQL语句
     * @return 执行结果
     */
    public QueryResult execute(Statement statement) {
        if (statement == null) {
            throw new IllegalArgumentException("Statement cannot be null");
        }

        logger.debug("执行 {} 语句, 表: {}", statement.getType(), statement.getTableName());

        Operator root = ExecutionPlan.build(statement, storageEngine, emptyTableAsMissing);

        switch (statement.getType()) {
            case SELECT:
                return executeQuery(root);

            case INSERT:
                return affected(statement, ((InsertOperator) root).execute());

            case UPDATE:
                return affected(statement, ((UpdateOperator) root).execute());

            case DELETE:
                return affected(statement, ((DeleteOperator) root).execute());

            default:
                throw new ExecutionException("Unsupported statement type: " + statement.getType());
        }
    }

    /**
     * 遍历算子树,收集所有行
     *
     * 返回的是副本,调用方修改结果不会影响表。
     */
    private QueryResult executeQuery(Operator root) {
        List<Row> rows = new ArrayList<>();
        while (root.hasNext()) {
            rows.add(root.next().copy());
        }

        logger.debug("查询返回 {} 行", rows.size());
        return QueryResult.ofRows(rows);
    }

    private QueryResult affected(Statement statement, int affectedRows) {
        logger.debug("{} 影响 {} 行, 表: {}", statement.getType(), affectedRows, statement.getTableName());
        return QueryResult.ofAffectedRows(statement.getType(), affectedRows);
    }
}
