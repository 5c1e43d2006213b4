package com.toydb;

import com.toydb.executor.VolcanoExecutor;
import com.toydb.parser.SQLParser;
import com.toydb.parser.Statement;
import com.toydb.result.QueryResult;
import com.toydb.storage.StorageEngine;
import com.toydb.storage.impl.MemoryStorageEngine;
import com.toydb.storage.table.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * ToyDB - 内存数据库入口
 *
 * 把SQLParser、VolcanoExecutor和内存存储引擎组装在一起。
 *
 * 使用示例:
 * <pre>
 * ToyDB db = new ToyDB();
 * db.createTable("users", List.of("id", "name", "age"));
 *
 * db.execute("INSERT INTO users (id, name, age) VALUES (1, 'Alice', 30)");
 * Optional&lt;List&lt;Row&gt;&gt; rows = db.execute("SELECT * FROM users WHERE age > 25 ORDER BY name");
 * </pre>
 *
 * 空表行为:
 * - 默认(emptyTableAsMissing = true): SELECT/UPDATE/DELETE对空表报TableNotFoundException,
 *   与"表不存在"不可区分;INSERT只要表存在即可
 * - emptyTableAsMissing = false: 所有语句只检查表是否存在
 *
 * 并发: 实例不是线程安全的,共享时由调用方加锁。
 */
public class ToyDB {

    private static final Logger logger = LoggerFactory.getLogger(ToyDB.class);

    private final StorageEngine storageEngine;

    private final SQLParser parser;

    private final VolcanoExecutor executor;

    public ToyDB() {
        this(true);
    }

    /**
     * @param emptyTableAsMissing SELECT/UPDATE/DELETE是否把空表视为不存在
     */
    public ToyDB(boolean emptyTableAsMissing) {
        this.storageEngine = new MemoryStorageEngine();
        this.parser = new SQLParser();
        this.executor = new VolcanoExecutor(storageEngine, emptyTableAsMissing);
        logger.debug("ToyDB 已创建, emptyTableAsMissing={}", emptyTableAsMissing);
    }

    /**
     * 创建表
     *
     * @param name 表名
     * @param columns 声明的列(只记录,不参与执行)
     * @throws com.toydb.storage.TableExistsException 表已存在
     */
    public void createTable(String name, List<String> columns) {
        storageEngine.createTable(name, columns);
    }

    /**
     * 解析并执行一条语句
     *
     * @param sql 语句文本
     * @return SELECT返回结果行,其他语句返回空
     * @throws com.toydb.parser.ParseException 语句无法解析
     * @throws com.toydb.parser.predicate.PredicateException WHERE条件不合法
     * @throws com.toydb.storage.TableNotFoundException 表不存在
     * @throws com.toydb.executor.ColumnValueMismatchException INSERT列数与值数不一致
     * @throws com.toydb.storage.table.RowKeyException 行中缺少被引用的列
     */
    public Optional<List<Row>> execute(String sql) {
        Statement statement = parser.parse(sql);
        QueryResult result = execute(statement);
        return result.isQuery() ? Optional.of(result.getRows()) : Optional.empty();
    }

    /**
     * 执行已解析的语句
     *
     * @param statement 语句
     * @return 执行结果
     */
    public QueryResult execute(Statement statement) {
        return executor.execute(statement);
    }

    public StorageEngine getStorageEngine() {
        return storageEngine;
    }
}
