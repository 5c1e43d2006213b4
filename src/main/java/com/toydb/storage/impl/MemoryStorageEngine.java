package com.toydb.storage.impl;

import com.toydb.storage.StorageEngine;
import com.toydb.storage.TableExistsException;
import com.toydb.storage.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MemoryStorageEngine - 内存存储引擎
 *
 * 对应MySQL的Memory存储引擎: 数据全部在内存,进程退出即丢失。
 *
 * 核心特性:
 * 1. 表名 → Table 的有序映射(按创建顺序)
 * 2. 表只增不删
 * 3. 无持久化、无索引、无事务
 *
 * 并发:
 * - 内部不加锁,映射和行列表都是普通集合
 * - 多线程共享同一实例时,调用方必须自行串行化
 *
 * "实用主义": 表结构只记录列名,不做任何校验
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger logger = LoggerFactory.getLogger(MemoryStorageEngine.class);

    /** 表名到表的映射 */
    private final Map<String, Table> tables;

    public MemoryStorageEngine() {
        this.tables = new LinkedHashMap<>();
    }

    @Override
    public Table createTable(String tableName, List<String> columns) {
        if (tableName == null || tableName.trim().isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        if (tables.containsKey(tableName)) {
            throw new TableExistsException(tableName);
        }

        Table table = new Table(tableName, columns);
        tables.put(tableName, table);

        logger.info("创建表: {}, 声明列: {}", tableName, table.getColumns());
        return table;
    }

    @Override
    public Table getTable(String tableName) {
        return tables.get(tableName);
    }

    @Override
    public boolean tableExists(String tableName) {
        return tables.containsKey(tableName);
    }

    @Override
    public List<String> getAllTableNames() {
        return new ArrayList<>(tables.keySet());
    }

    @Override
    public int getTableCount() {
        return tables.size();
    }

    @Override
    public String toString() {
        return "MemoryStorageEngine{" +
                "tables=" + tables.keySet() +
                '}';
    }
}
