package com.toydb.storage;

import com.toydb.storage.table.Table;

import java.util.List;

/**
 * StorageEngine - 存储引擎接口
 *
 * 定义表存储(Table Store)的标准操作: 表名 → Table 的映射。
 *
 * 生命周期:
 * - 创建时为空
 * - 表只能新建,不能删除
 * - 随引擎实例一起销毁,不持久化
 *
 * 设计原则:
 * - 接口隔离: 只定义执行器需要的操作
 * - 引擎无关: 执行器不关心具体实现
 *
 * 使用模式:
 * <pre>
 * StorageEngine engine = new MemoryStorageEngine();
 * Table users = engine.createTable("users", List.of("id", "name", "age"));
 * </pre>
 */
public interface StorageEngine {

    /**
     * 创建表
     *
     * @param tableName 表名
     * @param columns 声明的列(仅作元数据记录)
     * @return 创建的空表
     * @throws TableExistsException 表已存在
     */
    Table createTable(String tableName, List<String> columns);

    /**
     * 获取表
     *
     * @param tableName 表名
     * @return 表实例,如果不存在返回null
     */
    Table getTable(String tableName);

    /**
     * 检查表是否存在
     *
     * @param tableName 表名
     * @return 存在返回true
     */
    boolean tableExists(String tableName);

    /**
     * 获取所有表名(按创建顺序)
     *
     * @return 表名列表
     */
    List<String> getAllTableNames();

    /**
     * 获取表的数量
     *
     * @return 表数量
     */
    int getTableCount();
}
