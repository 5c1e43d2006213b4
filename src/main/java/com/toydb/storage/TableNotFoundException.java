package com.toydb.storage;

/**
 * TableNotFoundException - 语句引用的表不存在
 *
 * SELECT/UPDATE/DELETE在默认配置下也会对"存在但为空"的表抛出此异常,
 * 见 {@link com.toydb.ToyDB#ToyDB(boolean)}。
 */
public class TableNotFoundException extends StorageException {

    private final String tableName;

    public TableNotFoundException(String tableName) {
        super("Table '" + tableName + "' does not exist");
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
