package com.toydb.storage;

/**
 * TableExistsException - 重复建表
 */
public class TableExistsException extends StorageException {

    private final String tableName;

    public TableExistsException(String tableName) {
        super("Table '" + tableName + "' already exists");
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
