package com.toydb.storage.table;

import com.toydb.storage.StorageException;

/**
 * RowKeyException - 行中不存在被引用的列
 *
 * 在执行期(谓词求值、排序、投影)按行抛出,而不是在解析期。
 */
public class RowKeyException extends StorageException {

    private final String columnName;

    public RowKeyException(String columnName) {
        super("Column not found in row: " + columnName);
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
