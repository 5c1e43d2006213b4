package com.toydb.executor;

/**
 * ColumnValueMismatchException - INSERT列数与值数不一致
 *
 * 严格配对,不截断。
 */
public class ColumnValueMismatchException extends ExecutionException {

    private final int columnCount;

    private final int valueCount;

    public ColumnValueMismatchException(int columnCount, int valueCount) {
        super("Column count doesn't match value count. " +
                "Columns: " + columnCount + ", Values: " + valueCount);
        this.columnCount = columnCount;
        this.valueCount = valueCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public int getValueCount() {
        return valueCount;
    }
}
