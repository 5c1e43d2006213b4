package com.toydb.executor;

import com.toydb.storage.table.Row;
import com.toydb.storage.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * 算子测试的公共数据: users(id, name, age)
 */
final class OperatorTestSupport {

    private OperatorTestSupport() {
    }

    static Table usersTable() {
        Table table = new Table("users", List.of("id", "name", "age"));
        table.insertRow(Row.of(List.of("id", "name", "age"), List.of("1", "'Alice'", "30")));
        table.insertRow(Row.of(List.of("id", "name", "age"), List.of("2", "'Bob'", "25")));
        table.insertRow(Row.of(List.of("id", "name", "age"), List.of("3", "'Charlie'", "35")));
        table.insertRow(Row.of(List.of("id", "name", "age"), List.of("4", "'David'", "25")));
        return table;
    }

    static List<Row> drain(Operator operator) {
        List<Row> rows = new ArrayList<>();
        while (operator.hasNext()) {
            rows.add(operator.next());
        }
        return rows;
    }

    static List<String> column(List<Row> rows, String columnName) {
        List<String> values = new ArrayList<>();
        for (Row row : rows) {
            values.add(row.getValue(columnName));
        }
        return values;
    }
}
