package com.toydb.storage.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("行数据测试")
class RowTest {

    @Test
    @DisplayName("按位置配对列名和值,保持列顺序")
    void testOf() {
        Row row = Row.of(List.of("id", "name"), List.of("1", "'Alice'"));

        assertEquals(List.of("id", "name"), row.getColumnNames());
        assertEquals("'Alice'", row.getValue("name"));
        assertEquals(2, row.getColumnCount());
    }

    @Test
    @DisplayName("长度不一致不截断")
    void testOfSizeMismatch() {
        assertThrows(IllegalArgumentException.class, () -> Row.of(List.of("id", "name"), List.of("1")));
    }

    @Test
    @DisplayName("读取不存在的列抛出 RowKeyException")
    void testMissingColumn() {
        Row row = new Row(Map.of("id", "1"));

        RowKeyException e = assertThrows(RowKeyException.class, () -> row.getValue("Id"));
        assertEquals("Id", e.getColumnName());
    }

    @Test
    @DisplayName("setValue 可以新增列")
    void testSetValueAddsColumn() {
        Row row = Row.of(List.of("id"), List.of("1"));

        row.setValue("email", "'a@b'");

        assertEquals(List.of("id", "email"), row.getColumnNames());
    }

    @Test
    @DisplayName("副本与原行相等但互不影响")
    void testCopy() {
        Row row = Row.of(List.of("id"), List.of("1"));
        Row copy = row.copy();

        assertEquals(row, copy);
        copy.setValue("id", "2");
        assertEquals("1", row.getValue("id"));
    }
}
