package com.toydb.parser.predicate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WHERE 条件编译器测试")
class PredicateCompilerTest {

    private final PredicateCompiler compiler = new PredicateCompiler();

    @Test
    @DisplayName("六种运算符")
    void testAllOperators() {
        assertEquals(ComparisonOperator.EQUAL, compiler.compile("a = 1").getOperator());
        assertEquals(ComparisonOperator.NOT_EQUAL, compiler.compile("a != 1").getOperator());
        assertEquals(ComparisonOperator.LESS_THAN, compiler.compile("a < 1").getOperator());
        assertEquals(ComparisonOperator.LESS_EQUAL, compiler.compile("a <= 1").getOperator());
        assertEquals(ComparisonOperator.GREATER_THAN, compiler.compile("a > 1").getOperator());
        assertEquals(ComparisonOperator.GREATER_EQUAL, compiler.compile("a >= 1").getOperator());
    }

    @Test
    @DisplayName("运算符符号")
    void testOperatorSymbols() {
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            assertSame(operator, ComparisonOperator.fromSymbol(operator.getSymbol()));
        }
        assertEquals("<=", ComparisonOperator.LESS_EQUAL.getSymbol());
        assertNull(ComparisonOperator.fromSymbol("<>"));
    }

    @Test
    @DisplayName("非ASCII列名")
    void testUnicodeColumn() {
        Predicate predicate = compiler.compile("名字 = '张三'");

        assertEquals("名字", predicate.getColumn());
        assertEquals("'张三'", predicate.getLiteral());
    }

    @Test
    @DisplayName("两字符运算符优先,没有空白也能识别")
    void testTwoCharacterOperatorWithoutWhitespace() {
        Predicate predicate = compiler.compile("age>=30");

        assertEquals("age", predicate.getColumn());
        assertEquals(ComparisonOperator.GREATER_EQUAL, predicate.getOperator());
        assertEquals("30", predicate.getLiteral());
    }

    @Test
    @DisplayName("右操作数原样保留引号,去掉首尾空白")
    void testLiteralKeepsQuotes() {
        Predicate predicate = compiler.compile("  name   !=   'Bob Smith'  ");

        assertEquals("name", predicate.getColumn());
        assertEquals("'Bob Smith'", predicate.getLiteral());
    }

    @Test
    @DisplayName("AND 不被识别,整体成为右操作数")
    void testAndIsPartOfLiteral() {
        Predicate predicate = compiler.compile("a = 1 AND b = 2");

        assertEquals("a", predicate.getColumn());
        assertEquals("1 AND b = 2", predicate.getLiteral());
    }

    @Test
    @DisplayName("不支持的运算符 - 错误中带有运算符")
    void testUnsupportedOperators() {
        UnsupportedOperatorException notEqual = assertThrows(UnsupportedOperatorException.class,
                () -> compiler.compile("a <> 1"));
        assertEquals("<>", notEqual.getOperator());

        UnsupportedOperatorException doubleEqual = assertThrows(UnsupportedOperatorException.class,
                () -> compiler.compile("a == 1"));
        assertEquals("==", doubleEqual.getOperator());

        assertThrows(UnsupportedOperatorException.class, () -> compiler.compile("a => 1"));
    }

    @Test
    @DisplayName("缺少列名")
    void testMissingColumn() {
        PredicateException e = assertThrows(PredicateException.class, () -> compiler.compile("= 1"));

        assertFalse(e instanceof UnsupportedOperatorException);
    }

    @Test
    @DisplayName("缺少运算符")
    void testMissingOperator() {
        PredicateException e = assertThrows(PredicateException.class, () -> compiler.compile("age 30"));

        assertTrue(e.getMessage().startsWith("Unsupported WHERE condition"));
    }

    @Test
    @DisplayName("缺少右操作数")
    void testMissingLiteral() {
        PredicateException e = assertThrows(PredicateException.class, () -> compiler.compile("age >  "));

        assertTrue(e.getMessage().startsWith("Missing right operand"));
    }

    @Test
    @DisplayName("谓词错误也是解析错误")
    void testPredicateExceptionIsParseException() {
        assertInstanceOf(com.toydb.parser.ParseException.class,
                assertThrows(PredicateException.class, () -> compiler.compile("")));
    }
}
