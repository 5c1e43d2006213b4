package com.toydb.parser.predicate;

/**
 * PredicateCompiler - WHERE条件编译器
 *
 * 把WHERE子句的原始文本编译为 {@link Predicate}。
 *
 * 条件格式:
 * <pre>
 * &lt;列名&gt; [空白] &lt;运算符&gt; [空白] &lt;右操作数&gt;
 * </pre>
 *
 * 词法规则:
 * - 列名: 字母、数字、下划线组成的连续串
 * - 运算符: 紧随其后的运算符字符(= ! &lt; &gt;)组成的最长串,
 *   因此 {@code <=} 不会被拆成 {@code <} 加一个多余的 {@code =}
 * - 右操作数: 剩余全部文本去掉首尾空白,原样保留(包括引号、AND等)
 *
 * 错误处理:
 * - 没有列名或没有运算符: {@link PredicateException}
 * - 运算符串不是六种之一(如 {@code <>}、{@code ==}): {@link UnsupportedOperatorException}
 * - 右操作数为空: {@link PredicateException}
 *
 * 不支持AND/OR组合: {@code a = 1 AND b = 2} 的右操作数是 {@code 1 AND b = 2}。
 */
public class PredicateCompiler {

    /**
     * 编译WHERE条件
     *
     * @param condition WHERE子句文本(不含WHERE关键字)
     * @return 编译后的谓词
     * @throws PredicateException 条件格式不合法
     */
    public Predicate compile(String condition) {
        if (condition == null) {
            throw new PredicateException("WHERE condition cannot be null");
        }

        String text = condition.trim();
        int length = text.length();
        int pos = 0;

        // 1. 列名
        while (pos < length && isIdentifierChar(text.charAt(pos))) {
            pos++;
        }
        if (pos == 0) {
            throw new PredicateException("Unsupported WHERE condition: " + condition);
        }
        String column = text.substring(0, pos);

        pos = skipWhitespace(text, pos);

        // 2. 运算符
        int operatorStart = pos;
        while (pos < length && isOperatorChar(text.charAt(pos))) {
            pos++;
        }
        if (pos == operatorStart) {
            throw new PredicateException("Unsupported WHERE condition: " + condition);
        }
        String symbol = text.substring(operatorStart, pos);
        ComparisonOperator operator = ComparisonOperator.fromSymbol(symbol);
        if (operator == null) {
            throw new UnsupportedOperatorException(symbol, condition);
        }

        // 3. 右操作数
        String literal = text.substring(pos).trim();
        if (literal.isEmpty()) {
            throw new PredicateException("Missing right operand in WHERE condition: " + condition);
        }

        return new Predicate(column, operator, literal);
    }

    private static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isOperatorChar(char c) {
        return c == '=' || c == '!' || c == '<' || c == '>';
    }
}
