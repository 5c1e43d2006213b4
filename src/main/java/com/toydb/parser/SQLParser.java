package com.toydb.parser;

import com.toydb.CommonConstant;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ConsoleErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * SQLParser - SQL解析器对外接口
 *
 * 提供简单易用的API来解析SQL字符串。
 *
 * 解析流程:
 * 1. 去掉首尾空白
 * 2. 看第一个记号: 不是SELECT/INSERT/UPDATE/DELETE直接失败,不猜测意图
 * 3. 用该关键字对应的完整文法匹配,任何语法错误都整体失败,没有部分解析
 * 4. ASTBuilder构建Statement,遇到WHERE时调用谓词编译器
 *
 * 使用示例:
 * <pre>
 * SQLParser parser = new SQLParser();
 * Statement stmt = parser.parse("SELECT * FROM users WHERE age > 30 ORDER BY name");
 *
 * if (stmt.getType() == Statement.StatementType.SELECT) {
 *     SelectStatement select = (SelectStatement) stmt;
 *     System.out.println("Table: " + select.getTableName());
 * }
 * </pre>
 *
 * "Good taste": 错误处理直接暴露,而不是被掩盖
 */
public class SQLParser {

    private static final Logger logger = LoggerFactory.getLogger(SQLParser.class);

    /**
     * 解析SQL字符串
     *
     * @param sql SQL语句
     * @return 解析后的Statement对象
     * @throws ParseException 如果SQL语法错误
     * @throws com.toydb.parser.predicate.PredicateException 如果WHERE条件不合法
     */
    public Statement parse(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            throw new ParseException("SQL statement cannot be null or empty");
        }

        String text = sql.trim();

        try {
            // 1. 词法分析
            SyntaxErrorCollector errorCollector = new SyntaxErrorCollector();
            ToySQLLexer lexer = new ToySQLLexer(CharStreams.fromString(text));
            lexer.removeErrorListeners();
            lexer.addErrorListener(errorCollector);

            CommonTokenStream tokens = new CommonTokenStream(lexer);

            // 2. 首关键字决定文法
            int leadingToken = tokens.LT(1).getType();
            if (!isKnownOperation(leadingToken)) {
                throw new ParseException(CommonConstant.NO_OPERATION_MATCHED);
            }

            // 3. 语法分析
            ToySQLParser parser = new ToySQLParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(errorCollector);

            ToySQLParser.SqlStatementContext tree = parser.sqlStatement();

            if (errorCollector.hasErrors()) {
                throw new ParseException("Malformed " + ToySQLLexer.VOCABULARY.getSymbolicName(leadingToken)
                        + " statement: " + errorCollector.getErrorMessage());
            }

            // 4. 将ANTLR语法树转换为Statement对象
            ASTBuilder builder = new ASTBuilder();
            Statement statement = (Statement) builder.visit(tree);

            logger.debug("解析完成: {}", statement);
            return statement;

        } catch (ParseException e) {
            throw e;
        } catch (Exception e) {
            throw new ParseException("Failed to parse SQL: " + e.getMessage(), e);
        }
    }

    private static boolean isKnownOperation(int tokenType) {
        return tokenType == ToySQLLexer.SELECT
                || tokenType == ToySQLLexer.INSERT
                || tokenType == ToySQLLexer.UPDATE
                || tokenType == ToySQLLexer.DELETE;
    }

    /**
     * ANTLR错误收集器
     *
     * 收集词法和语法错误,提供清晰的错误信息。
     */
    private static class SyntaxErrorCollector extends ConsoleErrorListener {
        private final List<String> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            String error = String.format("Syntax error at line %d:%d - %s",
                    line, charPositionInLine, msg);
            errors.add(error);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public String getErrorMessage() {
            return String.join("\n", errors);
        }
    }
}
