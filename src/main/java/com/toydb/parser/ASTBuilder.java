package com.toydb.parser;

import com.toydb.CommonConstant;
import com.toydb.parser.predicate.Predicate;
import com.toydb.parser.predicate.PredicateCompiler;
import com.toydb.parser.statements.DeleteStatement;
import com.toydb.parser.statements.InsertStatement;
import com.toydb.parser.statements.SelectStatement;
import com.toydb.parser.statements.UpdateStatement;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ASTBuilder - 将ANTLR语法树转换为Statement对象
 *
 * 使用访问者模式遍历ANTLR生成的语法树,将其转换为强类型的Statement对象。
 *
 * 设计原则:
 * - 文法只负责关键字骨架,子句主体(WHERE、VALUES、SET值)从字符流中按原始文本截取,
 *   空白和引号都原样保留
 * - WHERE子句在这里立即交给PredicateCompiler编译,编译失败整条语句失败
 *
 * 错误处理:
 * - 谓词编译失败抛出PredicateException(ParseException的子类),原样向上传播
 */
public class ASTBuilder extends ToySQLBaseVisitor<Object> {

    /** WHERE条件编译器 */
    private final PredicateCompiler predicateCompiler;

    public ASTBuilder() {
        this(new PredicateCompiler());
    }

    public ASTBuilder(PredicateCompiler predicateCompiler) {
        this.predicateCompiler = predicateCompiler;
    }

    @Override
    public Object visitSqlStatement(ToySQLParser.SqlStatementContext ctx) {
        // 顶层规则,委托给具体的语句
        if (ctx.selectStatement() != null) {
            return visitSelectStatement(ctx.selectStatement());
        }
        if (ctx.insertStatement() != null) {
            return visitInsertStatement(ctx.insertStatement());
        }
        if (ctx.updateStatement() != null) {
            return visitUpdateStatement(ctx.updateStatement());
        }
        if (ctx.deleteStatement() != null) {
            return visitDeleteStatement(ctx.deleteStatement());
        }
        throw new ParseException(CommonConstant.NO_OPERATION_MATCHED);
    }

    // ==================== SELECT ====================

    @Override
    public SelectStatement visitSelectStatement(ToySQLParser.SelectStatementContext ctx) {
        // 解析SELECT列表
        List<String> columns = new ArrayList<>();
        if (ctx.selectItems().STAR() != null) {
            columns.add(CommonConstant.SELECT_ALL);
        } else {
            for (ToySQLParser.IdentifierContext identCtx : ctx.selectItems().identifier()) {
                columns.add(visitIdentifier(identCtx));
            }
        }

        String tableName = visitIdentifier(ctx.tableName);

        String whereText = null;
        Predicate whereClause = null;
        if (ctx.whereText != null) {
            whereText = rawText(ctx.whereText);
            whereClause = predicateCompiler.compile(whereText);
        }

        String orderBy = null;
        if (ctx.orderColumn != null) {
            orderBy = visitIdentifier(ctx.orderColumn);
        }

        return new SelectStatement(columns, tableName, whereClause, whereText, orderBy);
    }

    // ==================== INSERT ====================

    @Override
    public InsertStatement visitInsertStatement(ToySQLParser.InsertStatementContext ctx) {
        String tableName = visitIdentifier(ctx.tableName);

        // ctx.identifier() 第一个是tableName,之后才是列名
        List<String> columnNames = new ArrayList<>();
        List<ToySQLParser.IdentifierContext> allIdents = ctx.identifier();
        for (int i = 1; i < allIdents.size(); i++) {
            columnNames.add(visitIdentifier(allIdents.get(i)));
        }

        List<String> values = new ArrayList<>();
        for (ToySQLParser.ValueTextContext valueCtx : ctx.valueText()) {
            values.add(rawText(valueCtx));
        }

        return new InsertStatement(tableName, columnNames, values);
    }

    // ==================== UPDATE ====================

    @Override
    public UpdateStatement visitUpdateStatement(ToySQLParser.UpdateStatementContext ctx) {
        String tableName = visitIdentifier(ctx.tableName);

        // 解析SET子句,重复的列后者覆盖前者
        Map<String, String> assignments = new LinkedHashMap<>();
        for (ToySQLParser.SetItemContext setItemCtx : ctx.setItem()) {
            String columnName = visitIdentifier(setItemCtx.columnName);
            assignments.put(columnName, rawText(setItemCtx.valueExpr));
        }

        String whereText = null;
        Predicate whereClause = null;
        if (ctx.whereText != null) {
            whereText = rawText(ctx.whereText);
            whereClause = predicateCompiler.compile(whereText);
        }

        return new UpdateStatement(tableName, assignments, whereClause, whereText);
    }

    // ==================== DELETE ====================

    @Override
    public DeleteStatement visitDeleteStatement(ToySQLParser.DeleteStatementContext ctx) {
        String tableName = visitIdentifier(ctx.tableName);

        String whereText = null;
        Predicate whereClause = null;
        if (ctx.whereText != null) {
            whereText = rawText(ctx.whereText);
            whereClause = predicateCompiler.compile(whereText);
        }

        return new DeleteStatement(tableName, whereClause, whereText);
    }

    // ==================== 标识符 ====================

    @Override
    public String visitIdentifier(ToySQLParser.IdentifierContext ctx) {
        return ctx.getText();
    }

    // ==================== 辅助方法 ====================

    /**
     * 截取规则覆盖的原始文本
     *
     * ctx.getText()会丢掉隐藏通道上的空白,这里直接从字符流按区间取。
     */
    private static String rawText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        return start.getInputStream()
                .getText(Interval.of(start.getStartIndex(), stop.getStopIndex()))
                .trim();
    }
}
