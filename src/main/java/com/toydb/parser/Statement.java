package com.toydb.parser;

/**
 * Statement - SQL语句接口
 *
 * 所有SQL语句的基类,代表一个解析完成、可执行的SQL命令。
 *
 * 设计原则:
 * - 封闭集合: 只有四种语句,执行器对 {@link StatementType} 做穷举分发
 * - 类型安全: 每种SQL有专门的子类,只携带自己需要的字段
 *
 * 使用示例:
 * <pre>
 * Statement stmt = parser.parse("SELECT * FROM users WHERE age > 30");
 * if (stmt.getType() == Statement.StatementType.SELECT) {
 *     SelectStatement select = (SelectStatement) stmt;
 *     ...
 * }
 * </pre>
 */
public interface Statement {

    /**
     * 获取语句类型
     *
     * @return 语句类型枚举
     */
    StatementType getType();

    /**
     * 获取语句操作的表名
     *
     * @return 表名
     */
    String getTableName();

    /**
     * SQL语句类型枚举
     */
    enum StatementType {
        /** SELECT - 查询 */
        SELECT,
        /** INSERT - 插入 */
        INSERT,
        /** UPDATE - 更新 */
        UPDATE,
        /** DELETE - 删除 */
        DELETE
    }
}
