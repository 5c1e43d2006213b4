package com.toydb;

/**
 * CommonConstant - 全局常量
 */
public final class CommonConstant {

    /** SELECT * 的列表哨兵值 */
    public static final String SELECT_ALL = "*";

    /** 首个关键字无法识别时的统一错误信息 */
    public static final String NO_OPERATION_MATCHED = "Query did not match any known SQL operation";

    private CommonConstant() {
    }
}
