package com.toydb.parser.predicate;

import com.toydb.parser.ParseException;

/**
 * PredicateException - WHERE条件不合法
 *
 * 继承ParseException: WHERE子句写错,整条语句就解析失败。
 */
public class PredicateException extends ParseException {

    public PredicateException(String message) {
        super(message);
    }
}
