package com.toydb.parser;

/**
 * ParseException - SQL解析异常
 *
 * 当语句不符合任何文法,或关键字已识别但语句主体不合法时抛出此异常。
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
