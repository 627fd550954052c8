package org.lupenghan.docdb.exception;

/**
 * 计划文本无法解析（非法 JSON、未知操作类型等），整个调用失败
 */
public class PlanParseException extends Exception {
    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
