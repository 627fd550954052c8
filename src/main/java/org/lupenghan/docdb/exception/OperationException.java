package org.lupenghan.docdb.exception;

/**
 * 单个操作执行失败。执行器会把它转换成 status=error 的执行结果，不会中断整个计划
 */
public abstract class OperationException extends Exception {
    private final ErrorKind kind;

    /**
     * @param kind 错误分类
     * @param message 面向用户的描述
     */
    protected OperationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * 获取错误分类
     * @return 错误分类
     */
    public ErrorKind getKind() {
        return kind;
    }
}
