package org.lupenghan.docdb.exception;

/**
 * 行数据违反列约束
 */
public class ValidationException extends OperationException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
