package org.lupenghan.docdb.exception;

/**
 * 对象已存在
 */
public class ConflictException extends OperationException {
    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
