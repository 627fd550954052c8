package org.lupenghan.docdb.exception;

/**
 * 引用的表、列或角色不存在
 */
public class NotFoundException extends OperationException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
