package org.lupenghan.docdb.exception;

/**
 * 列或表定义非法
 */
public class SchemaException extends OperationException {
    public SchemaException(String message) {
        super(ErrorKind.SCHEMA, message);
    }
}
