package org.lupenghan.docdb.operation.models;

/**
 * 操作分类
 */
public enum OperationCategory {
    DDL,
    DML,
    DQL,
    DCL
}
