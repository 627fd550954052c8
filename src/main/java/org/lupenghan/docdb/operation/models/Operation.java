package org.lupenghan.docdb.operation.models;

import org.lupenghan.docdb.operation.OperationVisitor;

/**
 * 操作的公共父类。子类是固定的十种，全部不可变；
 * 新增操作类型时 {@link OperationVisitor} 需要同步新增方法，所有访问者都会在编译期报错
 */
public abstract class Operation {

    Operation() {
    }

    public abstract OperationType getType();

    /**
     * 操作作用的表名
     */
    public abstract String getTable();

    public abstract <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E;
}
