package org.lupenghan.docdb.operation;

import org.lupenghan.docdb.operation.models.AddColumnOperation;
import org.lupenghan.docdb.operation.models.CreateTableOperation;
import org.lupenghan.docdb.operation.models.DeleteOperation;
import org.lupenghan.docdb.operation.models.DropColumnOperation;
import org.lupenghan.docdb.operation.models.DropTableOperation;
import org.lupenghan.docdb.operation.models.GrantOperation;
import org.lupenghan.docdb.operation.models.InsertOperation;
import org.lupenghan.docdb.operation.models.RevokeOperation;
import org.lupenghan.docdb.operation.models.SelectOperation;
import org.lupenghan.docdb.operation.models.UpdateOperation;

/**
 * 操作访问者，每种操作一个方法
 * @param <R> 返回值类型
 * @param <E> 访问过程中可能抛出的异常类型
 */
public interface OperationVisitor<R, E extends Exception> {
    // DDL
    R visitCreateTable(CreateTableOperation operation) throws E;

    R visitDropTable(DropTableOperation operation) throws E;

    R visitAddColumn(AddColumnOperation operation) throws E;

    R visitDropColumn(DropColumnOperation operation) throws E;

    // DML
    R visitInsert(InsertOperation operation) throws E;

    R visitUpdate(UpdateOperation operation) throws E;

    R visitDelete(DeleteOperation operation) throws E;

    // DQL
    R visitSelect(SelectOperation operation) throws E;

    // DCL
    R visitGrant(GrantOperation operation) throws E;

    R visitRevoke(RevokeOperation operation) throws E;
}
