package org.lupenghan.docdb.executor.interfaces;

import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.schema.models.Document;

public interface OperationExecutor {
    /**
     * 对内存中的文档执行单个操作。操作级错误以 status=error 的结果返回，不抛异常；
     * 失败的操作不会修改文档
     * @param document 目标文档，调用方负责加锁
     * @param operation 操作
     * @param actingRole 执行角色，为 null 时不做权限检查
     * @return 执行结果
     */
    ExecutionResult execute(Document document, Operation operation, String actingRole);

    default ExecutionResult execute(Document document, Operation operation) {
        return execute(document, operation, null);
    }
}
