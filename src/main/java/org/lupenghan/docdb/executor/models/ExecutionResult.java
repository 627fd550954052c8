package org.lupenghan.docdb.executor.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.exception.ErrorKind;
import org.lupenghan.docdb.exception.OperationException;
import org.lupenghan.docdb.operation.models.OperationCategory;
import org.lupenghan.docdb.operation.models.OperationType;

import java.util.UUID;

/**
 * 单个操作的执行结果。category 由 type 推导，不能单独设置
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResult {
    @Builder.Default
    String id = UUID.randomUUID().toString();
    OperationType type;
    ExecutionStatus status;
    String detail;
    ErrorKind errorKind;        // 仅 status=error 时有值
    Integer affectedRows;       // insert/update/delete 影响的行数
    QueryResultSet resultSet;   // 仅 select

    @JsonProperty("category")
    public OperationCategory getCategory() {
        return type == null ? null : type.getCategory();
    }

    @JsonIgnore
    public boolean isError() {
        return status == ExecutionStatus.ERROR;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public static ExecutionResult success(OperationType type, String detail) {
        return ExecutionResult.builder().type(type).status(ExecutionStatus.SUCCESS).detail(detail).build();
    }

    public static ExecutionResult skipped(OperationType type, String detail) {
        return ExecutionResult.builder().type(type).status(ExecutionStatus.SKIPPED).detail(detail).build();
    }

    public static ExecutionResult error(OperationType type, OperationException cause) {
        return ExecutionResult.builder()
                .type(type)
                .status(ExecutionStatus.ERROR)
                .detail(cause.getMessage())
                .errorKind(cause.getKind())
                .build();
    }
}
