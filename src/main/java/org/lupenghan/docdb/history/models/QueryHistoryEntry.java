package org.lupenghan.docdb.history.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.executor.models.ExecutionStatus;
import org.lupenghan.docdb.operation.models.OperationCategory;

import java.time.Instant;
import java.util.List;

/**
 * 查询历史中的一条记录
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryHistoryEntry {
    String id;
    String query;                   // 操作的 SQL 形式，仅用于展示
    OperationCategory category;
    ExecutionStatus status;
    long executionTimeMs;
    Integer affectedRows;
    String errorMessage;
    List<String> tables;
    Instant executedAt;
}
