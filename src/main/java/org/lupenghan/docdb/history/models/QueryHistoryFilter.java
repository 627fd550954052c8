package org.lupenghan.docdb.history.models;

import lombok.Builder;
import lombok.Value;
import org.lupenghan.docdb.executor.models.ExecutionStatus;
import org.lupenghan.docdb.operation.models.OperationCategory;

import java.time.Instant;

@Value
@Builder
public class QueryHistoryFilter {
    OperationCategory category;
    ExecutionStatus status;
    String searchTerm;      // 匹配 query 文本或表名，忽略大小写
    Instant since;
    Instant until;

    public static QueryHistoryFilter all() {
        return QueryHistoryFilter.builder().build();
    }
}
