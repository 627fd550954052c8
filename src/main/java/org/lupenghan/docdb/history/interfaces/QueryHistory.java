package org.lupenghan.docdb.history.interfaces;

import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.history.models.QueryHistoryEntry;
import org.lupenghan.docdb.history.models.QueryHistoryFilter;
import org.lupenghan.docdb.history.models.QueryHistoryStats;
import org.lupenghan.docdb.operation.models.Operation;

import java.util.List;

public interface QueryHistory {
    QueryHistoryEntry record(Operation operation, ExecutionResult result, long executionTimeMs);

    /**
     * 按条件查询历史，最新的在前
     */
    List<QueryHistoryEntry> list(QueryHistoryFilter filter);

    QueryHistoryStats stats();

    int size();

    void clear();
}
