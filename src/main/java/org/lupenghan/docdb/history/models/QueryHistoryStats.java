package org.lupenghan.docdb.history.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryHistoryStats {
    int total;
    int succeeded;
    int skipped;
    int failed;
    double averageExecutionTimeMs;
}
