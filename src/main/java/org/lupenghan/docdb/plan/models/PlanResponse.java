package org.lupenghan.docdb.plan.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.store.models.DocumentSummary;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanResponse {
    String content;
    String thought;
    List<ExecutionResult> results;
    List<String> warnings;          // 规划器警告与失败操作的详情，去重后按出现顺序
    DocumentSummary summary;
}
