package org.lupenghan.docdb.executor.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * select 的结果集
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResultSet {
    String title;
    List<String> columns;                 // 投影列，按输出顺序
    List<Map<String, Object>> rows;       // 过滤、排序、截断之后的行
    int rowCount;                         // 截断之前满足条件的行数
    Integer limit;                        // 实际使用的 limit，不限制时为空
}
