package org.lupenghan.docdb.store.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.schema.models.ColumnDefinition;

import java.time.Instant;
import java.util.List;

/**
 * 单张表的只读概要，不包含行数据
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableSummary {
    String name;
    String description;
    String primaryKey;
    int columnCount;
    int rowCount;
    Instant updatedAt;
    List<ColumnDefinition> columns;             // 按 columnOrder 排列的副本
    List<PermissionSummary> permissions;
}
