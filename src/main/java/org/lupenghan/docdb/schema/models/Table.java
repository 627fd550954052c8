package org.lupenghan.docdb.schema.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表结构与数据（整张表随文档一起持久化）
 * columns 与 columnOrder 的键集合必须始终一致，columnOrder 决定列的顺序
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Table {
    private String name;                    // 表名（创建后不可修改）
    private String description;             // 描述（可选）
    private String primaryKey;              // 主键字段名（单列）
    @Builder.Default
    private Map<String, ColumnDefinition> columns = new LinkedHashMap<>();     // 字段定义
    @Builder.Default
    private List<String> columnOrder = new ArrayList<>();                      // 字段顺序
    @Builder.Default
    private Map<String, TablePermission> permissions = new LinkedHashMap<>();  // 角色 -> 权限
    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();               // 行数据，按插入顺序
    private Instant createdAt;              // 创建时间
    private Instant updatedAt;              // 最后修改时间

    public ColumnDefinition column(String columnName) {
        return columns.get(columnName);
    }

    public boolean hasColumn(String columnName) {
        return columns.containsKey(columnName);
    }
}
