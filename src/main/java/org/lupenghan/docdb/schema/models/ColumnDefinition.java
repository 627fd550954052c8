package org.lupenghan.docdb.schema.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 列定义类
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnDefinition {
    private String name;            // 列名
    private String dataType;        // 类型标签（原样保存，例如 "integer"、"text"）
    private boolean nullable;       // 是否允许 NULL
    private Object defaultValue;    // 默认值（已按类型转换）
    @JsonProperty("isPrimaryKey")
    private boolean primaryKey;     // 是否是主键
}
