package org.lupenghan.docdb.operation.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * create_table / alter_table_add_column 中的列蓝图
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnBlueprint {
    String name;
    String dataType;
    @Builder.Default
    Boolean nullable = Boolean.TRUE;
    Object defaultValue;
    @JsonProperty("isPrimaryKey")
    boolean primaryKey;

    public boolean allowsNull() {
        return nullable == null || nullable;
    }
}
