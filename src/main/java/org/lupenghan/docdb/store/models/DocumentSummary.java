package org.lupenghan.docdb.store.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.schema.models.DocumentMeta;

import java.util.List;

/**
 * 文档概要：元数据、表概要和角色列表。所有字段都是副本，修改它不会影响文档
 */
@Value
@Builder
@Jacksonized
public class DocumentSummary {
    DocumentMeta meta;
    List<TableSummary> tables;
    List<RoleSummary> roles;

    public TableSummary table(String name) {
        for (TableSummary table : tables) {
            if (table.getName().equals(name)) {
                return table;
            }
        }
        return null;
    }
}
