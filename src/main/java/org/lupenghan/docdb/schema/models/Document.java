package org.lupenghan.docdb.schema.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 持久化的根对象：一个逻辑数据库对应一个文档
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Document {
    public static final int CURRENT_VERSION = 1;

    private DocumentMeta meta;
    @Builder.Default
    private Map<String, Table> tables = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Role> roles = new LinkedHashMap<>();

    /**
     * 创建一个空文档，附带内置的超级用户角色
     * @param superuserRole 超级用户角色名
     * @param now 当前时间
     * @return 新文档，revision 为 0
     */
    public static Document fresh(String superuserRole, Instant now) {
        Document document = Document.builder()
                .meta(DocumentMeta.builder()
                        .version(CURRENT_VERSION)
                        .revision(0)
                        .createdAt(now)
                        .updatedAt(now)
                        .build())
                .build();
        document.getRoles().put(superuserRole, Role.builder()
                .name(superuserRole)
                .description("Full access to every table and privilege.")
                .createdAt(now)
                .updatedAt(now)
                .build());
        return document;
    }

    public Table table(String tableName) {
        return tables.get(tableName);
    }

    public long revision() {
        return meta.getRevision();
    }

    /**
     * 记录一次成功的写操作：revision 加一并刷新 updatedAt
     */
    public void bumpRevision(Instant now) {
        meta.setRevision(meta.getRevision() + 1);
        meta.setUpdatedAt(now);
    }
}
