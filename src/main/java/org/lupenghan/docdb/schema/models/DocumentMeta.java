package org.lupenghan.docdb.schema.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentMeta {
    private int version;        // 文档格式版本
    private long revision;      // 修订号，每次成功的写操作加一
    private Instant createdAt;
    private Instant updatedAt;  // 只在 revision 变化时刷新
}
