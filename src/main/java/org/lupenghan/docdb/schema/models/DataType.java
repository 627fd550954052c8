package org.lupenghan.docdb.schema.models;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 数据类型枚举
 * 列定义里的 dataType 是自由文本标签，这里把常见写法归一到固定的几类
 */
@Getter
public enum DataType {
    TEXT(Set.of("string", "text", "uuid", "varchar", "char")),
    INTEGER(Set.of("integer", "int", "bigint", "smallint")),
    NUMBER(Set.of("number", "float", "double", "decimal", "numeric", "real")),
    BOOLEAN(Set.of("boolean", "bool")),
    DATE(Set.of("date")),
    DATETIME(Set.of("datetime", "timestamp")),
    JSON(Set.of("json", "jsonb"));

    private final Set<String> tags;

    DataType(Set<String> tags) {
        this.tags = tags;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == NUMBER;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    /**
     * 按标签查找数据类型（忽略大小写和首尾空白）
     * @param tag 列定义中的类型标签
     * @return 未识别时返回空
     */
    public static Optional<DataType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.tags.contains(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
