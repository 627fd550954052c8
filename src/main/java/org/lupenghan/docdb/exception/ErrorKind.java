package org.lupenghan.docdb.exception;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 执行结果中的错误分类
 */
@Getter
public enum ErrorKind {
    SCHEMA("SchemaError"),          // 列/表定义非法或冲突
    CONFLICT("ConflictError"),      // 表/列已存在
    NOT_FOUND("NotFoundError"),     // 表/列/角色不存在
    PRIVILEGE("PrivilegeError"),    // 角色缺少所需权限
    VALIDATION("ValidationError");  // 行数据违反列约束

    @JsonValue
    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    @JsonCreator
    public static ErrorKind fromLabel(String label) {
        for (ErrorKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label) || kind.name().equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Invalid error kind: " + label);
    }
}
