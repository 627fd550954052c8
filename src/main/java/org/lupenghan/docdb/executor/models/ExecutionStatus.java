package org.lupenghan.docdb.executor.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStatus {
    SUCCESS,
    SKIPPED,    // 仅在 ifExists 明确要求空操作时使用
    ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        return ExecutionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
