package org.lupenghan.docdb.operation.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * create_table 遇到同名表时的处理策略
 */
public enum IfExistsPolicy {
    ABORT,
    SKIP,
    REPLACE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IfExistsPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ABORT;
        }
        return IfExistsPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
