package org.lupenghan.docdb.operation.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SortDirection fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ASC;
        }
        return "desc".equalsIgnoreCase(value.trim()) ? DESC : ASC;
    }
}
