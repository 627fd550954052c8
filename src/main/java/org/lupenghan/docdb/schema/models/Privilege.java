package org.lupenghan.docdb.schema.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

/**
 * 表级权限
 */
@Getter
public enum Privilege {
    SELECT("select"),
    INSERT("insert"),
    UPDATE("update"),
    DELETE("delete"),
    ALTER("alter"),
    DROP("drop"),
    MANAGE_PERMISSIONS("manage_permissions");

    @JsonValue
    private final String value;

    Privilege(String value) {
        this.value = value;
    }

    @JsonCreator
    public static Privilege fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Privilege privilege : values()) {
                if (privilege.value.equals(normalized)) {
                    return privilege;
                }
            }
        }
        throw new IllegalArgumentException("Invalid privilege value: " + value);
    }
}
