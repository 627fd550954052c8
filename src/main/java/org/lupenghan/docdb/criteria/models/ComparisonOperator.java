package org.lupenghan.docdb.criteria.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

@Getter
public enum ComparisonOperator {
    EQ("eq"),
    NEQ("neq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    IN("in");

    @JsonValue
    private final String value;

    ComparisonOperator(String value) {
        this.value = value;
    }

    public boolean isNumeric() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    @JsonCreator
    public static ComparisonOperator fromValue(String value) {
        if (value == null) {
            return EQ;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ComparisonOperator operator : values()) {
            if (operator.value.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Invalid comparison operator: " + value);
    }
}
