package org.lupenghan.docdb.criteria.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单个过滤条件：column operator value
 */
@Value
@Builder
@Jacksonized
public class CriteriaCondition {
    String column;
    @Builder.Default
    ComparisonOperator operator = ComparisonOperator.EQ;
    Object value;

    public static CriteriaCondition of(String column, ComparisonOperator operator, Object value) {
        return CriteriaCondition.builder().column(column).operator(operator).value(value).build();
    }

    public static CriteriaCondition eq(String column, Object value) {
        return of(column, ComparisonOperator.EQ, value);
    }
}
