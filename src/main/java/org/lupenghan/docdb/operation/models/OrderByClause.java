package org.lupenghan.docdb.operation.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OrderByClause {
    String column;
    @Builder.Default
    SortDirection direction = SortDirection.ASC;

    public static OrderByClause asc(String column) {
        return OrderByClause.builder().column(column).direction(SortDirection.ASC).build();
    }

    public static OrderByClause desc(String column) {
        return OrderByClause.builder().column(column).direction(SortDirection.DESC).build();
    }
}
