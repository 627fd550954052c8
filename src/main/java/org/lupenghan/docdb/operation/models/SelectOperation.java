package org.lupenghan.docdb.operation.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.criteria.models.CriteriaCondition;
import org.lupenghan.docdb.operation.OperationVisitor;

import java.util.List;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class SelectOperation extends Operation {
    String table;
    List<String> columns;               // 为空时按 columnOrder 返回全部列
    List<CriteriaCondition> criteria;
    List<OrderByClause> orderBy;
    Integer limit;                      // 为空表示不限制

    @Override
    public OperationType getType() {
        return OperationType.SELECT;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitSelect(this);
    }
}
