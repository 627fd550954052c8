package org.lupenghan.docdb.operation.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.criteria.models.CriteriaCondition;
import org.lupenghan.docdb.operation.OperationVisitor;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class UpdateOperation extends Operation {
    String table;
    List<CriteriaCondition> criteria;
    boolean allRows;        // 显式声明更新全部行，criteria 为空时必须为 true
    Map<String, Object> changes;

    @Override
    public OperationType getType() {
        return OperationType.UPDATE;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitUpdate(this);
    }
}
