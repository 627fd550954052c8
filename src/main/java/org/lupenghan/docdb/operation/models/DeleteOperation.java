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
public class DeleteOperation extends Operation {
    String table;
    List<CriteriaCondition> criteria;
    boolean allRows;        // 显式声明删除全部行，criteria 为空时必须为 true

    @Override
    public OperationType getType() {
        return OperationType.DELETE;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitDelete(this);
    }
}
