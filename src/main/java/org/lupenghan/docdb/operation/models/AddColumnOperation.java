package org.lupenghan.docdb.operation.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.operation.OperationVisitor;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class AddColumnOperation extends Operation {
    String table;
    ColumnBlueprint column;
    Integer position;       // 为空时追加到末尾

    @Override
    public OperationType getType() {
        return OperationType.ALTER_TABLE_ADD_COLUMN;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitAddColumn(this);
    }
}
