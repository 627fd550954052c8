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
public class DropColumnOperation extends Operation {
    String table;
    String column;

    @Override
    public OperationType getType() {
        return OperationType.ALTER_TABLE_DROP_COLUMN;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitDropColumn(this);
    }
}
