package org.lupenghan.docdb.operation.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.operation.OperationVisitor;

import java.util.List;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class CreateTableOperation extends Operation {
    String table;
    String description;
    @Builder.Default
    IfExistsPolicy ifExists = IfExistsPolicy.ABORT;
    List<ColumnBlueprint> columns;

    @Override
    public OperationType getType() {
        return OperationType.CREATE_TABLE;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitCreateTable(this);
    }
}
