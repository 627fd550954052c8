package org.lupenghan.docdb.operation.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.operation.OperationVisitor;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class InsertOperation extends Operation {
    String table;
    List<Map<String, Object>> rows;

    @Override
    public OperationType getType() {
        return OperationType.INSERT;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitInsert(this);
    }
}
