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
public class DropTableOperation extends Operation {
    String table;
    boolean ifExists;       // 表不存在时跳过而不是报错

    @Override
    public OperationType getType() {
        return OperationType.DROP_TABLE;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitDropTable(this);
    }
}
