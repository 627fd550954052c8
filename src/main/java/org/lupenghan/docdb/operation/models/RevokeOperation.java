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
public class RevokeOperation extends Operation {
    String role;
    String table;
    List<String> privileges;

    @Override
    public OperationType getType() {
        return OperationType.REVOKE;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitRevoke(this);
    }
}
