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
public class GrantOperation extends Operation {
    String role;
    String table;
    List<String> privileges;
    String description;     // 角色描述，角色不存在时一并创建

    @Override
    public OperationType getType() {
        return OperationType.GRANT;
    }

    @Override
    public <R, E extends Exception> R accept(OperationVisitor<R, E> visitor) throws E {
        return visitor.visitGrant(this);
    }
}
