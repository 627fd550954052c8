package org.lupenghan.docdb.operation.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import org.lupenghan.docdb.schema.models.Privilege;

import java.util.Optional;

/**
 * 操作类型（封闭集合），同时记录分类、是否写操作以及所需权限
 */
@Getter
public enum OperationType {
    CREATE_TABLE("ddl.create_table", OperationCategory.DDL, null, CreateTableOperation.class),
    DROP_TABLE("ddl.drop_table", OperationCategory.DDL, Privilege.DROP, DropTableOperation.class),
    ALTER_TABLE_ADD_COLUMN("ddl.alter_table_add_column", OperationCategory.DDL, Privilege.ALTER, AddColumnOperation.class),
    ALTER_TABLE_DROP_COLUMN("ddl.alter_table_drop_column", OperationCategory.DDL, Privilege.ALTER, DropColumnOperation.class),
    INSERT("dml.insert", OperationCategory.DML, Privilege.INSERT, InsertOperation.class),
    UPDATE("dml.update", OperationCategory.DML, Privilege.UPDATE, UpdateOperation.class),
    DELETE("dml.delete", OperationCategory.DML, Privilege.DELETE, DeleteOperation.class),
    SELECT("dql.select", OperationCategory.DQL, Privilege.SELECT, SelectOperation.class),
    GRANT("dcl.grant", OperationCategory.DCL, Privilege.MANAGE_PERMISSIONS, GrantOperation.class),
    REVOKE("dcl.revoke", OperationCategory.DCL, Privilege.MANAGE_PERMISSIONS, RevokeOperation.class);

    @JsonValue
    private final String wireName;
    private final OperationCategory category;
    private final Privilege requiredPrivilege;   // create_table 不需要表级权限
    private final Class<? extends Operation> operationClass;

    OperationType(String wireName, OperationCategory category, Privilege requiredPrivilege,
                  Class<? extends Operation> operationClass) {
        this.wireName = wireName;
        this.category = category;
        this.requiredPrivilege = requiredPrivilege;
        this.operationClass = operationClass;
    }

    public boolean isMutating() {
        return category != OperationCategory.DQL;
    }

    /**
     * 动作名，即去掉分类前缀后的部分，例如 create_table
     */
    public String getAction() {
        return wireName.substring(wireName.indexOf('.') + 1);
    }

    public static Optional<OperationType> lookup(String wireName) {
        for (OperationType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static OperationType fromWireName(String wireName) {
        return lookup(wireName)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported operation type: " + wireName));
    }
}
