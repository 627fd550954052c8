package org.lupenghan.docdb.history;

import org.lupenghan.docdb.criteria.models.CriteriaCondition;
import org.lupenghan.docdb.operation.OperationVisitor;
import org.lupenghan.docdb.operation.models.AddColumnOperation;
import org.lupenghan.docdb.operation.models.ColumnBlueprint;
import org.lupenghan.docdb.operation.models.CreateTableOperation;
import org.lupenghan.docdb.operation.models.DeleteOperation;
import org.lupenghan.docdb.operation.models.DropColumnOperation;
import org.lupenghan.docdb.operation.models.DropTableOperation;
import org.lupenghan.docdb.operation.models.GrantOperation;
import org.lupenghan.docdb.operation.models.InsertOperation;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.operation.models.OrderByClause;
import org.lupenghan.docdb.operation.models.RevokeOperation;
import org.lupenghan.docdb.operation.models.SelectOperation;
import org.lupenghan.docdb.operation.models.SortDirection;
import org.lupenghan.docdb.operation.models.UpdateOperation;
import org.lupenghan.docdb.utils.Json;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 把操作渲染成近似 SQL 的文本，只用于历史记录和日志展示
 */
public class OperationQueryRenderer implements OperationVisitor<String, RuntimeException> {
    private static final OperationQueryRenderer INSTANCE = new OperationQueryRenderer();

    public static String render(Operation operation) {
        return operation.accept(INSTANCE);
    }

    @Override
    public String visitCreateTable(CreateTableOperation operation) {
        List<ColumnBlueprint> columns = operation.getColumns() == null ? List.of() : operation.getColumns();
        String body = columns.stream()
                .map(c -> c.getName() + " " + c.getDataType()
                        + (c.isPrimaryKey() ? " PRIMARY KEY" : "")
                        + (c.allowsNull() ? "" : " NOT NULL"))
                .collect(Collectors.joining(", "));
        return "CREATE TABLE " + operation.getTable() + " (" + body + ")";
    }

    @Override
    public String visitDropTable(DropTableOperation operation) {
        return "DROP TABLE " + (operation.isIfExists() ? "IF EXISTS " : "") + operation.getTable();
    }

    @Override
    public String visitAddColumn(AddColumnOperation operation) {
        ColumnBlueprint column = operation.getColumn();
        String definition = column == null ? "?" : column.getName() + " " + column.getDataType();
        return "ALTER TABLE " + operation.getTable() + " ADD COLUMN " + definition;
    }

    @Override
    public String visitDropColumn(DropColumnOperation operation) {
        return "ALTER TABLE " + operation.getTable() + " DROP COLUMN " + operation.getColumn();
    }

    @Override
    public String visitInsert(InsertOperation operation) {
        int count = operation.getRows() == null ? 0 : operation.getRows().size();
        return "INSERT INTO " + operation.getTable() + " VALUES (" + count + " rows)";
    }

    @Override
    public String visitUpdate(UpdateOperation operation) {
        String changes = operation.getChanges() == null ? "" : String.join(", ", operation.getChanges().keySet());
        return "UPDATE " + operation.getTable() + " SET " + changes + where(operation.getCriteria(), operation.isAllRows());
    }

    @Override
    public String visitDelete(DeleteOperation operation) {
        return "DELETE FROM " + operation.getTable() + where(operation.getCriteria(), operation.isAllRows());
    }

    @Override
    public String visitSelect(SelectOperation operation) {
        StringBuilder sql = new StringBuilder("SELECT ");
        List<String> columns = operation.getColumns();
        sql.append(columns == null || columns.isEmpty() ? "*" : String.join(", ", columns));
        sql.append(" FROM ").append(operation.getTable());
        sql.append(where(operation.getCriteria(), true));
        List<OrderByClause> orderBy = operation.getOrderBy();
        if (orderBy != null && !orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(orderBy.stream()
                    .map(o -> o.getColumn() + (o.getDirection() == SortDirection.DESC ? " DESC" : " ASC"))
                    .collect(Collectors.joining(", ")));
        }
        if (operation.getLimit() != null) {
            sql.append(" LIMIT ").append(operation.getLimit());
        }
        return sql.toString();
    }

    @Override
    public String visitGrant(GrantOperation operation) {
        return "GRANT " + joinPrivileges(operation.getPrivileges()) + " ON " + operation.getTable()
                + " TO " + operation.getRole();
    }

    @Override
    public String visitRevoke(RevokeOperation operation) {
        return "REVOKE " + joinPrivileges(operation.getPrivileges()) + " ON " + operation.getTable()
                + " FROM " + operation.getRole();
    }

    private static String where(List<CriteriaCondition> criteria, boolean allRowsAllowed) {
        if (criteria == null || criteria.isEmpty()) {
            return allRowsAllowed ? "" : " WHERE <missing criteria>";
        }
        return " WHERE " + criteria.stream()
                .map(c -> c.getColumn() + " " + (c.getOperator() == null ? "eq" : c.getOperator().getValue())
                        + " " + Json.compact(c.getValue()))
                .collect(Collectors.joining(" AND "));
    }

    private static String joinPrivileges(List<String> privileges) {
        return privileges == null ? "" : String.join(", ", privileges);
    }
}
