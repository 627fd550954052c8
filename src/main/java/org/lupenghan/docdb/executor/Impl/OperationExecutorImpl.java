package org.lupenghan.docdb.executor.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.docdb.criteria.CriteriaEvaluator;
import org.lupenghan.docdb.criteria.models.CriteriaCondition;
import org.lupenghan.docdb.exception.ConflictException;
import org.lupenghan.docdb.exception.NotFoundException;
import org.lupenghan.docdb.exception.OperationException;
import org.lupenghan.docdb.exception.PrivilegeException;
import org.lupenghan.docdb.exception.SchemaException;
import org.lupenghan.docdb.exception.ValidationException;
import org.lupenghan.docdb.executor.interfaces.OperationExecutor;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.executor.models.ExecutionStatus;
import org.lupenghan.docdb.executor.models.QueryResultSet;
import org.lupenghan.docdb.history.interfaces.QueryHistory;
import org.lupenghan.docdb.operation.OperationVisitor;
import org.lupenghan.docdb.operation.models.AddColumnOperation;
import org.lupenghan.docdb.operation.models.CreateTableOperation;
import org.lupenghan.docdb.operation.models.DeleteOperation;
import org.lupenghan.docdb.operation.models.DropColumnOperation;
import org.lupenghan.docdb.operation.models.DropTableOperation;
import org.lupenghan.docdb.operation.models.GrantOperation;
import org.lupenghan.docdb.operation.models.IfExistsPolicy;
import org.lupenghan.docdb.operation.models.InsertOperation;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.operation.models.OrderByClause;
import org.lupenghan.docdb.operation.models.RevokeOperation;
import org.lupenghan.docdb.operation.models.SelectOperation;
import org.lupenghan.docdb.operation.models.SortDirection;
import org.lupenghan.docdb.operation.models.UpdateOperation;
import org.lupenghan.docdb.schema.ColumnRules;
import org.lupenghan.docdb.schema.PrivilegeRules;
import org.lupenghan.docdb.schema.models.ColumnDefinition;
import org.lupenghan.docdb.schema.models.Document;
import org.lupenghan.docdb.schema.models.Privilege;
import org.lupenghan.docdb.schema.models.Role;
import org.lupenghan.docdb.schema.models.Table;
import org.lupenghan.docdb.schema.models.TablePermission;
import org.lupenghan.docdb.utils.Json;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 操作执行器：校验、权限检查、修改文档并生成执行结果。
 * 每个处理方法先完成全部校验，再一次性修改文档，失败时文档保持原样
 */
@Slf4j
public class OperationExecutorImpl implements OperationExecutor {
    private final Clock clock;
    private final String superuserRole;
    private final QueryHistory history;

    /**
     * @param clock 时钟（测试中可以固定）
     * @param superuserRole 超级用户角色名，该角色通过所有权限检查
     * @param history 查询历史，为 null 时不记录
     */
    public OperationExecutorImpl(Clock clock, String superuserRole, QueryHistory history) {
        this.clock = clock;
        this.superuserRole = superuserRole;
        this.history = history;
    }

    public OperationExecutorImpl(String superuserRole) {
        this(Clock.systemUTC(), superuserRole, null);
    }

    @Override
    public ExecutionResult execute(Document document, Operation operation, String actingRole) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation must not be null");
        }
        if (document == null) {
            throw new IllegalArgumentException("Document must not be null");
        }

        long start = System.nanoTime();
        ExecutionResult result;
        try {
            result = operation.accept(new Handler(document, actingRole, clock.instant()));
        } catch (OperationException e) {
            log.warn("⚠️ 操作 {} 执行失败 [{}]: {}", operation.getType().getWireName(), e.getKind().getLabel(), e.getMessage());
            result = ExecutionResult.error(operation.getType(), e);
        } catch (RuntimeException e) {
            log.error("❌ 操作 {} 执行时发生意外错误", operation.getType().getWireName(), e);
            result = ExecutionResult.error(operation.getType(), new ValidationException(
                    "Operation " + operation.getType().getWireName() + " failed unexpectedly: " + e.getMessage()));
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        if (result.getStatus() == ExecutionStatus.SUCCESS) {
            log.info("✅ {} 成功: {} (revision={})", operation.getType().getWireName(), result.getDetail(), document.revision());
        } else if (result.getStatus() == ExecutionStatus.SKIPPED) {
            log.info("跳过 {}: {}", operation.getType().getWireName(), result.getDetail());
        }
        if (history != null) {
            try {
                history.record(operation, result, elapsedMs);
            } catch (RuntimeException e) {
                // 文档已经修改，历史写入失败不影响执行结果
                log.error("查询历史记录失败: {}", operation.getType().getWireName(), e);
            }
        }
        return result;
    }

    /**
     * 单次执行的上下文
     */
    private final class Handler implements OperationVisitor<ExecutionResult, OperationException> {
        private final Document document;
        private final String actingRole;
        private final Instant now;

        private Handler(Document document, String actingRole, Instant now) {
            this.document = document;
            this.actingRole = actingRole;
            this.now = now;
        }

        // ---------------------------------------------------------------- DDL

        @Override
        public ExecutionResult visitCreateTable(CreateTableOperation operation) throws OperationException {
            String name = requireTableName(operation.getTable());
            Table existing = document.table(name);
            IfExistsPolicy policy = operation.getIfExists() == null ? IfExistsPolicy.ABORT : operation.getIfExists();

            if (existing != null) {
                if (policy == IfExistsPolicy.SKIP) {
                    return ExecutionResult.skipped(operation.getType(),
                            "Table \"" + name + "\" already exists; skipping creation as requested.");
                }
                if (policy == IfExistsPolicy.ABORT) {
                    throw new ConflictException("Table \"" + name + "\" already exists.");
                }
                checkPrivilege(existing, Privilege.DROP);
            } else {
                requireActingRoleExists();
            }

            List<ColumnDefinition> definitions = ColumnRules.buildColumns(operation.getColumns());
            Table table = Table.builder()
                    .name(name)
                    .description(operation.getDescription())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            for (ColumnDefinition column : definitions) {
                table.getColumns().put(column.getName(), column);
                table.getColumnOrder().add(column.getName());
                if (column.isPrimaryKey()) {
                    table.setPrimaryKey(column.getName());
                }
            }
            if (actingRole != null && !isSuperuser()) {
                table.getPermissions().put(actingRole, TablePermission.builder()
                        .role(actingRole)
                        .privileges(EnumSet.allOf(Privilege.class))
                        .grantedAt(now)
                        .build());
            }

            document.getTables().put(name, table);
            document.bumpRevision(now);
            String detail = existing == null
                    ? "Created table \"" + name + "\" with " + definitions.size() + " column(s)."
                    : "Replaced table \"" + name + "\" with " + definitions.size() + " column(s) (removed "
                    + existing.getRows().size() + " row(s)).";
            return ExecutionResult.success(operation.getType(), detail);
        }

        @Override
        public ExecutionResult visitDropTable(DropTableOperation operation) throws OperationException {
            String name = requireTableName(operation.getTable());
            Table table = document.table(name);
            if (table == null) {
                if (operation.isIfExists()) {
                    return ExecutionResult.skipped(operation.getType(),
                            "Table \"" + name + "\" does not exist; skipping drop as requested.");
                }
                throw new NotFoundException("Table \"" + name + "\" does not exist.");
            }
            checkPrivilege(table, Privilege.DROP);

            document.getTables().remove(name);
            document.bumpRevision(now);
            return ExecutionResult.success(operation.getType(),
                    "Dropped table \"" + name + "\" (removed " + table.getRows().size() + " row(s)).");
        }

        @Override
        public ExecutionResult visitAddColumn(AddColumnOperation operation) throws OperationException {
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());

            if (operation.getColumn() == null) {
                throw new SchemaException("Column definition cannot be empty.");
            }
            String requested = operation.getColumn().getName() == null ? "" : operation.getColumn().getName().trim();
            if (table.hasColumn(requested)) {
                throw new ConflictException("Column \"" + requested + "\" already exists on table \""
                        + table.getName() + "\".");
            }
            ColumnDefinition column = ColumnRules.validateColumnBlueprint(operation.getColumn(), table.getColumnOrder());
            boolean hasRows = !table.getRows().isEmpty();
            if (column.isPrimaryKey()) {
                if (table.getPrimaryKey() != null) {
                    throw new SchemaException("Table \"" + table.getName() + "\" already has primary key \""
                            + table.getPrimaryKey() + "\".");
                }
                if (hasRows) {
                    throw new SchemaException("Cannot add primary key column \"" + column.getName()
                            + "\" to a table that already contains rows.");
                }
            }
            if (hasRows && !column.isNullable() && column.getDefaultValue() == null) {
                throw new ValidationException("Column \"" + column.getName()
                        + "\" is not nullable and has no default value, but table \"" + table.getName()
                        + "\" already contains rows.");
            }
            List<String> order = ColumnRules.nextColumnOrder(table.getColumnOrder(), column.getName(),
                    operation.getPosition());

            table.getColumns().put(column.getName(), column);
            table.setColumnOrder(order);
            if (column.isPrimaryKey()) {
                table.setPrimaryKey(column.getName());
            }
            if (column.getDefaultValue() != null) {
                for (Map<String, Object> row : table.getRows()) {
                    row.put(column.getName(), Json.deepCopy(column.getDefaultValue()));
                }
            }
            touch(table);
            return ExecutionResult.success(operation.getType(),
                    "Added column \"" + column.getName() + "\" to table \"" + table.getName() + "\".");
        }

        @Override
        public ExecutionResult visitDropColumn(DropColumnOperation operation) throws OperationException {
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());

            String columnName = operation.getColumn();
            if (columnName == null || !table.hasColumn(columnName)) {
                throw new NotFoundException("Column \"" + columnName + "\" does not exist on table \""
                        + table.getName() + "\".");
            }
            if (columnName.equals(table.getPrimaryKey())) {
                throw new SchemaException("Cannot drop primary key column \"" + columnName + "\".");
            }

            table.getColumns().remove(columnName);
            table.getColumnOrder().remove(columnName);
            for (Map<String, Object> row : table.getRows()) {
                row.remove(columnName);
            }
            touch(table);
            return ExecutionResult.success(operation.getType(),
                    "Removed column \"" + columnName + "\" from table \"" + table.getName() + "\".");
        }

        // ---------------------------------------------------------------- DML

        @Override
        public ExecutionResult visitInsert(InsertOperation operation) throws OperationException {
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());

            List<Map<String, Object>> incoming = operation.getRows();
            if (incoming == null || incoming.isEmpty()) {
                throw new ValidationException("Insert operation requires at least one row.");
            }

            String primaryKey = table.getPrimaryKey();
            Set<Object> seenKeys = new HashSet<>();
            if (primaryKey != null) {
                for (Map<String, Object> row : table.getRows()) {
                    seenKeys.add(row.get(primaryKey));
                }
            }

            List<Map<String, Object>> prepared = new ArrayList<>(incoming.size());
            for (int i = 0; i < incoming.size(); i++) {
                Map<String, Object> record = prepareRow(table, incoming.get(i), i + 1);
                if (primaryKey != null) {
                    Object key = record.get(primaryKey);
                    if (key == null) {
                        throw new ValidationException("Row " + (i + 1) + ": primary key column \"" + primaryKey
                                + "\" requires a value.");
                    }
                    if (!seenKeys.add(key)) {
                        throw new ValidationException("Row " + (i + 1) + ": duplicate primary key value "
                                + key + " for column \"" + primaryKey + "\".");
                    }
                }
                prepared.add(record);
            }

            table.getRows().addAll(prepared);
            touch(table);
            return ExecutionResult.builder()
                    .type(operation.getType())
                    .status(ExecutionStatus.SUCCESS)
                    .detail("Inserted " + prepared.size() + " row(s) into \"" + table.getName() + "\".")
                    .affectedRows(prepared.size())
                    .build();
        }

        @Override
        public ExecutionResult visitUpdate(UpdateOperation operation) throws OperationException {
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());
            requireScope(operation.getCriteria(), operation.isAllRows(), "Update");

            Map<String, Object> changes = operation.getChanges();
            if (changes == null || changes.isEmpty()) {
                throw new ValidationException("Update operation requires at least one field to change.");
            }
            Map<String, Object> coerced = new LinkedHashMap<>();
            for (Map.Entry<String, Object> change : changes.entrySet()) {
                ColumnDefinition column = table.column(change.getKey());
                if (column == null) {
                    throw new NotFoundException("Column \"" + change.getKey() + "\" does not exist on table \""
                            + table.getName() + "\".");
                }
                coerced.put(column.getName(), ColumnRules.coerceValue(column, change.getValue()));
            }

            Predicate<Map<String, Object>> predicate = CriteriaEvaluator.predicate(operation.getCriteria());
            List<Map<String, Object>> nextRows = new ArrayList<>(table.getRows().size());
            int affected = 0;
            for (Map<String, Object> row : table.getRows()) {
                if (predicate.test(row)) {
                    Map<String, Object> updated = new LinkedHashMap<>(row);
                    updated.putAll(coerced);
                    nextRows.add(updated);
                    affected++;
                } else {
                    nextRows.add(row);
                }
            }

            String primaryKey = table.getPrimaryKey();
            if (primaryKey != null && coerced.containsKey(primaryKey) && affected > 0) {
                Set<Object> keys = new HashSet<>();
                for (Map<String, Object> row : nextRows) {
                    if (!keys.add(row.get(primaryKey))) {
                        throw new ValidationException("Update would create duplicate primary key value "
                                + row.get(primaryKey) + " for column \"" + primaryKey + "\".");
                    }
                }
            }

            table.setRows(nextRows);
            touch(table);
            return ExecutionResult.builder()
                    .type(operation.getType())
                    .status(ExecutionStatus.SUCCESS)
                    .detail("Updated " + affected + " row(s) on \"" + table.getName() + "\".")
                    .affectedRows(affected)
                    .build();
        }

        @Override
        public ExecutionResult visitDelete(DeleteOperation operation) throws OperationException {
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());
            requireScope(operation.getCriteria(), operation.isAllRows(), "Delete");

            Predicate<Map<String, Object>> predicate = CriteriaEvaluator.predicate(operation.getCriteria());
            int before = table.getRows().size();
            table.getRows().removeIf(predicate);
            int removed = before - table.getRows().size();

            touch(table);
            return ExecutionResult.builder()
                    .type(operation.getType())
                    .status(ExecutionStatus.SUCCESS)
                    .detail("Deleted " + removed + " row(s) from \"" + table.getName() + "\".")
                    .affectedRows(removed)
                    .build();
        }

        // ---------------------------------------------------------------- DQL

        @Override
        public ExecutionResult visitSelect(SelectOperation operation) throws OperationException {
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());

            List<String> projection = operation.getColumns() == null || operation.getColumns().isEmpty()
                    ? new ArrayList<>(table.getColumnOrder())
                    : new ArrayList<>(operation.getColumns());
            for (String column : projection) {
                requireColumn(table, column);
            }
            List<OrderByClause> orderBy = operation.getOrderBy() == null ? List.of() : operation.getOrderBy();
            for (OrderByClause clause : orderBy) {
                requireColumn(table, clause.getColumn());
            }
            Integer limit = operation.getLimit();
            if (limit != null && limit < 0) {
                throw new ValidationException("Limit must be non-negative, got " + limit + ".");
            }

            List<Map<String, Object>> matched = table.getRows().stream()
                    .filter(CriteriaEvaluator.predicate(operation.getCriteria()))
                    .collect(Collectors.toCollection(ArrayList::new));
            if (!orderBy.isEmpty()) {
                // List.sort 是稳定排序
                matched.sort(rowComparator(orderBy));
            }
            List<Map<String, Object>> limited = limit == null || limit >= matched.size()
                    ? matched : matched.subList(0, limit);

            List<Map<String, Object>> rows = new ArrayList<>(limited.size());
            for (Map<String, Object> row : limited) {
                Map<String, Object> projected = new LinkedHashMap<>();
                for (String column : projection) {
                    if (row.containsKey(column)) {
                        projected.put(column, Json.deepCopy(row.get(column)));
                    }
                }
                rows.add(projected);
            }

            QueryResultSet resultSet = QueryResultSet.builder()
                    .title("Query on " + table.getName())
                    .columns(projection)
                    .rows(rows)
                    .rowCount(matched.size())
                    .limit(limit)
                    .build();
            return ExecutionResult.builder()
                    .type(operation.getType())
                    .status(ExecutionStatus.SUCCESS)
                    .detail("Retrieved " + rows.size() + " row(s) (scanned " + matched.size() + ").")
                    .resultSet(resultSet)
                    .build();
        }

        // ---------------------------------------------------------------- DCL

        @Override
        public ExecutionResult visitGrant(GrantOperation operation) throws OperationException {
            String roleName = requireRoleName(operation.getRole());
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());
            EnumSet<Privilege> privileges = PrivilegeRules.normalize(operation.getPrivileges());

            Role role = document.getRoles().get(roleName);
            if (role == null) {
                role = Role.builder()
                        .name(roleName)
                        .description(operation.getDescription())
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                document.getRoles().put(roleName, role);
            } else if (operation.getDescription() != null && !operation.getDescription().isBlank()) {
                role.setDescription(operation.getDescription());
                role.setUpdatedAt(now);
            }

            TablePermission permission = table.getPermissions().get(roleName);
            if (permission == null) {
                permission = TablePermission.builder().role(roleName).build();
                table.getPermissions().put(roleName, permission);
            }
            EnumSet<Privilege> merged = permission.getPrivileges() == null
                    ? EnumSet.noneOf(Privilege.class) : EnumSet.copyOf(permission.getPrivileges());
            merged.addAll(privileges);
            permission.setPrivileges(merged);
            permission.setGrantedAt(now);

            touch(table);
            return ExecutionResult.success(operation.getType(), "Granted " + describe(privileges) + " on \""
                    + table.getName() + "\" to role \"" + roleName + "\".");
        }

        @Override
        public ExecutionResult visitRevoke(RevokeOperation operation) throws OperationException {
            String roleName = requireRoleName(operation.getRole());
            Table table = requireTable(operation.getTable());
            checkPrivilege(table, operation.getType().getRequiredPrivilege());
            EnumSet<Privilege> privileges = PrivilegeRules.normalize(operation.getPrivileges());

            TablePermission permission = table.getPermissions().get(roleName);
            if (permission == null) {
                throw new NotFoundException("Role \"" + roleName + "\" has no privileges on table \""
                        + table.getName() + "\".");
            }
            EnumSet<Privilege> remaining = permission.getPrivileges() == null
                    ? EnumSet.noneOf(Privilege.class) : EnumSet.copyOf(permission.getPrivileges());
            remaining.removeAll(privileges);
            if (remaining.isEmpty()) {
                table.getPermissions().remove(roleName);
            } else {
                permission.setPrivileges(remaining);
            }

            touch(table);
            return ExecutionResult.success(operation.getType(), "Revoked " + describe(privileges) + " on \""
                    + table.getName() + "\" from role \"" + roleName + "\".");
        }

        // ---------------------------------------------------------------- helpers

        private String requireTableName(String name) throws SchemaException {
            if (name == null || name.isBlank()) {
                throw new SchemaException("Table name cannot be empty.");
            }
            return name.trim();
        }

        private String requireRoleName(String name) throws ValidationException {
            if (name == null || name.isBlank()) {
                throw new ValidationException("Role name cannot be empty.");
            }
            return name.trim();
        }

        private Table requireTable(String name) throws NotFoundException {
            Table table = name == null ? null : document.table(name);
            if (table == null) {
                throw new NotFoundException("Table \"" + name + "\" does not exist.");
            }
            return table;
        }

        private void requireColumn(Table table, String column) throws NotFoundException {
            if (column == null || !table.hasColumn(column)) {
                throw new NotFoundException("Column \"" + column + "\" does not exist on table \""
                        + table.getName() + "\".");
            }
        }

        private void requireScope(List<CriteriaCondition> criteria, boolean allRows, String action)
                throws ValidationException {
            boolean hasCriteria = criteria != null && !criteria.isEmpty();
            if (!hasCriteria && !allRows) {
                throw new ValidationException(action + " requires criteria; set allRows to true to affect every row.");
            }
            if (hasCriteria && allRows) {
                throw new ValidationException(action + " cannot combine criteria with allRows.");
            }
        }

        private boolean isSuperuser() {
            return actingRole != null && actingRole.equals(superuserRole);
        }

        private void requireActingRoleExists() throws NotFoundException {
            if (actingRole != null && !isSuperuser() && !document.getRoles().containsKey(actingRole)) {
                throw new NotFoundException("Role \"" + actingRole + "\" does not exist.");
            }
        }

        private void checkPrivilege(Table table, Privilege privilege) throws OperationException {
            if (actingRole == null || isSuperuser() || privilege == null) {
                return;
            }
            requireActingRoleExists();
            if (!PrivilegeRules.resolvePrivilege(table, actingRole, privilege)) {
                throw new PrivilegeException("Role \"" + actingRole + "\" lacks the \"" + privilege.getValue()
                        + "\" privilege on table \"" + table.getName() + "\".");
            }
        }

        /**
         * 构造一条待插入的行：校验列名，填充默认值，按列类型转换
         */
        private Map<String, Object> prepareRow(Table table, Map<String, Object> row, int rowNumber)
                throws ValidationException {
            if (row == null) {
                throw new ValidationException("Row " + rowNumber + ": row cannot be empty.");
            }
            for (String key : row.keySet()) {
                if (!table.hasColumn(key)) {
                    throw new ValidationException("Row " + rowNumber + ": column \"" + key
                            + "\" does not exist on table \"" + table.getName() + "\".");
                }
            }
            Map<String, Object> record = new LinkedHashMap<>();
            for (String columnName : table.getColumnOrder()) {
                ColumnDefinition column = table.column(columnName);
                Object value;
                if (row.containsKey(columnName)) {
                    value = row.get(columnName);
                } else if (column.getDefaultValue() != null) {
                    value = column.getDefaultValue();
                } else if (!column.isNullable()) {
                    throw new ValidationException("Row " + rowNumber + ": column \"" + columnName
                            + "\" requires a value.");
                } else {
                    continue;
                }
                try {
                    record.put(columnName, ColumnRules.coerceValue(column, value));
                } catch (ValidationException e) {
                    throw new ValidationException("Row " + rowNumber + ": " + e.getMessage());
                }
            }
            return record;
        }

        private void touch(Table table) {
            table.setUpdatedAt(now);
            document.bumpRevision(now);
        }
    }

    /**
     * 多列排序。值先按种类排：null 最前，其次是数字和布尔值（按数值比较），最后是字符串及其他值（按字符串比较）。
     * 混合类型的 json 列也能得到全序
     */
    static Comparator<Map<String, Object>> rowComparator(List<OrderByClause> orderBy) {
        return (left, right) -> {
            for (OrderByClause clause : orderBy) {
                int direction = clause.getDirection() == SortDirection.DESC ? -1 : 1;
                int result = compareValues(left.get(clause.getColumn()), right.get(clause.getColumn()));
                if (result != 0) {
                    return result * direction;
                }
            }
            return 0;
        };
    }

    static int compareValues(Object left, Object right) {
        if (Objects.equals(left, right)) {
            return 0;
        }
        BigDecimal l = numericValue(left);
        BigDecimal r = numericValue(right);
        int rank = Integer.compare(rank(left, l), rank(right, r));
        if (rank != 0) {
            return rank;
        }
        if (left == null) {
            return 0;
        }
        if (l != null) {
            return l.compareTo(r);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static int rank(Object value, BigDecimal numeric) {
        if (value == null) {
            return 0;
        }
        return numeric != null ? 1 : 2;
    }

    private static BigDecimal numericValue(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return CriteriaEvaluator.toNumber(value);
        }
        return null;
    }

    private static String describe(Set<Privilege> privileges) {
        return privileges.stream().map(Privilege::getValue).collect(Collectors.joining(", "));
    }
}
