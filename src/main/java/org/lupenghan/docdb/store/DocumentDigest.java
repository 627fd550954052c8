package org.lupenghan.docdb.store;

import org.lupenghan.docdb.schema.models.ColumnDefinition;
import org.lupenghan.docdb.schema.models.Document;
import org.lupenghan.docdb.schema.models.Privilege;
import org.lupenghan.docdb.schema.models.Role;
import org.lupenghan.docdb.schema.models.Table;
import org.lupenghan.docdb.schema.models.TablePermission;
import org.lupenghan.docdb.utils.Json;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 生成给外部规划器使用的纯文本文档摘要：表结构、少量样例行、权限和角色
 */
public final class DocumentDigest {

    private DocumentDigest() {
    }

    public static String format(Document document, int maxRows) {
        StringBuilder sb = new StringBuilder();
        if (document.getTables().isEmpty()) {
            line(sb, "No tables are currently defined.");
        }
        for (Table table : document.getTables().values()) {
            line(sb, "Table \"" + table.getName() + "\" (" + table.getRows().size() + " row(s), "
                    + table.getColumnOrder().size() + " column(s))");
            if (table.getDescription() != null && !table.getDescription().isBlank()) {
                line(sb, "  Description: " + table.getDescription());
            }
            line(sb, "  Columns:");
            for (String columnName : table.getColumnOrder()) {
                line(sb, "    - " + describeColumn(table.column(columnName)));
            }
            List<Map<String, Object>> rows = table.getRows();
            if (!rows.isEmpty() && maxRows > 0) {
                line(sb, "  Sample rows:");
                for (Map<String, Object> row : rows.subList(0, Math.min(maxRows, rows.size()))) {
                    line(sb, "    " + Json.compact(row));
                }
            }
            if (!table.getPermissions().isEmpty()) {
                line(sb, "  Permissions:");
                for (TablePermission permission : table.getPermissions().values()) {
                    line(sb, "    - " + permission.getRole() + ": " + permission.getPrivileges().stream()
                            .map(Privilege::getValue)
                            .collect(Collectors.joining(", ")));
                }
            }
        }
        if (!document.getRoles().isEmpty()) {
            line(sb, "Roles:");
            for (Role role : document.getRoles().values()) {
                String description = role.getDescription() == null || role.getDescription().isBlank()
                        ? "" : " (" + role.getDescription() + ")";
                line(sb, "  - " + role.getName() + description);
            }
        }
        return sb.toString().stripTrailing();
    }

    private static String describeColumn(ColumnDefinition column) {
        StringBuilder sb = new StringBuilder(column.getName()).append(": ").append(column.getDataType());
        if (column.isPrimaryKey()) {
            sb.append(" PRIMARY KEY");
        }
        if (!column.isNullable()) {
            sb.append(" NOT NULL");
        }
        if (column.getDefaultValue() != null) {
            sb.append(" DEFAULT ").append(Json.compact(column.getDefaultValue()));
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(text).append('\n');
    }
}
