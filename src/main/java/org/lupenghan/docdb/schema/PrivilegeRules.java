package org.lupenghan.docdb.schema;

import org.lupenghan.docdb.exception.ValidationException;
import org.lupenghan.docdb.schema.models.Privilege;
import org.lupenghan.docdb.schema.models.Table;
import org.lupenghan.docdb.schema.models.TablePermission;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 表级权限的查询与规范化
 */
public final class PrivilegeRules {

    private PrivilegeRules() {
    }

    /**
     * 判断角色在表上是否拥有某项权限。没有权限记录即没有任何权限；
     * grant/revoke 只要求 manage_permissions，因此持有它的角色可以授予或回收任意权限
     * @param table 目标表
     * @param role 角色名
     * @param privilege 需要的权限
     * @return 是否拥有
     */
    public static boolean resolvePrivilege(Table table, String role, Privilege privilege) {
        return privilegesOf(table, role).contains(privilege);
    }

    public static Set<Privilege> privilegesOf(Table table, String role) {
        if (table == null || role == null) {
            return Collections.emptySet();
        }
        TablePermission permission = table.getPermissions().get(role);
        if (permission == null || permission.getPrivileges() == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(permission.getPrivileges());
    }

    /**
     * 规范化权限列表：去空白、转小写、去重，拒绝未知权限
     * @param privileges 原始权限名
     * @return 非空的权限集合
     * @throws ValidationException 列表为空或包含未知权限
     */
    public static EnumSet<Privilege> normalize(List<String> privileges) throws ValidationException {
        EnumSet<Privilege> result = EnumSet.noneOf(Privilege.class);
        if (privileges != null) {
            for (String entry : privileges) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                try {
                    result.add(Privilege.fromValue(entry));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException("Privilege \"" + entry.trim() + "\" is not supported.");
                }
            }
        }
        if (result.isEmpty()) {
            throw new ValidationException("At least one privilege must be specified.");
        }
        return result;
    }
}
