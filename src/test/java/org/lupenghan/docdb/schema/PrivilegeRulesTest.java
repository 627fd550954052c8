package org.lupenghan.docdb.schema;

import org.junit.Test;
import org.lupenghan.docdb.exception.ValidationException;
import org.lupenghan.docdb.schema.models.Privilege;
import org.lupenghan.docdb.schema.models.Table;
import org.lupenghan.docdb.schema.models.TablePermission;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PrivilegeRulesTest {

    @Test
    public void testResolvePrivilege() {
        Table table = Table.builder().name("users").build();
        table.getPermissions().put("analyst", TablePermission.builder()
                .role("analyst")
                .privileges(EnumSet.of(Privilege.SELECT))
                .build());

        assertTrue(PrivilegeRules.resolvePrivilege(table, "analyst", Privilege.SELECT));
        assertFalse(PrivilegeRules.resolvePrivilege(table, "analyst", Privilege.INSERT));
        assertFalse(PrivilegeRules.resolvePrivilege(table, "guest", Privilege.SELECT));
        assertTrue(PrivilegeRules.privilegesOf(table, "guest").isEmpty());
    }

    @Test
    public void testNormalize() throws Exception {
        EnumSet<Privilege> privileges = PrivilegeRules.normalize(Arrays.asList(" SELECT", "insert", "select", "", null));
        assertEquals(EnumSet.of(Privilege.SELECT, Privilege.INSERT), privileges);
        assertEquals(EnumSet.of(Privilege.MANAGE_PERMISSIONS), PrivilegeRules.normalize(List.of("Manage_Permissions")));
    }

    @Test
    public void testNormalizeRejectsUnknownAndEmpty() {
        try {
            PrivilegeRules.normalize(List.of("select", "truncate"));
            fail("未知权限应该失败");
        } catch (ValidationException e) {
            assertEquals("Privilege \"truncate\" is not supported.", e.getMessage());
        }
        try {
            PrivilegeRules.normalize(List.of(" "));
            fail("空权限列表应该失败");
        } catch (ValidationException e) {
            assertEquals("At least one privilege must be specified.", e.getMessage());
        }
    }
}
