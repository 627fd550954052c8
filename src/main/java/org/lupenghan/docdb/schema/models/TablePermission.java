package org.lupenghan.docdb.schema.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;

/**
 * 某个角色在某张表上的权限集合，集合为空时整条记录应被删除
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TablePermission {
    private String role;
    @Builder.Default
    private EnumSet<Privilege> privileges = EnumSet.noneOf(Privilege.class);
    private Instant grantedAt;
}
