package org.lupenghan.docdb.store.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.lupenghan.docdb.schema.models.Privilege;

import java.util.List;

@Value
@Builder
@Jacksonized
public class PermissionSummary {
    String role;
    List<Privilege> privileges;
}
