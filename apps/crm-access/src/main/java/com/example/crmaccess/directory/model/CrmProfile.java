package com.example.crmaccess.directory.model;

import java.util.List;

/**
 * Permission template assigned to users, independent of their role.
 */
public record CrmProfile(
        String id,
        String displayLabel,
        String organizationId,
        List<ModulePermission> permissions
) {
    public CrmProfile {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
