package com.example.crmaccess.access.model;

import com.example.crmaccess.access.hierarchy.HierarchyNode;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Diagnostic view of everything that feeds a module's visibility in one organization.
 *
 * @param organizationId            organization inspected
 * @param moduleName                module inspected
 * @param shareType                 raw share type of the consulted rule, null when no rule exists
 * @param profilesWithModuleAccess  profiles enabling the module
 * @param roleHierarchy             all active roles with their computed levels
 */
public record PermissionSummary(
        String organizationId,
        String moduleName,
        @Nullable String shareType,
        List<ProfileSummary> profilesWithModuleAccess,
        List<HierarchyNode> roleHierarchy
) {
    public record ProfileSummary(String id, String displayLabel) {
    }
}
