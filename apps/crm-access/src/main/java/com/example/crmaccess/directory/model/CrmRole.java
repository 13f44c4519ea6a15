package com.example.crmaccess.directory.model;

import org.springframework.lang.Nullable;

/**
 * Node of the organization's role hierarchy.
 *
 * @param id             CRM role id
 * @param displayLabel   label shown in the CRM
 * @param reportsToId    parent role; null for a root
 * @param organizationId owning organization
 */
public record CrmRole(
        String id,
        String displayLabel,
        @Nullable String reportsToId,
        String organizationId
) {
}
