package com.example.crmaccess.directory.model;

import org.springframework.lang.Nullable;

/**
 * CRM user as mirrored by the directory sync.
 *
 * @param id             local identifier
 * @param externalId     CRM user id; users without one can never appear in a result
 * @param organizationId organization membership
 * @param active         whether the user is active in the CRM
 * @param profileId      assigned profile, null while the directory is mid-sync
 * @param roleId         assigned role, null when the user has no place in the hierarchy
 */
public record CrmUser(
        String id,
        @Nullable String externalId,
        @Nullable String organizationId,
        boolean active,
        @Nullable String profileId,
        @Nullable String roleId
) {
}
