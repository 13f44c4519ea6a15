package com.example.crmaccess.access.model;

import org.springframework.lang.Nullable;

/**
 * Owner and organization derived for a record. Either part may still be unknown.
 */
public record RecordOwnership(
        @Nullable String ownerExternalId,
        @Nullable String organizationId
) {
    public static RecordOwnership unknown() {
        return new RecordOwnership(null, null);
    }

    public boolean hasOwner() {
        return ownerExternalId != null && !ownerExternalId.isBlank();
    }

    public boolean hasOrganization() {
        return organizationId != null && !organizationId.isBlank();
    }

    public boolean isComplete() {
        return hasOwner() && hasOrganization();
    }

    /**
     * Fills only the parts that are still unknown; known parts are never overwritten.
     */
    public RecordOwnership fillMissing(@Nullable String owner, @Nullable String organization) {
        return new RecordOwnership(
                hasOwner() ? ownerExternalId : owner,
                hasOrganization() ? organizationId : organization);
    }
}
