package com.example.crmaccess.directory.model;

import org.springframework.lang.Nullable;

/**
 * Contact record, reduced to the attributes that matter for visibility.
 *
 * @param id              local identifier
 * @param externalId      CRM-issued identifier
 * @param linkedUserId    local id of the user the contact was synced for
 * @param ownerExternalId CRM user id of the owner, when stored directly
 * @param organizationId  owning organization, when stored directly
 */
public record ContactRecord(
        String id,
        @Nullable String externalId,
        @Nullable String linkedUserId,
        @Nullable String ownerExternalId,
        @Nullable String organizationId
) implements ModuleRecord {

    @Override
    public CrmModule module() {
        return CrmModule.CONTACTS;
    }
}
