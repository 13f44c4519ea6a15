package com.example.crmaccess.directory.model;

import org.springframework.lang.Nullable;

/**
 * A CRM record whose visibility can be resolved.
 * One variant per supported {@link CrmModule}; adding a module means adding a variant.
 */
public sealed interface ModuleRecord permits ContactRecord {

    /**
     * Local (primary key) identifier.
     */
    String id();

    /**
     * Identifier issued by the CRM, if the record has been synced.
     */
    @Nullable
    String externalId();

    CrmModule module();
}
