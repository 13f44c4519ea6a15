package com.example.crmaccess.directory.model;

import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Optional;

/**
 * CRM modules whose record visibility can be resolved.
 * Each constant maps to exactly one {@link ModuleRecord} variant.
 */
public enum CrmModule {

    CONTACTS("Contacts");

    private final String apiName;

    CrmModule(String apiName) {
        this.apiName = apiName;
    }

    /**
     * Module name as used by the CRM API and in sharing rules / profile permissions.
     */
    public String apiName() {
        return apiName;
    }

    public static Optional<CrmModule> fromApiName(@Nullable String apiName) {
        if (apiName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(module -> module.apiName.equals(apiName))
                .findFirst();
    }
}
