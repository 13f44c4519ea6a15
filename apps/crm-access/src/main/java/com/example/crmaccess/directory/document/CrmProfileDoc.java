package com.example.crmaccess.directory.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

/**
 * MongoDB document for a CRM profile with its module permissions embedded.
 */
@Data
@Builder
@Document(collection = "crm_profiles")
public class CrmProfileDoc {

    @Id
    private String id;

    private String displayLabel;

    @Indexed
    private String organizationId;

    private boolean custom;

    private List<PermissionEntry> permissions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PermissionEntry {

        /**
         * Module API name, e.g. "Contacts".
         */
        private String module;

        private boolean enabled;
    }
}
