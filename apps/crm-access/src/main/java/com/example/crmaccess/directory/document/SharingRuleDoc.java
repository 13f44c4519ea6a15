package com.example.crmaccess.directory.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for an organization's default sharing rule of one module.
 */
@Data
@Builder
@Document(collection = "crm_sharing_rules")
@CompoundIndex(name = "org_module_active_idx", def = "{'organizationId': 1, 'moduleName': 1, 'active': 1}")
public class SharingRuleDoc {

    @Id
    private String id;

    private String organizationId;

    private String moduleName;

    /**
     * Raw CRM share type: private, public or public_read_only.
     */
    private String shareType;

    private boolean active;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
