package com.example.crmaccess.directory.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for a CRM role. The document id is the CRM role id.
 */
@Data
@Builder
@Document(collection = "crm_roles")
public class CrmRoleDoc {

    @Id
    private String id;

    private String name;

    private String displayLabel;

    /**
     * Parent role id; null for top-level roles.
     */
    private String reportsToId;

    @Indexed
    private String organizationId;

    private boolean active;

    @CreatedDate
    private Instant createdAt;
}
