package com.example.crmaccess.directory.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for a CRM user mirrored by the directory sync.
 */
@Data
@Builder
@Document(collection = "crm_users")
@CompoundIndex(name = "org_active_idx", def = "{'organizationId': 1, 'active': 1}")
public class CrmUserDoc {

    @Id
    private String id;

    /**
     * CRM user id.
     */
    @Indexed(unique = true, sparse = true)
    private String externalId;

    private String email;

    private String name;

    private String organizationId;

    private boolean active;

    private String profileId;

    private String roleId;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
