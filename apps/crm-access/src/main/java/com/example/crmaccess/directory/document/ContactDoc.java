package com.example.crmaccess.directory.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for a synced CRM contact.
 */
@Data
@Builder
@Document(collection = "crm_contacts")
public class ContactDoc {

    @Id
    private String id;

    /**
     * CRM-issued contact id.
     */
    @Indexed(unique = true, sparse = true)
    private String externalId;

    /**
     * Local user the contact was synced for.
     */
    private String userId;

    private String ownerExternalId;

    private String organizationId;

    private String firstName;

    private String lastName;

    private String email;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
