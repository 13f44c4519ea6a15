package com.example.crmaccess.directory.repository;

import com.example.crmaccess.directory.document.CrmProfileDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repository for CRM profiles and their embedded module permissions.
 */
@Repository
public interface CrmProfileRepository extends ReactiveMongoRepository<CrmProfileDoc, String> {

    Flux<CrmProfileDoc> findByOrganizationIdOrderByDisplayLabelAsc(String organizationId);
}
