package com.example.crmaccess.directory.repository;

import com.example.crmaccess.directory.document.CrmRoleDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repository for CRM roles.
 */
@Repository
public interface CrmRoleRepository extends ReactiveMongoRepository<CrmRoleDoc, String> {

    Flux<CrmRoleDoc> findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc(String organizationId);
}
