package com.example.crmaccess.directory.repository;

import com.example.crmaccess.directory.document.CrmUserDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for mirrored CRM users.
 */
@Repository
public interface CrmUserRepository extends ReactiveMongoRepository<CrmUserDoc, String> {

    Mono<CrmUserDoc> findByExternalId(String externalId);

    /**
     * Active users of an organization, oldest first so enumeration order is stable.
     */
    Flux<CrmUserDoc> findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc(String organizationId);
}
