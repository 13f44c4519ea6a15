package com.example.crmaccess.directory.repository;

import com.example.crmaccess.directory.document.SharingRuleDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repository for organization sharing rules.
 */
@Repository
public interface SharingRuleRepository extends ReactiveMongoRepository<SharingRuleDoc, String> {

    /**
     * Active rules for a module, oldest first. The first element is the one consulted.
     */
    Flux<SharingRuleDoc> findByOrganizationIdAndModuleNameAndActiveTrueOrderByCreatedAtAscIdAsc(
            String organizationId,
            String moduleName);
}
