package com.example.crmaccess.directory.repository;

import com.example.crmaccess.directory.document.ContactDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Repository for synced contacts.
 */
@Repository
public interface ContactRepository extends ReactiveMongoRepository<ContactDoc, String> {

    Mono<ContactDoc> findByExternalId(String externalId);
}
