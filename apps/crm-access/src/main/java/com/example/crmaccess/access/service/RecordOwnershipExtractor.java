package com.example.crmaccess.access.service;

import com.example.crmaccess.access.exception.AccessConfigurationException;
import com.example.crmaccess.access.model.RecordOwnership;
import com.example.crmaccess.directory.DirectoryStore;
import com.example.crmaccess.directory.model.ContactRecord;
import com.example.crmaccess.directory.model.CrmModule;
import com.example.crmaccess.directory.model.ModuleRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Derives owner and organization of a record, one typed extraction per record variant.
 *
 * <p>Fallback chain, stopping as soon as both parts are known:
 * <ol>
 *   <li>fields stored on the record</li>
 *   <li>the record's linked local user</li>
 *   <li>the record found through its CRM-issued id, and that record's linked user</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordOwnershipExtractor {

    private final DirectoryStore directoryStore;

    public Mono<RecordOwnership> extract(ModuleRecord record) {
        if (record instanceof ContactRecord contact) {
            return extractContact(contact);
        }
        return Mono.error(AccessConfigurationException.unsupportedModule(record.module().apiName()));
    }

    private Mono<RecordOwnership> extractContact(ContactRecord contact) {
        RecordOwnership stored = new RecordOwnership(contact.ownerExternalId(), contact.organizationId());

        return fromLinkedUser(stored, contact.linkedUserId())
                .flatMap(ownership -> {
                    if (ownership.hasOwner() || contact.externalId() == null) {
                        return Mono.just(ownership);
                    }
                    return fromExternalRecord(ownership, contact);
                });
    }

    private Mono<RecordOwnership> fromLinkedUser(RecordOwnership current, @Nullable String linkedUserId) {
        if (current.isComplete() || linkedUserId == null) {
            return Mono.just(current);
        }
        return directoryStore.findUserById(linkedUserId)
                .map(user -> current.fillMissing(user.externalId(), user.organizationId()))
                .defaultIfEmpty(current);
    }

    private Mono<RecordOwnership> fromExternalRecord(RecordOwnership current, ContactRecord contact) {
        log.debug("Resolving owner of contact {} through external id", contact.id());
        return directoryStore.findRecordByExternalId(CrmModule.CONTACTS, contact.externalId())
                .ofType(ContactRecord.class)
                .flatMap(found -> {
                    RecordOwnership filled = current.fillMissing(found.ownerExternalId(), found.organizationId());
                    // Linked user already tried above
                    if (Objects.equals(found.linkedUserId(), contact.linkedUserId())) {
                        return Mono.just(filled);
                    }
                    return fromLinkedUser(filled, found.linkedUserId());
                })
                .defaultIfEmpty(current);
    }
}
