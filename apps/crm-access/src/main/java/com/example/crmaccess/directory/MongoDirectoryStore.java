package com.example.crmaccess.directory;

import com.example.crmaccess.common.util.StringSanitizer;
import com.example.crmaccess.directory.document.ContactDoc;
import com.example.crmaccess.directory.document.CrmProfileDoc;
import com.example.crmaccess.directory.document.CrmRoleDoc;
import com.example.crmaccess.directory.document.CrmUserDoc;
import com.example.crmaccess.directory.document.SharingRuleDoc;
import com.example.crmaccess.directory.model.ContactRecord;
import com.example.crmaccess.directory.model.CrmModule;
import com.example.crmaccess.directory.model.CrmProfile;
import com.example.crmaccess.directory.model.CrmRole;
import com.example.crmaccess.directory.model.CrmUser;
import com.example.crmaccess.directory.model.ModulePermission;
import com.example.crmaccess.directory.model.ModuleRecord;
import com.example.crmaccess.directory.model.SharingRule;
import com.example.crmaccess.directory.repository.ContactRepository;
import com.example.crmaccess.directory.repository.CrmProfileRepository;
import com.example.crmaccess.directory.repository.CrmRoleRepository;
import com.example.crmaccess.directory.repository.CrmUserRepository;
import com.example.crmaccess.directory.repository.SharingRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link DirectoryStore} backed by the reactive MongoDB collections the directory sync writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoDirectoryStore implements DirectoryStore {

    private final ContactRepository contactRepository;
    private final CrmUserRepository userRepository;
    private final CrmProfileRepository profileRepository;
    private final CrmRoleRepository roleRepository;
    private final SharingRuleRepository sharingRuleRepository;

    @Override
    public Mono<ModuleRecord> findRecordByPrimaryId(CrmModule module, String id) {
        return switch (module) {
            case CONTACTS -> contactRepository.findById(id).map(MongoDirectoryStore::toContact);
        };
    }

    @Override
    public Mono<ModuleRecord> findRecordByExternalId(CrmModule module, String externalId) {
        return switch (module) {
            case CONTACTS -> contactRepository.findByExternalId(externalId).map(MongoDirectoryStore::toContact);
        };
    }

    @Override
    public Mono<CrmUser> findUserByExternalId(String externalId) {
        return userRepository.findByExternalId(externalId).map(MongoDirectoryStore::toUser);
    }

    @Override
    public Mono<CrmUser> findUserById(String id) {
        return userRepository.findById(id).map(MongoDirectoryStore::toUser);
    }

    @Override
    public Flux<CrmUser> listActiveUsers(String organizationId) {
        return userRepository.findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc(organizationId)
                .map(MongoDirectoryStore::toUser);
    }

    @Override
    public Mono<CrmProfile> getProfileWithPermissions(String profileId) {
        return profileRepository.findById(profileId).map(MongoDirectoryStore::toProfile);
    }

    @Override
    public Flux<CrmProfile> listProfiles(String organizationId) {
        return profileRepository.findByOrganizationIdOrderByDisplayLabelAsc(organizationId)
                .map(MongoDirectoryStore::toProfile);
    }

    @Override
    public Flux<CrmRole> listRoles(String organizationId) {
        return roleRepository.findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc(organizationId)
                .map(MongoDirectoryStore::toRole);
    }

    @Override
    public Mono<SharingRule> getSharingRule(String organizationId, String moduleName) {
        return sharingRuleRepository
                .findByOrganizationIdAndModuleNameAndActiveTrueOrderByCreatedAtAscIdAsc(organizationId, moduleName)
                .map(MongoDirectoryStore::toSharingRule)
                .collectList()
                .flatMap(rules -> {
                    if (rules.isEmpty()) {
                        return Mono.empty();
                    }
                    if (rules.size() > 1) {
                        log.warn("{} active sharing rules for module {} in organization {}, using oldest rule {}",
                                rules.size(),
                                StringSanitizer.forLog(moduleName),
                                StringSanitizer.forLog(organizationId),
                                rules.get(0).id());
                    }
                    return Mono.just(rules.get(0));
                });
    }

    private static ModuleRecord toContact(ContactDoc doc) {
        return new ContactRecord(
                doc.getId(),
                doc.getExternalId(),
                doc.getUserId(),
                doc.getOwnerExternalId(),
                doc.getOrganizationId());
    }

    private static CrmUser toUser(CrmUserDoc doc) {
        return new CrmUser(
                doc.getId(),
                doc.getExternalId(),
                doc.getOrganizationId(),
                doc.isActive(),
                doc.getProfileId(),
                doc.getRoleId());
    }

    private static CrmProfile toProfile(CrmProfileDoc doc) {
        List<ModulePermission> permissions = doc.getPermissions() == null
                ? List.of()
                : doc.getPermissions().stream()
                        .map(entry -> new ModulePermission(entry.getModule(), entry.isEnabled()))
                        .toList();
        return new CrmProfile(doc.getId(), doc.getDisplayLabel(), doc.getOrganizationId(), permissions);
    }

    private static CrmRole toRole(CrmRoleDoc doc) {
        return new CrmRole(doc.getId(), doc.getDisplayLabel(), doc.getReportsToId(), doc.getOrganizationId());
    }

    private static SharingRule toSharingRule(SharingRuleDoc doc) {
        return new SharingRule(
                doc.getId(),
                doc.getOrganizationId(),
                doc.getModuleName(),
                doc.getShareType(),
                doc.getCreatedAt());
    }
}
