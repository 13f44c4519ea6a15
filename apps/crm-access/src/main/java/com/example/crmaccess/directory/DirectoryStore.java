package com.example.crmaccess.directory;

import com.example.crmaccess.directory.model.CrmModule;
import com.example.crmaccess.directory.model.CrmProfile;
import com.example.crmaccess.directory.model.CrmRole;
import com.example.crmaccess.directory.model.CrmUser;
import com.example.crmaccess.directory.model.ModuleRecord;
import com.example.crmaccess.directory.model.SharingRule;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the mirrored CRM directory.
 *
 * <p>Every lookup completes empty when nothing matches; absence is never an error
 * signal. Implementations must not mutate the store.
 */
public interface DirectoryStore {

    Mono<ModuleRecord> findRecordByPrimaryId(CrmModule module, String id);

    Mono<ModuleRecord> findRecordByExternalId(CrmModule module, String externalId);

    Mono<CrmUser> findUserByExternalId(String externalId);

    Mono<CrmUser> findUserById(String id);

    /**
     * Active users of the organization, in a stable order.
     */
    Flux<CrmUser> listActiveUsers(String organizationId);

    Mono<CrmProfile> getProfileWithPermissions(String profileId);

    Flux<CrmProfile> listProfiles(String organizationId);

    /**
     * Active roles of the organization, in a stable order.
     */
    Flux<CrmRole> listRoles(String organizationId);

    /**
     * The sharing rule consulted for {@code (organizationId, moduleName)}.
     * When several active rules exist the implementation must pick the same one every time.
     */
    Mono<SharingRule> getSharingRule(String organizationId, String moduleName);
}
