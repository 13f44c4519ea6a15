package com.example.crmaccess.access.service;

import com.example.crmaccess.access.exception.AccessConfigurationException;
import com.example.crmaccess.access.exception.RecordNotFoundException;
import com.example.crmaccess.access.hierarchy.RoleHierarchy;
import com.example.crmaccess.access.hierarchy.RoleHierarchyBuilder;
import com.example.crmaccess.access.model.AccessType;
import com.example.crmaccess.access.model.RecordOwnership;
import com.example.crmaccess.access.model.RecordResolution;
import com.example.crmaccess.access.model.ResolutionResult;
import com.example.crmaccess.access.permission.PermissionEvaluator;
import com.example.crmaccess.common.util.StringSanitizer;
import com.example.crmaccess.directory.DirectoryStore;
import com.example.crmaccess.directory.model.CrmModule;
import com.example.crmaccess.directory.model.CrmUser;
import com.example.crmaccess.directory.model.ModuleRecord;
import com.example.crmaccess.directory.model.SharingRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Computes which CRM users can view a record, mirroring the CRM's own rules
 * without calling its permission API.
 *
 * <p>Decision order:
 * <ol>
 *   <li>locate the record by local id, then by CRM id</li>
 *   <li>derive owner and organization</li>
 *   <li>read the organization's sharing rule for the module</li>
 *   <li>public / public_read_only: every active user whose profile enables the module</li>
 *   <li>private: the owner plus users at or above the owner's role level with module access</li>
 * </ol>
 *
 * <p>Stateless and read-only. Missing owner, profile or role are fail-closed results, not errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessResolver {

    private final DirectoryStore directoryStore;
    private final PermissionEvaluator permissionEvaluator;
    private final RoleHierarchyBuilder hierarchyBuilder;
    private final RecordOwnershipExtractor ownershipExtractor;

    /**
     * Resolve the users allowed to view one record.
     *
     * @param moduleName module API name, e.g. "Contacts"
     * @param recordId   local or CRM-issued record id
     * @return Mono emitting the result, or erroring with {@link RecordNotFoundException}
     *         or {@link AccessConfigurationException}
     */
    public Mono<ResolutionResult> resolve(String moduleName, String recordId) {
        return resolve(moduleName, recordId, new HierarchyCache(this::loadHierarchy));
    }

    /**
     * Resolve several records of one module. Each organization's role hierarchy is built once
     * for the whole batch. Not-found and configuration failures are reported per record.
     */
    public Flux<RecordResolution> resolveAll(String moduleName, List<String> recordIds) {
        HierarchyCache hierarchies = new HierarchyCache(this::loadHierarchy);

        return Flux.fromIterable(recordIds)
                .concatMap(recordId -> resolve(moduleName, recordId, hierarchies)
                        .map(result -> RecordResolution.resolved(recordId, result))
                        .onErrorResume(RecordNotFoundException.class, e -> Mono.just(
                                RecordResolution.failed(recordId, RecordResolution.NOT_FOUND, e.getMessage())))
                        .onErrorResume(AccessConfigurationException.class, e -> Mono.just(
                                RecordResolution.failed(recordId, RecordResolution.CONFIGURATION_ERROR, e.getMessage()))));
    }

    private Mono<ResolutionResult> resolve(String moduleName, String recordId, HierarchyCache hierarchies) {
        CrmModule module = CrmModule.fromApiName(moduleName).orElse(null);
        if (module == null) {
            return Mono.error(AccessConfigurationException.unsupportedModule(moduleName));
        }

        log.debug("Checking permissions for module {} with record id {}",
                moduleName, StringSanitizer.forLog(recordId));

        return findRecord(module, recordId)
                .flatMap(ownershipExtractor::extract)
                .flatMap(ownership -> {
                    if (!ownership.hasOrganization()) {
                        return Mono.error(AccessConfigurationException.organizationUndetermined(moduleName, recordId));
                    }
                    log.debug("Record {} owner={}, organization={}",
                            StringSanitizer.forLog(recordId),
                            StringSanitizer.forLog(ownership.ownerExternalId()),
                            StringSanitizer.forLog(ownership.organizationId()));

                    return directoryStore.getSharingRule(ownership.organizationId(), moduleName)
                            .switchIfEmpty(Mono.error(() -> AccessConfigurationException.sharingRuleMissing(moduleName)))
                            .flatMap(rule -> dispatch(rule, ownership, moduleName, hierarchies));
                });
    }

    private Mono<ModuleRecord> findRecord(CrmModule module, String recordId) {
        return directoryStore.findRecordByPrimaryId(module, recordId)
                .switchIfEmpty(Mono.defer(() -> directoryStore.findRecordByExternalId(module, recordId)))
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException(module.apiName(), recordId)));
    }

    private Mono<ResolutionResult> dispatch(
            SharingRule rule,
            RecordOwnership ownership,
            String moduleName,
            HierarchyCache hierarchies) {

        AccessType accessType = AccessType.fromShareType(rule.shareType()).orElse(null);
        if (accessType == null) {
            return Mono.error(AccessConfigurationException.unsupportedShareType(rule.shareType()));
        }

        log.debug("Sharing rule {} for module {}: {}", rule.id(), moduleName, accessType.shareType());

        if (accessType.isPublic()) {
            return resolvePublic(ownership.organizationId(), moduleName, accessType);
        }
        return resolvePrivate(ownership, moduleName, hierarchies);
    }

    private Mono<ResolutionResult> resolvePublic(String organizationId, String moduleName, AccessType accessType) {
        return directoryStore.listActiveUsers(organizationId)
                .filter(user -> user.active() && user.externalId() != null)
                .filterWhen(user -> permissionEvaluator.hasModuleAccess(user, moduleName))
                .map(CrmUser::externalId)
                .collectList()
                .map(userIds -> ResolutionResult.publicAccess(accessType, userIds));
    }

    private Mono<ResolutionResult> resolvePrivate(
            RecordOwnership ownership,
            String moduleName,
            HierarchyCache hierarchies) {

        if (!ownership.hasOwner()) {
            log.warn("No record owner for private module {}, returning empty access", moduleName);
            return Mono.just(ResolutionResult.empty(AccessType.PRIVATE));
        }

        String ownerId = ownership.ownerExternalId();

        return directoryStore.findUserByExternalId(ownerId)
                .flatMap(owner -> permissionEvaluator.hasModuleAccess(owner, moduleName)
                        .flatMap(ownerHasAccess -> {
                            if (!ownerHasAccess) {
                                log.warn("Owner {} has no access to module {}, returning empty access",
                                        StringSanitizer.forLog(ownerId), moduleName);
                                return Mono.just(ResolutionResult.empty(AccessType.PRIVATE));
                            }
                            return resolveOwnerHierarchy(owner, ownerId, ownership.organizationId(),
                                    moduleName, hierarchies);
                        }))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Owner user {} not found, returning empty access", StringSanitizer.forLog(ownerId));
                    return ResolutionResult.empty(AccessType.PRIVATE);
                }));
    }

    private Mono<ResolutionResult> resolveOwnerHierarchy(
            CrmUser owner,
            String ownerId,
            String organizationId,
            String moduleName,
            HierarchyCache hierarchies) {

        if (owner.roleId() == null) {
            log.warn("Owner {} has no role assigned, only the owner has access", StringSanitizer.forLog(ownerId));
            return Mono.just(ResolutionResult.ownerOnly(ownerId));
        }

        return hierarchies.get(organizationId)
                .flatMap(hierarchy -> {
                    OptionalInt ownerLevel = hierarchy.levelOf(owner.roleId());
                    if (ownerLevel.isEmpty()) {
                        log.warn("Role {} of owner {} is not in the hierarchy of organization {}, only the owner has access",
                                StringSanitizer.forLog(owner.roleId()),
                                StringSanitizer.forLog(ownerId),
                                StringSanitizer.forLog(organizationId));
                        return Mono.just(ResolutionResult.ownerOnly(ownerId));
                    }

                    Set<String> roleIds = hierarchy.rolesAtOrAbove(ownerLevel.getAsInt());
                    log.debug("Owner role {} at level {}, {} roles at or above",
                            owner.roleId(), ownerLevel.getAsInt(), roleIds.size());

                    return usersInRoles(organizationId, roleIds, moduleName)
                            .map(userIds -> ResolutionResult.hierarchy(ownerId, userIds));
                });
    }

    /**
     * Active users assigned to one of the roles and holding module access,
     * ordered by role (hierarchy order) then by user.
     */
    private Mono<List<String>> usersInRoles(String organizationId, Set<String> roleIds, String moduleName) {
        return directoryStore.listActiveUsers(organizationId)
                .filter(user -> user.active() && user.externalId() != null && user.roleId() != null
                        && roleIds.contains(user.roleId()))
                .collectList()
                .flatMapMany(users -> Flux.fromIterable(orderByRole(users, roleIds)))
                .filterWhen(user -> permissionEvaluator.hasModuleAccess(user, moduleName))
                .map(CrmUser::externalId)
                .collectList();
    }

    private static List<CrmUser> orderByRole(List<CrmUser> users, Set<String> roleIds) {
        List<CrmUser> ordered = new ArrayList<>(users.size());
        for (String roleId : roleIds) {
            for (CrmUser user : users) {
                if (roleId.equals(user.roleId())) {
                    ordered.add(user);
                }
            }
        }
        return ordered;
    }

    private Mono<RoleHierarchy> loadHierarchy(String organizationId) {
        return directoryStore.listRoles(organizationId)
                .collectList()
                .map(hierarchyBuilder::build)
                .doOnNext(hierarchy -> log.debug("Built role hierarchy of {} roles for organization {}",
                        hierarchy.size(), StringSanitizer.forLog(organizationId)));
    }
}
