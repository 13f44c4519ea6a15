package com.example.crmaccess.access.service;

import com.example.crmaccess.access.hierarchy.HierarchyNode;
import com.example.crmaccess.access.hierarchy.RoleHierarchyBuilder;
import com.example.crmaccess.access.model.PermissionSummary;
import com.example.crmaccess.access.permission.PermissionEvaluator;
import com.example.crmaccess.directory.DirectoryStore;
import com.example.crmaccess.directory.model.SharingRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Read-only diagnostic view of a module's visibility inputs in one organization.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionSummaryService {

    private final DirectoryStore directoryStore;
    private final RoleHierarchyBuilder hierarchyBuilder;

    public Mono<PermissionSummary> summarize(String organizationId, String moduleName) {
        Mono<Optional<SharingRule>> rule = directoryStore.getSharingRule(organizationId, moduleName)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());

        Mono<List<PermissionSummary.ProfileSummary>> profiles = directoryStore.listProfiles(organizationId)
                .filter(profile -> PermissionEvaluator.grants(profile, moduleName))
                .map(profile -> new PermissionSummary.ProfileSummary(profile.id(), profile.displayLabel()))
                .collectList();

        Mono<List<HierarchyNode>> hierarchy = directoryStore.listRoles(organizationId)
                .collectList()
                .map(roles -> hierarchyBuilder.build(roles).nodes());

        return Mono.zip(rule, profiles, hierarchy)
                .map(tuple -> new PermissionSummary(
                        organizationId,
                        moduleName,
                        tuple.getT1().map(SharingRule::shareType).orElse(null),
                        tuple.getT2(),
                        tuple.getT3()))
                .doOnNext(summary -> log.debug("Permission summary for module {}: {} profiles, {} roles",
                        moduleName, summary.profilesWithModuleAccess().size(), summary.roleHierarchy().size()));
    }
}
