package com.example.crmaccess.access.service;

import com.example.crmaccess.access.hierarchy.RoleHierarchy;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Builds each organization's role hierarchy at most once. Scoped to a single
 * resolve call or batch, never shared across requests.
 */
final class HierarchyCache {

    private final Map<String, Mono<RoleHierarchy>> byOrganization = new ConcurrentHashMap<>();
    private final Function<String, Mono<RoleHierarchy>> loader;

    HierarchyCache(Function<String, Mono<RoleHierarchy>> loader) {
        this.loader = loader;
    }

    Mono<RoleHierarchy> get(String organizationId) {
        return byOrganization.computeIfAbsent(organizationId, id -> loader.apply(id).cache());
    }
}
