package com.example.crmaccess.access.hierarchy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable role forest of one organization, keyed by role id in input order.
 */
public final class RoleHierarchy {

    private static final RoleHierarchy EMPTY = new RoleHierarchy(Map.of());

    private final Map<String, HierarchyNode> nodes;

    RoleHierarchy(Map<String, HierarchyNode> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public static RoleHierarchy empty() {
        return EMPTY;
    }

    public Optional<HierarchyNode> node(String roleId) {
        return Optional.ofNullable(nodes.get(roleId));
    }

    public boolean contains(String roleId) {
        return nodes.containsKey(roleId);
    }

    public OptionalInt levelOf(String roleId) {
        HierarchyNode node = nodes.get(roleId);
        return node == null ? OptionalInt.empty() : OptionalInt.of(node.level());
    }

    /**
     * Roles whose level is at most {@code level}, i.e. equal or more senior. Input order is kept.
     */
    public Set<String> rolesAtOrAbove(int level) {
        Set<String> roleIds = new LinkedHashSet<>();
        nodes.values().forEach(node -> {
            if (node.level() <= level) {
                roleIds.add(node.roleId());
            }
        });
        return roleIds;
    }

    public Map<String, HierarchyNode> asMap() {
        return nodes;
    }

    public List<HierarchyNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public int size() {
        return nodes.size();
    }
}
