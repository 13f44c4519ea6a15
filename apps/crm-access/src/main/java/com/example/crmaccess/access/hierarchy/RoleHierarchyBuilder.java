package com.example.crmaccess.access.hierarchy;

import com.example.crmaccess.directory.model.CrmRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a flat role list into a forest and assigns each role its depth.
 *
 * <p>Levels are computed breadth-first from the roots. A role whose parent is not
 * in the input is a root. Roles never reached from a root (their ancestor chain
 * cycles) keep level 0 and act as isolated roots. Every input role appears exactly
 * once in the result and the traversal is linear in the number of roles.
 */
@Slf4j
@Component
public class RoleHierarchyBuilder {

    public RoleHierarchy build(List<CrmRole> roles) {
        if (roles == null || roles.isEmpty()) {
            return RoleHierarchy.empty();
        }

        Map<String, CrmRole> byId = new LinkedHashMap<>();
        for (CrmRole role : roles) {
            if (byId.putIfAbsent(role.id(), role) != null) {
                log.debug("Ignoring duplicate role {}", role.id());
            }
        }

        Map<String, List<String>> children = new LinkedHashMap<>();
        byId.keySet().forEach(roleId -> children.put(roleId, new ArrayList<>()));

        Deque<QueueEntry> queue = new ArrayDeque<>();
        for (CrmRole role : byId.values()) {
            String parentId = role.reportsToId();
            if (parentId != null && byId.containsKey(parentId)) {
                children.get(parentId).add(role.id());
            } else {
                queue.add(new QueueEntry(role.id(), 0));
            }
        }

        Map<String, Integer> levels = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            if (!visited.add(entry.roleId())) {
                continue;
            }
            levels.put(entry.roleId(), entry.level());
            for (String childId : children.get(entry.roleId())) {
                if (!visited.contains(childId)) {
                    queue.add(new QueueEntry(childId, entry.level() + 1));
                }
            }
        }

        if (visited.size() < byId.size()) {
            log.warn("{} of {} roles are unreachable from a root (cyclic reporting), treating them as roots",
                    byId.size() - visited.size(), byId.size());
        }

        Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
        for (CrmRole role : byId.values()) {
            nodes.put(role.id(), new HierarchyNode(
                    role.id(),
                    role.displayLabel(),
                    role.reportsToId(),
                    levels.getOrDefault(role.id(), 0),
                    children.get(role.id())));
        }
        return new RoleHierarchy(nodes);
    }

    private record QueueEntry(String roleId, int level) {
    }
}
