package com.example.crmaccess.access.hierarchy;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * A role placed in the hierarchy.
 *
 * @param roleId       role id
 * @param displayLabel role label
 * @param reportsTo    parent role as stored; may point outside the organization's roles
 * @param level        distance from the nearest root, 0 for roots and for unreachable roles
 * @param children     direct subordinates, in input order
 */
public record HierarchyNode(
        String roleId,
        String displayLabel,
        @Nullable String reportsTo,
        int level,
        List<String> children
) {
    public HierarchyNode {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
