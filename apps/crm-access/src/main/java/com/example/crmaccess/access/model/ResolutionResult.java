package com.example.crmaccess.access.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Outcome of a visibility resolution: the CRM user ids allowed to view the record.
 *
 * <p>{@code userIds} has set semantics in first-seen order; duplicates are dropped on construction.
 */
public record ResolutionResult(
        List<String> userIds,
        AccessType accessType,
        boolean hierarchyUsed
) {
    public ResolutionResult {
        userIds = userIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(userIds));
    }

    /**
     * Nobody can view the record.
     */
    public static ResolutionResult empty(AccessType accessType) {
        return new ResolutionResult(List.of(), accessType, false);
    }

    /**
     * Only the owner can view the record; no hierarchy was consulted.
     */
    public static ResolutionResult ownerOnly(String ownerExternalId) {
        return new ResolutionResult(List.of(ownerExternalId), AccessType.PRIVATE, false);
    }

    public static ResolutionResult publicAccess(AccessType accessType, List<String> userIds) {
        return new ResolutionResult(userIds, accessType, false);
    }

    /**
     * Owner first, then everyone granted through the role hierarchy.
     */
    public static ResolutionResult hierarchy(String ownerExternalId, List<String> hierarchyUserIds) {
        List<String> ids = new ArrayList<>(hierarchyUserIds.size() + 1);
        ids.add(ownerExternalId);
        ids.addAll(hierarchyUserIds);
        return new ResolutionResult(ids, AccessType.PRIVATE, true);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return userIds.isEmpty();
    }
}
