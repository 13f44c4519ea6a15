package com.example.crmaccess.directory.model;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Organization-wide default visibility for one module.
 *
 * <p>{@code shareType} is kept as the raw CRM value; unknown values are rejected
 * at resolution time rather than when the rule is read.
 */
public record SharingRule(
        String id,
        String organizationId,
        String moduleName,
        @Nullable String shareType,
        @Nullable Instant createdAt
) {
}
