package com.example.crmaccess.access.audit;

import com.example.crmaccess.access.model.ResolutionResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for one visibility resolution.
 */
public record AccessAuditEvent(
        String eventId,
        Instant timestamp,
        String correlationId,
        Outcome outcome,
        String moduleName,
        String recordId,
        String accessType,
        Boolean hierarchyUsed,
        Integer userCount,
        String reason
) {
    public enum Outcome {
        RESOLVED, NOT_FOUND, CONFIGURATION_ERROR, ERROR
    }

    public static AccessAuditEvent resolved(
            String correlationId,
            String moduleName,
            String recordId,
            ResolutionResult result) {

        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                correlationId,
                Outcome.RESOLVED,
                moduleName,
                recordId,
                result.accessType().shareType(),
                result.hierarchyUsed(),
                result.userIds().size(),
                null
        );
    }

    public static AccessAuditEvent failed(
            String correlationId,
            Outcome outcome,
            String moduleName,
            String recordId,
            String reason) {

        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                correlationId,
                outcome,
                moduleName,
                recordId,
                null,
                null,
                null,
                reason
        );
    }

    /**
     * Flat map for JSON logging; null attributes are left out.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("eventType", "ACCESS_RESOLUTION");
        log.put("eventId", eventId);
        log.put("timestamp", timestamp.toString());
        putIfPresent(log, "correlationId", correlationId);
        log.put("outcome", outcome.name());
        putIfPresent(log, "moduleName", moduleName);
        putIfPresent(log, "recordId", recordId);
        putIfPresent(log, "accessType", accessType);
        putIfPresent(log, "hierarchyUsed", hierarchyUsed);
        putIfPresent(log, "userCount", userCount);
        putIfPresent(log, "reason", reason);
        return log;
    }

    private static void putIfPresent(Map<String, Object> log, String key, Object value) {
        if (value != null) {
            log.put(key, value);
        }
    }
}
