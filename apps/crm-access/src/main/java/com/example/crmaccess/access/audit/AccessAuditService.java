package com.example.crmaccess.access.audit;

import com.example.crmaccess.access.model.ResolutionResult;
import com.example.crmaccess.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Publishes visibility resolution audit events in structured JSON format.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.access.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AccessAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ACCESS_AUDIT");

    private static final int MAX_REASON_LENGTH = 200;

    private final ObjectMapper objectMapper;

    public void logResolved(
            @Nullable String correlationId,
            @NonNull String moduleName,
            @NonNull String recordId,
            @NonNull ResolutionResult result) {

        logEvent(AccessAuditEvent.resolved(
                correlationId != null ? StringSanitizer.forLog(correlationId) : null,
                StringSanitizer.forLog(moduleName),
                StringSanitizer.forLog(recordId),
                result));
    }

    public void logFailure(
            @Nullable String correlationId,
            @NonNull AccessAuditEvent.Outcome outcome,
            @NonNull String moduleName,
            @NonNull String recordId,
            @Nullable String reason) {

        logEvent(AccessAuditEvent.failed(
                correlationId != null ? StringSanitizer.forLog(correlationId) : null,
                outcome,
                StringSanitizer.forLog(moduleName),
                StringSanitizer.forLog(recordId),
                reason != null ? StringSanitizer.forLog(reason, MAX_REASON_LENGTH) : null));
    }

    private void logEvent(@NonNull AccessAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("Access {} - module={}, record={}, accessType={}, users={}, reason={}",
                    event.outcome(),
                    event.moduleName(),
                    event.recordId(),
                    event.accessType(),
                    event.userCount(),
                    event.reason());
        }
    }

    private void logByOutcome(AccessAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case RESOLVED -> AUDIT_LOG.info(json);
            case NOT_FOUND, CONFIGURATION_ERROR -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }
}
