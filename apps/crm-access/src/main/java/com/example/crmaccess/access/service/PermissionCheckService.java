package com.example.crmaccess.access.service;

import com.example.crmaccess.access.audit.AccessAuditEvent;
import com.example.crmaccess.access.audit.AccessAuditService;
import com.example.crmaccess.access.exception.AccessConfigurationException;
import com.example.crmaccess.access.exception.RecordNotFoundException;
import com.example.crmaccess.access.model.PermissionSummary;
import com.example.crmaccess.access.model.RecordResolution;
import com.example.crmaccess.access.model.ResolutionResult;
import com.example.crmaccess.config.AccessProperties;
import com.example.crmaccess.observability.filter.CorrelationIdFilter;
import com.example.crmaccess.observability.metrics.AccessMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Entry point for callers: runs the {@link AccessResolver} and records metrics and audit events.
 */
@Slf4j
@Service
public class PermissionCheckService {

    private final AccessResolver accessResolver;
    private final PermissionSummaryService summaryService;
    private final AccessMetrics metrics;
    private final AccessProperties properties;

    @Nullable
    private final AccessAuditService auditService;

    public PermissionCheckService(
            AccessResolver accessResolver,
            PermissionSummaryService summaryService,
            AccessMetrics metrics,
            AccessProperties properties,
            @Nullable AccessAuditService auditService) {
        this.accessResolver = accessResolver;
        this.summaryService = summaryService;
        this.metrics = metrics;
        this.properties = properties;
        this.auditService = auditService;
    }

    /**
     * Resolve who can view one record.
     *
     * @param moduleName module API name
     * @param recordId   local or CRM-issued record id
     * @return Mono emitting the resolution result
     */
    public Mono<ResolutionResult> check(String moduleName, String recordId) {
        return CorrelationIdFilter.getCorrelationId()
                .flatMap(correlationId -> {
                    long start = System.nanoTime();
                    return accessResolver.resolve(moduleName, recordId)
                            .doOnNext(result -> onResolved(correlationId, moduleName, recordId, result, start))
                            .doOnError(error -> onFailure(correlationId, moduleName, recordId, error, start));
                });
    }

    /**
     * Resolve several records of one module; failures are reported per record.
     *
     * @throws IllegalArgumentException (as error signal) when the batch exceeds the configured limit
     */
    public Mono<List<RecordResolution>> checkBatch(String moduleName, List<String> recordIds) {
        int maxRecords = properties.batch().maxRecords();
        if (recordIds.size() > maxRecords) {
            return Mono.error(new IllegalArgumentException(
                    String.format("Batch of %d records exceeds the limit of %d", recordIds.size(), maxRecords)));
        }

        return CorrelationIdFilter.getCorrelationId()
                .flatMap(correlationId -> {
                    long start = System.nanoTime();
                    return accessResolver.resolveAll(moduleName, recordIds)
                            .doOnNext(entry -> {
                                if (entry.isResolved()) {
                                    onResolved(correlationId, moduleName, entry.recordId(), entry.result(), start);
                                } else {
                                    onBatchFailure(correlationId, moduleName, entry, start);
                                }
                            })
                            .collectList()
                            .doOnNext(entries -> log.debug("Resolved batch of {} {} records",
                                    entries.size(), moduleName));
                });
    }

    public Mono<PermissionSummary> summarize(String organizationId, String moduleName) {
        return summaryService.summarize(organizationId, moduleName);
    }

    private void onResolved(String correlationId, String moduleName, String recordId,
                            ResolutionResult result, long start) {
        metrics.recordResolved(result, elapsedSince(start));
        if (auditService != null) {
            auditService.logResolved(correlationId, moduleName, recordId, result);
        }
    }

    private void onFailure(String correlationId, String moduleName, String recordId,
                           Throwable error, long start) {
        AccessAuditEvent.Outcome outcome;
        String metricOutcome;
        if (error instanceof RecordNotFoundException) {
            outcome = AccessAuditEvent.Outcome.NOT_FOUND;
            metricOutcome = AccessMetrics.OUTCOME_NOT_FOUND;
        } else if (error instanceof AccessConfigurationException) {
            outcome = AccessAuditEvent.Outcome.CONFIGURATION_ERROR;
            metricOutcome = AccessMetrics.OUTCOME_CONFIGURATION_ERROR;
        } else {
            outcome = AccessAuditEvent.Outcome.ERROR;
            metricOutcome = AccessMetrics.OUTCOME_ERROR;
        }

        metrics.recordFailure(metricOutcome, elapsedSince(start));
        if (auditService != null) {
            auditService.logFailure(correlationId, outcome, moduleName, recordId, error.getMessage());
        }
    }

    private void onBatchFailure(String correlationId, String moduleName, RecordResolution entry, long start) {
        boolean notFound = RecordResolution.NOT_FOUND.equals(entry.error());
        metrics.recordFailure(
                notFound ? AccessMetrics.OUTCOME_NOT_FOUND : AccessMetrics.OUTCOME_CONFIGURATION_ERROR,
                elapsedSince(start));
        if (auditService != null) {
            auditService.logFailure(correlationId,
                    notFound ? AccessAuditEvent.Outcome.NOT_FOUND : AccessAuditEvent.Outcome.CONFIGURATION_ERROR,
                    moduleName, entry.recordId(), entry.message());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
