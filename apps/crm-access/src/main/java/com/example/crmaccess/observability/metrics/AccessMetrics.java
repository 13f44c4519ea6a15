package com.example.crmaccess.observability.metrics;

import com.example.crmaccess.access.model.ResolutionResult;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for record visibility resolution.
 * Uses bounded tag values to prevent high-cardinality metric explosion.
 */
@Component
public class AccessMetrics {

    public static final String OUTCOME_RESOLVED = "resolved";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_CONFIGURATION_ERROR = "configuration_error";
    public static final String OUTCOME_ERROR = "error";

    private static final String TAG_NONE = "none";

    private final MeterRegistry registry;
    private final DistributionSummary resolvedUsers;
    private final Timer resolutionTimer;

    public AccessMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.resolvedUsers = DistributionSummary.builder("access.resolution.users")
                .description("Number of users granted visibility per resolved record")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.resolutionTimer = Timer.builder("access.resolution.duration")
                .description("Record visibility resolution duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordResolved(@NonNull ResolutionResult result, @NonNull Duration duration) {
        registry.counter("access.resolution",
                Tags.of("outcome", OUTCOME_RESOLVED,
                        "access_type", result.accessType().shareType(),
                        "hierarchy", String.valueOf(result.hierarchyUsed())))
                .increment();
        resolvedUsers.record(result.userIds().size());
        resolutionTimer.record(duration);
    }

    /**
     * @param outcome one of the {@code OUTCOME_*} constants
     */
    public void recordFailure(@NonNull String outcome, @NonNull Duration duration) {
        registry.counter("access.resolution",
                Tags.of("outcome", outcome,
                        "access_type", TAG_NONE,
                        "hierarchy", TAG_NONE))
                .increment();
        resolutionTimer.record(duration);
    }
}
