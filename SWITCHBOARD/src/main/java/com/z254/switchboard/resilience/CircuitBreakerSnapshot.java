package com.z254.switchboard.resilience;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a breaker for monitoring.
 */
public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int failureCount,
        int successCount,
        Instant openedAt,
        Instant lastFailureAt,
        long totalRequests,
        long totalSuccesses,
        long totalFailures,
        long totalTimeouts,
        long totalRejections,
        List<FailureRecord> recentFailures,
        BreakerConfig config
) {

    public double successRate() {
        return totalRequests > 0 ? (double) totalSuccesses / totalRequests : 0.0;
    }

    /**
     * One recorded failure.
     */
    public record FailureRecord(Instant timestamp, String message, String type) {
    }
}
