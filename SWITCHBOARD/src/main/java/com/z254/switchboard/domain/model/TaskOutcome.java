package com.z254.switchboard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Terminal record of one task in a {@link WorkflowResult}.
 */
@Value
@Builder
public class TaskOutcome {

    String taskId;

    /**
     * Agent the task was dispatched to, or the requested agent id if resolution never happened.
     */
    String agentId;

    TaskStatus status;

    /**
     * Agent output when the task succeeded.
     */
    Map<String, Object> output;

    /**
     * Error message when the task failed, or the skip explanation.
     */
    String error;

    /**
     * Simple class name of the failure cause.
     */
    String errorType;

    SkipReason skipReason;

    /**
     * True when the output came from the fallback provider because the breaker was open.
     */
    boolean fallbackUsed;

    Instant startedAt;

    Instant completedAt;

    @Builder.Default
    Duration duration = Duration.ZERO;

    public boolean isSucceeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }

    public boolean isSkipped() {
        return status == TaskStatus.SKIPPED;
    }
}
