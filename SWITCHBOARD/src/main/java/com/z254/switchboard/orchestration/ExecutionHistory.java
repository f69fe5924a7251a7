package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.domain.model.TaskStatus;
import com.z254.switchboard.domain.model.WorkflowResult;
import com.z254.switchboard.domain.model.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded record of recently completed workflows.
 */
public class ExecutionHistory {

    private static final int RECENT_REPORTED = 10;

    private final int capacity;
    private final Deque<ExecutionRecord> records = new ArrayDeque<>();
    private long totalExecutions;

    public ExecutionHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    public synchronized void record(WorkflowResult result) {
        records.addLast(ExecutionRecord.of(result));
        totalExecutions++;
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    /**
     * Totals over all executions; average duration and strategy counts over the retained window.
     */
    public synchronized ExecutionStats stats() {
        Map<CoordinationStrategy, Long> byStrategy = new EnumMap<>(CoordinationStrategy.class);
        Duration total = Duration.ZERO;
        for (ExecutionRecord record : records) {
            byStrategy.merge(record.strategy(), 1L, Long::sum);
            total = total.plus(record.duration());
        }
        Duration average = records.isEmpty() ? Duration.ZERO : total.dividedBy(records.size());

        List<ExecutionRecord> all = new ArrayList<>(records);
        List<ExecutionRecord> recent = all.subList(Math.max(0, all.size() - RECENT_REPORTED), all.size());
        return new ExecutionStats(totalExecutions, average, Map.copyOf(byStrategy), List.copyOf(recent));
    }

    public synchronized List<ExecutionRecord> records() {
        return List.copyOf(records);
    }

    /**
     * Summary of one completed workflow.
     */
    public record ExecutionRecord(
            String workflowId,
            CoordinationStrategy strategy,
            WorkflowStatus status,
            int taskCount,
            long succeeded,
            long failed,
            long skipped,
            Duration duration,
            Instant completedAt,
            boolean timedOut
    ) {
        static ExecutionRecord of(WorkflowResult result) {
            return new ExecutionRecord(
                    result.getWorkflowId(),
                    result.getStrategy(),
                    result.getStatus(),
                    result.getTasks().size(),
                    result.count(TaskStatus.SUCCEEDED),
                    result.count(TaskStatus.FAILED),
                    result.count(TaskStatus.SKIPPED),
                    result.getDuration(),
                    result.getCompletedAt(),
                    result.isTimedOut());
        }
    }

    /**
     * Aggregated execution statistics.
     *
     * @param totalExecutions workflows completed since startup
     * @param averageDuration mean duration of the retained workflows
     * @param byStrategy      retained workflows per strategy
     * @param recent          the most recent workflows, oldest first
     */
    public record ExecutionStats(
            long totalExecutions,
            Duration averageDuration,
            Map<CoordinationStrategy, Long> byStrategy,
            List<ExecutionRecord> recent
    ) {
    }
}
