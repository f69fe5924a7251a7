package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.domain.model.SkipReason;
import com.z254.switchboard.domain.model.TaskOutcome;
import com.z254.switchboard.domain.model.TaskStatus;
import com.z254.switchboard.domain.model.WorkflowContext;
import com.z254.switchboard.domain.model.WorkflowResult;
import com.z254.switchboard.domain.model.WorkflowStatus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one workflow execution: the validated graph plus a {@link TaskRun} per task.
 * Created fresh for every execution and never shared between executions.
 */
@Slf4j
public class WorkflowRun {

    @Getter
    private final String workflowId;
    @Getter
    private final CoordinationStrategy strategy;
    @Getter
    private final WorkflowGraph graph;
    @Getter
    private final TaskRouter router;
    @Getter
    private final AgentResolver resolver;
    @Getter
    private final Clock clock;
    @Getter
    private final Instant startedAt;

    /**
     * Absolute deadline, or null when the workflow has none.
     */
    @Getter
    private final Instant deadline;

    private final Map<String, TaskRun> runs;
    private final AtomicBoolean timedOut = new AtomicBoolean();

    public WorkflowRun(String workflowId,
                       CoordinationStrategy strategy,
                       WorkflowGraph graph,
                       TaskRouter router,
                       AgentResolver resolver,
                       Duration deadline,
                       Clock clock) {
        this.workflowId = workflowId;
        this.strategy = strategy;
        this.graph = graph;
        this.router = router;
        this.resolver = resolver;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deadline = deadline != null ? startedAt.plus(deadline) : null;

        Map<String, TaskRun> byId = new LinkedHashMap<>();
        for (AgentTask task : graph.tasks().values()) {
            byId.put(task.getId(), new TaskRun(task));
        }
        this.runs = byId;
    }

    public TaskRun run(String taskId) {
        TaskRun run = runs.get(taskId);
        if (run == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return run;
    }

    public Collection<TaskRun> allRuns() {
        return runs.values();
    }

    public boolean isTimedOut() {
        return timedOut.get();
    }

    public boolean isDeadlineExpired() {
        return timedOut.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * Outputs of every task that has succeeded so far.
     */
    public WorkflowContext context() {
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        for (TaskRun run : runs.values()) {
            if (run.getStatus() == TaskStatus.SUCCEEDED) {
                outputs.put(run.getId(), run.getOutput());
            }
        }
        return WorkflowContext.of(outputs);
    }

    /**
     * Mark every task that is not terminal yet as skipped because the deadline elapsed.
     * Calls already in flight keep running but can no longer change their task's status.
     */
    public void expire() {
        if (!timedOut.compareAndSet(false, true)) {
            return;
        }
        Instant now = clock.instant();
        int skipped = 0;
        for (TaskRun run : runs.values()) {
            if (run.skip(SkipReason.WORKFLOW_TIMEOUT, "Workflow deadline elapsed", now)) {
                skipped++;
            }
        }
        log.warn("Workflow {} deadline elapsed, {} tasks skipped", workflowId, skipped);
    }

    /**
     * Snapshot the current task states into a result.
     */
    public WorkflowResult toResult() {
        Map<String, TaskOutcome> outcomes = new LinkedHashMap<>();
        for (TaskRun run : runs.values()) {
            outcomes.put(run.getId(), run.toOutcome());
        }
        Instant completedAt = clock.instant();
        return WorkflowResult.builder()
                .workflowId(workflowId)
                .strategy(strategy)
                .status(overallStatus(outcomes.values()))
                .tasks(Collections.unmodifiableMap(outcomes))
                .startedAt(startedAt)
                .completedAt(completedAt)
                .duration(Duration.between(startedAt, completedAt))
                .timedOut(timedOut.get())
                .build();
    }

    /**
     * SUCCESS when nothing failed or timed out, FAILED when nothing succeeded, PARTIAL otherwise.
     * Tasks skipped for an unmet condition, a failed dependency or not being selected are neutral.
     */
    static WorkflowStatus overallStatus(Collection<TaskOutcome> outcomes) {
        long succeeded = 0;
        long bad = 0;
        for (TaskOutcome outcome : outcomes) {
            if (outcome.isSucceeded()) {
                succeeded++;
            } else if (outcome.isFailed()
                    || outcome.getSkipReason() == SkipReason.WORKFLOW_TIMEOUT
                    || outcome.getStatus() == TaskStatus.PENDING
                    || outcome.getStatus() == TaskStatus.RUNNING) {
                bad++;
            }
        }
        if (bad == 0) {
            return WorkflowStatus.SUCCESS;
        }
        return succeeded == 0 ? WorkflowStatus.FAILED : WorkflowStatus.PARTIAL;
    }
}
