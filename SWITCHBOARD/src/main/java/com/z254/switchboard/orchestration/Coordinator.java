package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.domain.model.TaskOutcome;
import com.z254.switchboard.domain.model.WorkflowResult;
import com.z254.switchboard.observability.StructuredLogger;
import com.z254.switchboard.orchestration.pattern.StrategyExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Executes workflows of agent tasks under a coordination strategy and aggregates their outcomes.
 * <p>
 * The task set is validated before anything runs; a duplicate id, an unknown dependency or a
 * dependency cycle is signalled as an error without invoking any agent. After validation every
 * failure is captured per task and the returned {@link WorkflowResult} always completes.
 * <p>
 * When a deadline applies, tasks that are not terminal when it elapses are skipped and the result
 * is returned immediately. In-flight agent calls are left to finish under their own timeouts.
 */
@Slf4j
public class Coordinator {

    private final Map<CoordinationStrategy, StrategyExecutor> executors;
    private final TaskRunner taskRunner;
    private final ExecutionHistory history;
    private final StructuredLogger structuredLogger;
    private final MeterRegistry meterRegistry;
    private final Duration defaultDeadline;
    private final Timer workflowTimer;

    public Coordinator(List<StrategyExecutor> executors,
                       TaskRunner taskRunner,
                       ExecutionHistory history,
                       StructuredLogger structuredLogger,
                       MeterRegistry meterRegistry,
                       Duration defaultDeadline) {
        this.executors = new EnumMap<>(CoordinationStrategy.class);
        for (StrategyExecutor executor : executors) {
            this.executors.put(executor.getStrategy(), executor);
            log.debug("Registered coordination strategy: {}", executor.getName());
        }
        this.taskRunner = taskRunner;
        this.history = history;
        this.structuredLogger = structuredLogger;
        this.meterRegistry = meterRegistry;
        this.defaultDeadline = defaultDeadline;
        this.workflowTimer = Timer.builder("switchboard.workflow.duration")
                .description("Wall-clock duration of workflow executions")
                .register(meterRegistry);
    }

    /**
     * Execute a workflow.
     *
     * @return the aggregated result; errors with {@link WorkflowValidationException} (or its
     *         subclass {@link CyclicDependencyException}) if the workflow cannot be executed
     */
    public Mono<WorkflowResult> executeWorkflow(WorkflowRequest request) {
        return Mono.defer(() -> {
            CoordinationStrategy strategy = request.getStrategy();
            if (strategy == null) {
                return Mono.error(new WorkflowValidationException("Coordination strategy is required"));
            }
            if (strategy == CoordinationStrategy.CONDITIONAL && request.getRouter() == null) {
                return Mono.error(new WorkflowValidationException("Conditional workflow requires a router"));
            }
            StrategyExecutor executor = executors.get(strategy);
            if (executor == null) {
                return Mono.error(new WorkflowValidationException("Unsupported strategy: " + strategy));
            }

            WorkflowGraph graph = WorkflowGraph.of(request.getTasks());
            String workflowId = request.getWorkflowId() != null
                    ? request.getWorkflowId()
                    : UUID.randomUUID().toString();
            Duration deadline = request.getDeadline() != null ? request.getDeadline() : defaultDeadline;
            AgentResolver resolver = request.getResolver() != null ? request.getResolver() : AgentResolver.byAgentId();

            WorkflowRun run = new WorkflowRun(workflowId, strategy, graph, request.getRouter(),
                    resolver, deadline, taskRunner.getClock());
            structuredLogger.logWorkflowStarted(workflowId, strategy, graph.size());

            Mono<Void> execution = executor.execute(run, taskRunner);
            if (deadline != null) {
                execution = detach(execution)
                        .timeout(deadline, Mono.fromRunnable(run::expire));
            }
            return execution.then(Mono.fromCallable(() -> complete(run)));
        });
    }

    public Mono<WorkflowResult> executeWorkflow(List<AgentTask> tasks, CoordinationStrategy strategy) {
        return executeWorkflow(WorkflowRequest.of(tasks, strategy));
    }

    public Mono<WorkflowResult> executeSequential(List<AgentTask> tasks) {
        return executeWorkflow(tasks, CoordinationStrategy.SEQUENTIAL);
    }

    public Mono<WorkflowResult> executeParallel(List<AgentTask> tasks) {
        return executeWorkflow(tasks, CoordinationStrategy.PARALLEL);
    }

    public Mono<WorkflowResult> executeConditional(List<AgentTask> tasks, TaskRouter router) {
        return executeWorkflow(WorkflowRequest.builder()
                .tasks(tasks)
                .strategy(CoordinationStrategy.CONDITIONAL)
                .router(router)
                .build());
    }

    public ExecutionHistory.ExecutionStats getExecutionStats() {
        return history.stats();
    }

    /**
     * Run the execution independently of the caller's subscription so a deadline can return
     * early without cancelling calls that are already in flight.
     */
    private Mono<Void> detach(Mono<Void> execution) {
        Sinks.Empty<Void> done = Sinks.empty();
        execution
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> { },
                        done::tryEmitError,
                        done::tryEmitEmpty);
        return done.asMono();
    }

    private WorkflowResult complete(WorkflowRun run) {
        WorkflowResult result = run.toResult();
        history.record(result);

        workflowTimer.record(result.getDuration());
        Counter.builder("switchboard.workflow.executions")
                .tag("strategy", result.getStrategy().name())
                .tag("status", result.getStatus().name())
                .register(meterRegistry)
                .increment();
        for (TaskOutcome outcome : result.getTasks().values()) {
            Counter.builder("switchboard.task.outcomes")
                    .tag("status", outcome.getStatus().name())
                    .register(meterRegistry)
                    .increment();
        }

        structuredLogger.logWorkflowCompleted(result);
        log.info("Workflow {} completed: status={}, tasks={}, duration={}ms",
                result.getWorkflowId(), result.getStatus(), result.getTasks().size(),
                result.getDuration().toMillis());
        return result;
    }
}
