package com.z254.switchboard.orchestration;

import com.z254.switchboard.agent.AgentInvoker;
import com.z254.switchboard.agent.FallbackProvider;
import com.z254.switchboard.domain.model.AgentDescriptor;
import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.SkipReason;
import com.z254.switchboard.domain.model.TaskStatus;
import com.z254.switchboard.domain.model.WorkflowContext;
import com.z254.switchboard.observability.StructuredLogger;
import com.z254.switchboard.registry.AgentRegistry;
import com.z254.switchboard.resilience.CircuitBreaker;
import com.z254.switchboard.resilience.CircuitBreakerRegistry;
import com.z254.switchboard.resilience.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs a single task once it is eligible: checks the deadline, the dependency outcomes and the
 * condition, then resolves the agent and calls it through the agent's circuit breaker.
 * <p>
 * The returned {@code Mono} always completes empty once the task is terminal; task failures are
 * recorded on the {@link TaskRun}, never signalled as errors.
 */
@Slf4j
public class TaskRunner {

    private final AgentRegistry agentRegistry;
    private final CircuitBreakerRegistry breakerRegistry;
    private final AgentInvoker invoker;
    private final FallbackProvider fallbackProvider;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    public TaskRunner(AgentRegistry agentRegistry,
                      CircuitBreakerRegistry breakerRegistry,
                      AgentInvoker invoker,
                      FallbackProvider fallbackProvider,
                      StructuredLogger structuredLogger,
                      Clock clock) {
        this.agentRegistry = agentRegistry;
        this.breakerRegistry = breakerRegistry;
        this.invoker = invoker;
        this.fallbackProvider = fallbackProvider;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    public Clock getClock() {
        return clock;
    }

    public Mono<Void> attempt(WorkflowRun run, TaskRun taskRun) {
        return Mono.defer(() -> {
            if (taskRun.isTerminal()) {
                return Mono.empty();
            }
            AgentTask task = taskRun.getTask();

            if (run.isDeadlineExpired()) {
                skip(run, taskRun, SkipReason.WORKFLOW_TIMEOUT, "Workflow deadline elapsed");
                return Mono.empty();
            }

            for (String dependencyId : task.getDependsOn()) {
                TaskStatus dependencyStatus = run.run(dependencyId).getStatus();
                if (dependencyStatus == TaskStatus.FAILED || dependencyStatus == TaskStatus.SKIPPED) {
                    skip(run, taskRun, SkipReason.DEPENDENCY_NOT_SATISFIED,
                            "Dependency " + dependencyId + " " + dependencyStatus.name().toLowerCase(Locale.ROOT));
                    return Mono.empty();
                }
            }

            WorkflowContext context = run.context();
            boolean shouldRun;
            try {
                shouldRun = task.shouldRun(context);
            } catch (RuntimeException e) {
                log.warn("Condition of task {} threw: {}", task.getId(), e.getMessage());
                fail(run, taskRun, e);
                return Mono.empty();
            }
            if (!shouldRun) {
                skip(run, taskRun, SkipReason.CONDITION_NOT_MET, "Condition not met");
                return Mono.empty();
            }

            if (!taskRun.markRunning(clock.instant())) {
                return Mono.empty();
            }

            AgentDescriptor agent;
            try {
                agent = run.getResolver().resolve(task, agentRegistry);
            } catch (RuntimeException e) {
                log.warn("Could not resolve agent for task {}: {}", task.getId(), e.getMessage());
                fail(run, taskRun, e);
                return Mono.empty();
            }
            taskRun.assignAgent(agent.getId());

            return invoke(run, taskRun, agent, buildPayload(run, task));
        });
    }

    private Mono<Void> invoke(WorkflowRun run, TaskRun taskRun, AgentDescriptor agent, Map<String, Object> payload) {
        AgentTask task = taskRun.getTask();
        CircuitBreaker breaker = breakerRegistry.getOrCreate(agent.getId());
        Duration timeout = task.getTimeout() != null ? task.getTimeout() : agent.getTimeout();

        AtomicBoolean fromFallback = new AtomicBoolean();
        Supplier<Mono<Map<String, Object>>> fallback = null;
        if (fallbackProvider != null) {
            fallback = () -> {
                fromFallback.set(true);
                breakerRegistry.recordRejection();
                return fallbackProvider.fallback(agent, payload);
            };
        }

        log.debug("Dispatching task {} to agent {} (timeout={})", task.getId(), agent.getId(), timeout);
        return breaker.<Map<String, Object>>call(() -> invoker.invoke(agent, payload), timeout, fallback)
                .defaultIfEmpty(Map.of())
                .doOnNext(output -> {
                    if (taskRun.succeed(output, fromFallback.get(), clock.instant())) {
                        structuredLogger.logTaskOutcome(run.getWorkflowId(), taskRun.toOutcome());
                    }
                })
                .then()
                .onErrorResume(error -> {
                    if (error instanceof CircuitOpenException) {
                        breakerRegistry.recordRejection();
                    }
                    log.warn("Task {} failed on agent {}: {}", task.getId(), agent.getId(), error.getMessage());
                    fail(run, taskRun, error);
                    return Mono.empty();
                });
    }

    /**
     * Task payload plus, for tasks with dependencies, a {@code context} entry mapping each
     * dependency id to its output.
     */
    static Map<String, Object> buildPayload(WorkflowRun run, AgentTask task) {
        Map<String, Object> payload = new LinkedHashMap<>(task.getPayload());
        if (task.hasDependencies()) {
            Map<String, Object> dependencyOutputs = new LinkedHashMap<>();
            for (String dependencyId : task.getDependsOn()) {
                Map<String, Object> output = run.run(dependencyId).getOutput();
                dependencyOutputs.put(dependencyId, output != null ? output : Map.of());
            }
            payload.put(AgentTask.CONTEXT_KEY, dependencyOutputs);
        }
        return payload;
    }

    private void skip(WorkflowRun run, TaskRun taskRun, SkipReason reason, String message) {
        if (taskRun.skip(reason, message, clock.instant())) {
            structuredLogger.logTaskOutcome(run.getWorkflowId(), taskRun.toOutcome());
        }
    }

    private void fail(WorkflowRun run, TaskRun taskRun, Throwable error) {
        if (taskRun.fail(error, clock.instant())) {
            structuredLogger.logTaskOutcome(run.getWorkflowId(), taskRun.toOutcome());
        }
    }
}
