package com.z254.switchboard.orchestration.pattern;

import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.domain.model.SkipReason;
import com.z254.switchboard.orchestration.TaskRun;
import com.z254.switchboard.orchestration.TaskRunner;
import com.z254.switchboard.orchestration.WorkflowRun;
import com.z254.switchboard.orchestration.WorkflowValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conditional coordination strategy.
 * A router inspects the first task's payload and selects one task by agent id; every other task
 * is skipped without invoking its agent.
 */
@Component
@Slf4j
public class ConditionalStrategyExecutor implements StrategyExecutor {

    @Override
    public CoordinationStrategy getStrategy() {
        return CoordinationStrategy.CONDITIONAL;
    }

    @Override
    public Mono<Void> execute(WorkflowRun run, TaskRunner runner) {
        return Mono.defer(() -> {
            List<AgentTask> tasks = List.copyOf(run.getGraph().tasks().values());
            if (tasks.isEmpty()) {
                return Mono.empty();
            }
            if (run.getRouter() == null) {
                return Mono.error(new WorkflowValidationException("Conditional workflow requires a router"));
            }

            Map<String, Object> input = tasks.get(0).getPayload();
            String selectedAgent;
            try {
                selectedAgent = run.getRouter().route(input);
            } catch (RuntimeException e) {
                return Mono.error(new WorkflowValidationException("Router failed: " + e.getMessage(), e));
            }

            AgentTask selected = tasks.stream()
                    .filter(task -> Objects.equals(task.getAgentId(), selectedAgent))
                    .findFirst()
                    .orElse(null);
            if (selected == null) {
                return Mono.error(new WorkflowValidationException(
                        "Router selected no task in the workflow: " + selectedAgent));
            }
            log.info("Workflow {} routed to agent {} (task {})", run.getWorkflowId(), selectedAgent, selected.getId());

            Instant now = Instant.now(run.getClock());
            for (TaskRun taskRun : run.allRuns()) {
                if (!taskRun.getId().equals(selected.getId())) {
                    taskRun.skip(SkipReason.NOT_SELECTED, "Not selected by router", now);
                }
            }
            return runner.attempt(run, run.run(selected.getId()));
        });
    }
}
