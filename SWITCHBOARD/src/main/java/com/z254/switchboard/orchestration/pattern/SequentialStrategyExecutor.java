package com.z254.switchboard.orchestration.pattern;

import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.orchestration.TaskRunner;
import com.z254.switchboard.orchestration.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Sequential coordination strategy.
 * Tasks run one at a time in input order; each waits for every earlier task to be terminal.
 * <p>
 * A task listed before one of its dependencies is moved after it, otherwise order is preserved.
 */
@Component
@Slf4j
public class SequentialStrategyExecutor implements StrategyExecutor {

    @Override
    public CoordinationStrategy getStrategy() {
        return CoordinationStrategy.SEQUENTIAL;
    }

    @Override
    public Mono<Void> execute(WorkflowRun run, TaskRunner runner) {
        log.info("Executing sequential workflow {} with {} tasks", run.getWorkflowId(), run.getGraph().size());
        return Flux.fromIterable(run.getGraph().topologicalOrder())
                .map(AgentTask::getId)
                .concatMap(taskId -> runner.attempt(run, run.run(taskId)))
                .then();
    }
}
