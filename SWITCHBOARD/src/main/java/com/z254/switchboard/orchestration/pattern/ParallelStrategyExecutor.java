package com.z254.switchboard.orchestration.pattern;

import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.orchestration.TaskRunner;
import com.z254.switchboard.orchestration.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parallel coordination strategy.
 * Every task starts as soon as all of its dependencies are terminal; independent tasks overlap.
 * <p>
 * Each task is a cached {@code Mono} that first awaits its dependencies' monos, so readiness is
 * driven by completion signals rather than polling.
 */
@Component
@Slf4j
public class ParallelStrategyExecutor implements StrategyExecutor {

    @Override
    public CoordinationStrategy getStrategy() {
        return CoordinationStrategy.PARALLEL;
    }

    @Override
    public Mono<Void> execute(WorkflowRun run, TaskRunner runner) {
        log.info("Executing parallel workflow {} with {} tasks", run.getWorkflowId(), run.getGraph().size());

        Map<String, Mono<Void>> completions = new HashMap<>();
        for (AgentTask task : run.getGraph().topologicalOrder()) {
            List<Mono<Void>> dependencies = new ArrayList<>();
            for (String dependencyId : task.getDependsOn()) {
                dependencies.add(completions.get(dependencyId));
            }

            Mono<Void> completion = Mono.when(dependencies)
                    .then(Mono.defer(() -> runner.attempt(run, run.run(task.getId())))
                            .subscribeOn(Schedulers.boundedElastic()))
                    .cache();
            completions.put(task.getId(), completion);
        }

        return Mono.when(completions.values());
    }
}
