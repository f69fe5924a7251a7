package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.AgentTask;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Validated dependency graph of a workflow's tasks.
 * <p>
 * Construction rejects blank or duplicate task ids, dependencies on tasks outside the workflow
 * and cyclic dependencies, so a graph that exists is always executable.
 */
public final class WorkflowGraph {

    private final Map<String, AgentTask> tasks;
    private final Map<String, Integer> inputIndex;
    private final List<AgentTask> topologicalOrder;

    private WorkflowGraph(Map<String, AgentTask> tasks) {
        this.tasks = Collections.unmodifiableMap(tasks);
        this.inputIndex = new HashMap<>();
        int index = 0;
        for (String id : tasks.keySet()) {
            inputIndex.put(id, index++);
        }
        detectCycle();
        this.topologicalOrder = List.copyOf(sortTopologically());
    }

    /**
     * Validate tasks and build their graph.
     *
     * @throws WorkflowValidationException if an id is blank or duplicated or a dependency is unknown
     * @throws CyclicDependencyException   if the dependencies form a cycle
     */
    public static WorkflowGraph of(List<AgentTask> tasks) {
        if (tasks == null) {
            throw new WorkflowValidationException("Task list must not be null");
        }
        Map<String, AgentTask> byId = new LinkedHashMap<>();
        for (AgentTask task : tasks) {
            if (task == null) {
                throw new WorkflowValidationException("Task must not be null");
            }
            String id = task.getId();
            if (id == null || id.isBlank()) {
                throw new WorkflowValidationException("Task has neither an id nor an agent id");
            }
            if (byId.putIfAbsent(id, task) != null) {
                throw new WorkflowValidationException("Duplicate task id: " + id);
            }
        }
        for (AgentTask task : byId.values()) {
            for (String dependency : task.getDependsOn()) {
                if (!byId.containsKey(dependency)) {
                    throw new WorkflowValidationException(
                            "Task " + task.getId() + " depends on unknown task: " + dependency);
                }
            }
        }
        return new WorkflowGraph(byId);
    }

    /**
     * Tasks keyed by id, in input order.
     */
    public Map<String, AgentTask> tasks() {
        return tasks;
    }

    public AgentTask task(String id) {
        return tasks.get(id);
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Input order, moved only as far as needed so every task follows its dependencies.
     */
    public List<AgentTask> topologicalOrder() {
        return topologicalOrder;
    }

    private void detectCycle() {
        Map<String, Mark> marks = new HashMap<>();
        for (String id : tasks.keySet()) {
            if (!marks.containsKey(id)) {
                visit(id, marks, new ArrayList<>());
            }
        }
    }

    private void visit(String id, Map<String, Mark> marks, List<String> path) {
        marks.put(id, Mark.IN_PROGRESS);
        path.add(id);
        for (String dependency : tasks.get(id).getDependsOn()) {
            Mark mark = marks.get(dependency);
            if (mark == Mark.IN_PROGRESS) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                throw new CyclicDependencyException(cycle);
            }
            if (mark == null) {
                visit(dependency, marks, path);
            }
        }
        path.remove(path.size() - 1);
        marks.put(id, Mark.DONE);
    }

    private List<AgentTask> sortTopologically() {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (AgentTask task : tasks.values()) {
            pending.put(task.getId(), task.getDependsOn().size());
            for (String dependency : task.getDependsOn()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(task.getId());
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> inputIndex.get(a) - inputIndex.get(b));
        pending.forEach((id, count) -> {
            if (count == 0) {
                ready.add(id);
            }
        });

        List<AgentTask> order = new ArrayList<>(tasks.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(tasks.get(id));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    private enum Mark {
        IN_PROGRESS,
        DONE
    }
}
