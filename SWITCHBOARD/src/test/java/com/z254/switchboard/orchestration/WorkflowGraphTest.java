package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.AgentTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WorkflowGraph}.
 */
class WorkflowGraphTest {

    private static AgentTask task(String id, String... dependsOn) {
        return AgentTask.builder().id(id).agentId(id).dependsOn(List.of(dependsOn)).build();
    }

    private static List<String> ids(WorkflowGraph graph) {
        return graph.topologicalOrder().stream().map(AgentTask::getId).toList();
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should keep input order when there are no dependencies")
        void inputOrder() {
            WorkflowGraph graph = WorkflowGraph.of(List.of(task("c"), task("a"), task("b")));

            assertThat(ids(graph)).containsExactly("c", "a", "b");
            assertThat(graph.tasks().keySet()).containsExactly("c", "a", "b");
        }

        @Test
        @DisplayName("should move a task only behind its dependencies")
        void minimalReordering() {
            WorkflowGraph graph = WorkflowGraph.of(List.of(
                    task("report", "fetch"), task("notify"), task("fetch"), task("archive")));

            assertThat(ids(graph)).containsExactly("notify", "fetch", "report", "archive");
        }

        @Test
        @DisplayName("should order a diamond")
        void diamond() {
            WorkflowGraph graph = WorkflowGraph.of(List.of(
                    task("d", "b", "c"), task("c", "a"), task("b", "a"), task("a")));

            assertThat(ids(graph)).containsExactly("a", "c", "b", "d");
        }

        @Test
        @DisplayName("should default a task id to its agent id")
        void agentIdAsTaskId() {
            WorkflowGraph graph = WorkflowGraph.of(List.of(AgentTask.forAgent("sales", null)));

            assertThat(graph.task("sales")).isNotNull();
            assertThat(graph.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should report the cycle path")
        void reportsCycle() {
            assertThatThrownBy(() -> WorkflowGraph.of(List.of(task("a", "c"), task("b", "a"), task("c", "b"))))
                    .isInstanceOf(CyclicDependencyException.class)
                    .hasMessageStartingWith("Cyclic task dependency: ")
                    .satisfies(e -> assertThat(((CyclicDependencyException) e).getCycle())
                            .hasSize(4)
                            .containsOnly("a", "b", "c"));
        }

        @Test
        @DisplayName("should report a self dependency as a cycle of one task")
        void selfDependency() {
            assertThatThrownBy(() -> WorkflowGraph.of(List.of(task("a", "a"))))
                    .isInstanceOf(CyclicDependencyException.class)
                    .hasMessage("Cyclic task dependency: a -> a");
        }

        @Test
        @DisplayName("should reject a task without any id")
        void missingId() {
            AgentTask anonymous = AgentTask.builder().build();

            assertThatThrownBy(() -> WorkflowGraph.of(List.of(anonymous)))
                    .isInstanceOf(WorkflowValidationException.class);
        }

        @Test
        @DisplayName("should reject duplicate ids and unknown dependencies")
        void duplicatesAndUnknowns() {
            assertThatThrownBy(() -> WorkflowGraph.of(List.of(task("a"), task("a"))))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessage("Duplicate task id: a");
            assertThatThrownBy(() -> WorkflowGraph.of(List.of(task("a", "x"))))
                    .isInstanceOf(WorkflowValidationException.class)
                    .isNotInstanceOf(CyclicDependencyException.class)
                    .hasMessage("Task a depends on unknown task: x");
        }
    }
}
