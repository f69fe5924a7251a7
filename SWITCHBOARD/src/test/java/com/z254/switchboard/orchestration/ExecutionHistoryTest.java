package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.domain.model.TaskOutcome;
import com.z254.switchboard.domain.model.TaskStatus;
import com.z254.switchboard.domain.model.WorkflowResult;
import com.z254.switchboard.domain.model.WorkflowStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExecutionHistory}.
 */
class ExecutionHistoryTest {

    private static WorkflowResult result(String id, CoordinationStrategy strategy, long millis) {
        return WorkflowResult.builder()
                .workflowId(id)
                .strategy(strategy)
                .status(WorkflowStatus.SUCCESS)
                .tasks(Map.of("t", TaskOutcome.builder().taskId("t").status(TaskStatus.SUCCEEDED).build()))
                .startedAt(Instant.EPOCH)
                .completedAt(Instant.EPOCH.plusMillis(millis))
                .duration(Duration.ofMillis(millis))
                .build();
    }

    @Test
    @DisplayName("should report zeros when empty")
    void empty() {
        ExecutionHistory.ExecutionStats stats = new ExecutionHistory(5).stats();

        assertThat(stats.totalExecutions()).isZero();
        assertThat(stats.averageDuration()).isEqualTo(Duration.ZERO);
        assertThat(stats.byStrategy()).isEmpty();
        assertThat(stats.recent()).isEmpty();
    }

    @Test
    @DisplayName("should evict the oldest records beyond capacity but keep the total")
    void boundedRetention() {
        ExecutionHistory history = new ExecutionHistory(3);
        history.record(result("w1", CoordinationStrategy.SEQUENTIAL, 100));
        history.record(result("w2", CoordinationStrategy.PARALLEL, 10));
        history.record(result("w3", CoordinationStrategy.PARALLEL, 20));
        history.record(result("w4", CoordinationStrategy.CONDITIONAL, 30));

        ExecutionHistory.ExecutionStats stats = history.stats();

        assertThat(history.records()).extracting(ExecutionHistory.ExecutionRecord::workflowId)
                .containsExactly("w2", "w3", "w4");
        assertThat(stats.totalExecutions()).isEqualTo(4);
        assertThat(stats.averageDuration()).isEqualTo(Duration.ofMillis(20));
        assertThat(stats.byStrategy())
                .containsEntry(CoordinationStrategy.PARALLEL, 2L)
                .containsEntry(CoordinationStrategy.CONDITIONAL, 1L)
                .doesNotContainKey(CoordinationStrategy.SEQUENTIAL);
    }

    @Test
    @DisplayName("should report only the ten most recent executions")
    void recentWindow() {
        ExecutionHistory history = new ExecutionHistory(50);
        for (int i = 0; i < 15; i++) {
            history.record(result("w" + i, CoordinationStrategy.SEQUENTIAL, i));
        }

        assertThat(history.stats().recent())
                .hasSize(10)
                .first()
                .satisfies(record -> {
                    assertThat(record.workflowId()).isEqualTo("w5");
                    assertThat(record.succeeded()).isEqualTo(1);
                    assertThat(record.taskCount()).isEqualTo(1);
                });
    }

    @Test
    @DisplayName("should reject a capacity below one")
    void invalidCapacity() {
        assertThatThrownBy(() -> new ExecutionHistory(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
