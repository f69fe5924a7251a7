package com.z254.switchboard.observability;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.switchboard.domain.model.SkipReason;
import com.z254.switchboard.domain.model.TaskOutcome;
import com.z254.switchboard.domain.model.TaskStatus;
import com.z254.switchboard.resilience.CircuitState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StructuredLogger}.
 */
class StructuredLoggerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StructuredLogger structuredLogger = new StructuredLogger(objectMapper);
    private final Logger logger = (Logger) LoggerFactory.getLogger(StructuredLogger.class);
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private JsonNode lastEvent() throws Exception {
        assertThat(appender.list).isNotEmpty();
        return objectMapper.readTree(appender.list.get(appender.list.size() - 1).getFormattedMessage());
    }

    @Test
    @DisplayName("should write a skipped task as a JSON event with its context")
    void taskOutcome() throws Exception {
        structuredLogger.logTaskOutcome("wf-1", TaskOutcome.builder()
                .taskId("approve")
                .agentId("finance")
                .status(TaskStatus.SKIPPED)
                .skipReason(SkipReason.CONDITION_NOT_MET)
                .error("Condition not met")
                .build());

        JsonNode event = lastEvent();
        assertThat(event.get("event").asText()).isEqualTo("task_skipped");
        assertThat(event.get("service").asText()).isEqualTo("switchboard");
        assertThat(event.get("workflowId").asText()).isEqualTo("wf-1");
        assertThat(event.get("taskId").asText()).isEqualTo("approve");
        assertThat(event.get("agentId").asText()).isEqualTo("finance");
        assertThat(event.get("skipReason").asText()).isEqualTo("CONDITION_NOT_MET");
        assertThat(event.has("fallbackUsed")).isFalse();
    }

    @Test
    @DisplayName("should clear the task context afterwards")
    void clearsContext() {
        structuredLogger.logTaskOutcome("wf-2", TaskOutcome.builder()
                .taskId("t").agentId("a").status(TaskStatus.SUCCEEDED).build());

        assertThat(MDC.get(StructuredLogger.MDC_WORKFLOW_ID)).isNull();
        assertThat(MDC.get(StructuredLogger.MDC_TASK_ID)).isNull();
        assertThat(MDC.get(StructuredLogger.MDC_AGENT_ID)).isNull();
    }

    @Test
    @DisplayName("should log breaker transitions with wire state names")
    void breakerTransition() throws Exception {
        structuredLogger.logBreakerTransition("sales", CircuitState.HALF_OPEN, CircuitState.OPEN);

        JsonNode event = lastEvent();
        assertThat(event.get("event").asText()).isEqualTo("circuit_breaker_transition");
        assertThat(event.get("from").asText()).isEqualTo("half_open");
        assertThat(event.get("to").asText()).isEqualTo("open");
    }
}
