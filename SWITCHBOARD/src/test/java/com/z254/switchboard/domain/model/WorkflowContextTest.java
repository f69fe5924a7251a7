package com.z254.switchboard.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WorkflowContext}.
 */
class WorkflowContextTest {

    @Test
    @DisplayName("should read numeric fields from numbers and numeric strings")
    void numericFields() {
        WorkflowContext context = WorkflowContext.of(Map.of(
                "quote", Map.of("amount", 150, "currency", "USD", "tax", " 12.5 ")));

        assertThat(context.getDouble("quote", "amount")).hasValue(150.0);
        assertThat(context.getDouble("quote", "tax")).hasValue(12.5);
        assertThat(context.getDouble("quote", "currency")).isEmpty();
        assertThat(context.getDouble("quote", "missing")).isEmpty();
        assertThat(context.getDouble("other", "amount")).isEmpty();
    }

    @Test
    @DisplayName("should snapshot outputs so later changes are not visible")
    void snapshot() {
        Map<String, Object> output = new HashMap<>();
        output.put("status", "open");
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        outputs.put("ticket", output);

        WorkflowContext context = WorkflowContext.of(outputs);
        output.put("status", "closed");
        outputs.put("late", Map.of());

        assertThat(context.get("ticket", "status")).contains("open");
        assertThat(context.hasOutput("late")).isFalse();
        assertThatThrownBy(() -> context.output("ticket").put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should treat tasks without output as empty")
    void emptyContext() {
        WorkflowContext context = WorkflowContext.of(null);

        assertThat(context).isSameAs(WorkflowContext.empty());
        assertThat(context.output("anything")).isEmpty();
        assertThat(context.get("anything", "key")).isEmpty();
    }
}
