package com.z254.switchboard.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of the outputs of tasks that have succeeded so far.
 * Task conditions are evaluated against this view, never against in-flight task state.
 */
public final class WorkflowContext {

    private static final WorkflowContext EMPTY = new WorkflowContext(Map.of());

    private final Map<String, Map<String, Object>> outputs;

    private WorkflowContext(Map<String, Map<String, Object>> outputs) {
        this.outputs = outputs;
    }

    public static WorkflowContext of(Map<String, Map<String, Object>> outputs) {
        if (outputs == null || outputs.isEmpty()) {
            return EMPTY;
        }
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        outputs.forEach((taskId, output) -> copy.put(taskId,
                output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of()));
        return new WorkflowContext(Collections.unmodifiableMap(copy));
    }

    public static WorkflowContext empty() {
        return EMPTY;
    }

    public boolean hasOutput(String taskId) {
        return outputs.containsKey(taskId);
    }

    /**
     * Output of a succeeded task, or an empty map if the task has not succeeded.
     */
    public Map<String, Object> output(String taskId) {
        return outputs.getOrDefault(taskId, Map.of());
    }

    public Optional<Object> get(String taskId, String key) {
        return Optional.ofNullable(output(taskId).get(key));
    }

    /**
     * Read a numeric output field. Strings holding a number are parsed.
     */
    public OptionalDouble getDouble(String taskId, String key) {
        Object value = output(taskId).get(key);
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return OptionalDouble.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public Map<String, Map<String, Object>> outputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return "WorkflowContext" + outputs.keySet();
    }
}
