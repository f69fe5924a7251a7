package com.z254.switchboard.orchestration;

import java.util.Map;

/**
 * Chooses the single task a conditional workflow runs.
 */
@FunctionalInterface
public interface TaskRouter {

    /**
     * @param input payload of the first task in the workflow
     * @return agent id of the task to execute
     */
    String route(Map<String, Object> input);
}
