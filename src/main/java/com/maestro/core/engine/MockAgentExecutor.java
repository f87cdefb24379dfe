package com.maestro.core.engine;

import java.util.Map;

/**
 * Executor that completes every task immediately without doing any work.
 * Used for dry runs of a plan when no real executor is configured.
 */
public class MockAgentExecutor implements AgentExecutor {

    static final String PREFIX = "[Mock] Completed: ";

    @Override
    public String execute(String agentName, String task, Map<String, String> context) {
        return PREFIX + task;
    }
}
