package com.maestro.core.engine;

import java.util.Map;

/**
 * The capability that actually performs a task, usually by prompting a language model
 * in the role of the named agent.
 * <p>
 * Calls block the dispatching worker thread until the task finishes; the engine applies
 * no timeout. Any exception counts as a failed attempt and is subject to the task's
 * retry budget.
 */
@FunctionalInterface
public interface AgentExecutor {

    /**
     * @param agentName name of the agent profile the task was routed to
     * @param task      the full task description
     * @param context   results of the task's completed dependencies, keyed by task id
     * @return the task result text
     * @throws Exception when the attempt failed
     */
    String execute(String agentName, String task, Map<String, String> context) throws Exception;
}
