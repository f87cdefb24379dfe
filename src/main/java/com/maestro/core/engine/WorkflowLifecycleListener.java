package com.maestro.core.engine;

import com.maestro.core.model.Workflow;

/**
 * Receives workflow-level lifecycle events: "started", then the final status value
 * ("completed", "completed_with_errors" or "cancelled").
 * <p>
 * Delivery is best-effort. Exceptions thrown by a listener are logged and discarded and
 * never affect scheduling.
 */
@FunctionalInterface
public interface WorkflowLifecycleListener {

    void onWorkflowEvent(Workflow workflow, String event);
}
