package com.maestro.core.engine;

import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowTask;

/**
 * Receives per-task lifecycle events: "started" when a task is dispatched, then the
 * lowercase name of the status it ended the attempt in ("completed", "pending" for a
 * retry, "failed"), plus "skipped" and "cancelled".
 * <p>
 * Delivery is best-effort. Exceptions thrown by a listener are logged and discarded and
 * never affect scheduling.
 */
@FunctionalInterface
public interface TaskLifecycleListener {

    void onTaskEvent(Workflow workflow, WorkflowTask task, String event);
}
