package com.maestro.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted while a workflow runs.
 *
 * @param eventType  dotted event name (e.g. "workflow.started", "task.completed", "task.skipped")
 * @param workflowId the workflow this event belongs to
 * @param taskId     the task this event relates to (nullable for workflow-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record WorkflowEvent(
    String eventType,
    String workflowId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public boolean isTaskEvent() {
        return taskId != null;
    }
}
