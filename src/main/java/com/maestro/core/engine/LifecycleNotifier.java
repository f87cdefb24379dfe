package com.maestro.core.engine;

import com.maestro.core.events.EventBus;
import com.maestro.core.events.WorkflowEvent;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans lifecycle events out to registered listeners and to the {@link EventBus}.
 * Never throws.
 */
@Component
public class LifecycleNotifier {

    private static final Logger log = LoggerFactory.getLogger(LifecycleNotifier.class);

    private final EventBus eventBus;
    private final CopyOnWriteArrayList<TaskLifecycleListener> taskListeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<WorkflowLifecycleListener> workflowListeners = new CopyOnWriteArrayList<>();

    public LifecycleNotifier(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void addTaskListener(TaskLifecycleListener listener) {
        taskListeners.add(listener);
    }

    public void addWorkflowListener(WorkflowLifecycleListener listener) {
        workflowListeners.add(listener);
    }

    public void taskEvent(Workflow workflow, WorkflowTask task, String event) {
        for (TaskLifecycleListener listener : taskListeners) {
            try {
                listener.onTaskEvent(workflow, task, event);
            } catch (Exception e) {
                log.warn("Task listener failed on {} for {}: {}", event, task.getId(), e.getMessage(), e);
            }
        }

        if (!hasSubscribers(workflow)) return;
        var payload = new HashMap<String, Object>();
        payload.put("assignee", task.getAssignee());
        payload.put("status", task.getStatus().value());
        payload.put("retries", task.getRetries());
        if (task.getError() != null) {
            payload.put("error", task.getError());
        }
        eventBus.publish(new WorkflowEvent("task." + event, workflow.getId(), task.getId(), payload, Instant.now()));
    }

    public void workflowEvent(Workflow workflow, String event) {
        for (WorkflowLifecycleListener listener : workflowListeners) {
            try {
                listener.onWorkflowEvent(workflow, event);
            } catch (Exception e) {
                log.warn("Workflow listener failed on {} for {}: {}", event, workflow.getId(), e.getMessage(), e);
            }
        }

        if (!hasSubscribers(workflow)) return;
        var payload = new HashMap<String, Object>();
        payload.put("name", workflow.getName());
        payload.put("status", workflow.getStatus().value());
        eventBus.publish(new WorkflowEvent("workflow." + event, workflow.getId(), null, payload, Instant.now()));
    }

    /**
     * Drops the event bus subscribers of a workflow that is being discarded.
     */
    public void forget(String workflowId) {
        if (eventBus != null) {
            eventBus.clear(workflowId);
        }
    }

    private boolean hasSubscribers(Workflow workflow) {
        return eventBus != null && eventBus.hasSubscribers(workflow.getId());
    }
}
