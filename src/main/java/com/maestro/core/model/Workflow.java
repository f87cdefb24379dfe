package com.maestro.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A DAG of {@link WorkflowTask}s pursuing a single objective.
 * <p>
 * The task map keeps plan order. Tasks are added while the plan is translated and
 * the map is never reassigned afterwards.
 */
public class Workflow {

    private final String id;
    private final String name;
    private final String objective;
    private final Map<String, WorkflowTask> tasks = new LinkedHashMap<>();
    private final Instant createdAt;

    private volatile WorkflowStatus status = WorkflowStatus.CREATED;
    private volatile Instant completedAt;

    public Workflow(String id, String name, String objective) {
        this(id, name, objective, Instant.now());
    }

    public Workflow(String id, String name, String objective, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.objective = objective;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getObjective() { return objective; }
    public Instant getCreatedAt() { return createdAt; }
    public WorkflowStatus getStatus() { return status; }
    public Instant getCompletedAt() { return completedAt; }

    public synchronized void setStatus(WorkflowStatus status) { this.status = status; }

    /**
     * Labels a CREATED or RUNNING workflow as PAUSED; finished workflows keep their status.
     *
     * @return true if the status changed
     */
    public synchronized boolean markPaused() {
        if (status != WorkflowStatus.CREATED && status != WorkflowStatus.RUNNING) {
            return false;
        }
        status = WorkflowStatus.PAUSED;
        return true;
    }

    /**
     * Moves a PAUSED workflow back to {@code resumed}. Any other status is left alone.
     *
     * @return true if the status changed
     */
    public synchronized boolean markResumed(WorkflowStatus resumed) {
        if (status != WorkflowStatus.PAUSED) {
            return false;
        }
        status = resumed;
        return true;
    }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public void addTask(WorkflowTask task) {
        tasks.put(task.getId(), task);
    }

    public WorkflowTask getTask(String taskId) {
        return tasks.get(taskId);
    }

    public Collection<WorkflowTask> getTasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public boolean containsTask(String taskId) {
        return tasks.containsKey(taskId);
    }

    /**
     * True when no task is PENDING, READY or RUNNING.
     */
    public boolean isComplete() {
        for (WorkflowTask task : tasks.values()) {
            if (!task.getStatus().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Results of all completed tasks that produced output, keyed by task id.
     */
    public Map<String, String> getResults() {
        var results = new LinkedHashMap<String, String>();
        for (WorkflowTask task : tasks.values()) {
            if (task.getStatus() == TaskStatus.COMPLETED && task.getResult() != null) {
                results.put(task.getId(), task.getResult());
            }
        }
        return results;
    }
}
