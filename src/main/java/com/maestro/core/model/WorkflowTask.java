package com.maestro.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A single unit of work within a workflow, routed to one agent.
 * <p>
 * Tasks are created during plan translation and afterwards mutated only by the
 * engine driving the owning workflow. They are never removed, only moved to a
 * terminal status.
 */
public class WorkflowTask {

    private final String id;
    private final String name;
    private final String description;
    private final String assignee;
    private final int priority;
    private final int sequence;
    private final Set<String> dependsOn;
    private final int maxRetries;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile int retries;
    private volatile String result;
    private volatile String error;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    /**
     * @param id          unique id within the workflow (e.g. "task_1")
     * @param name        short display name
     * @param description full task text handed to the executor
     * @param assignee    name of the agent profile that performs the task
     * @param priority    lower value runs first among ready tasks
     * @param sequence    position in the originating plan, used to break priority ties
     * @param dependsOn   ids of tasks that must complete first
     * @param maxRetries  failed attempts after which the task is FAILED (at least 1)
     */
    public WorkflowTask(String id, String name, String description, String assignee,
                        int priority, int sequence, Set<String> dependsOn, int maxRetries) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.assignee = assignee;
        this.priority = priority;
        this.sequence = sequence;
        this.dependsOn = dependsOn == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(dependsOn));
        this.maxRetries = Math.max(1, maxRetries);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getAssignee() { return assignee; }
    public int getPriority() { return priority; }
    public int getSequence() { return sequence; }
    public Set<String> getDependsOn() { return dependsOn; }
    public int getMaxRetries() { return maxRetries; }
    public Map<String, Object> getMetadata() { return metadata; }

    public TaskStatus getStatus() { return status; }
    public int getRetries() { return retries; }
    public String getResult() { return result; }
    public String getError() { return error; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }

    public void markReady() {
        this.status = TaskStatus.READY;
    }

    public void markRunning(Instant now) {
        this.status = TaskStatus.RUNNING;
        this.startedAt = now;
    }

    public void markCompleted(String result, Instant now) {
        this.result = result;
        this.error = null;
        this.status = TaskStatus.COMPLETED;
        this.completedAt = now;
    }

    /**
     * Records a failed attempt. The task goes back to PENDING while attempts remain,
     * otherwise it becomes FAILED.
     *
     * @return the resulting status
     */
    public TaskStatus recordFailure(String error, Instant now) {
        this.error = error;
        this.retries++;
        this.status = retries < maxRetries ? TaskStatus.PENDING : TaskStatus.FAILED;
        this.completedAt = now;
        return status;
    }

    public void markSkipped(String reason, Instant now) {
        this.error = reason;
        this.status = TaskStatus.SKIPPED;
        this.completedAt = now;
    }

    public void markCancelled(Instant now) {
        this.status = TaskStatus.CANCELLED;
        this.completedAt = now;
    }

    @Override
    public String toString() {
        return "WorkflowTask[" + id + ", " + assignee + ", " + status + "]";
    }
}
