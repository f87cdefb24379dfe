package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Serializable point-in-time view of a workflow and all of its tasks.
 */
public record WorkflowSnapshot(
    String id,
    String name,
    String objective,
    WorkflowStatus status,
    List<TaskSnapshot> tasks,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("completed_at") Instant completedAt
) implements Serializable {

    public static WorkflowSnapshot of(Workflow workflow, int previewLength) {
        return new WorkflowSnapshot(
                workflow.getId(), workflow.getName(), workflow.getObjective(), workflow.getStatus(),
                workflow.getTasks().stream().map(t -> TaskSnapshot.of(t, previewLength)).toList(),
                workflow.getCreatedAt(), workflow.getCompletedAt());
    }

    public long countByStatus(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).count();
    }
}
