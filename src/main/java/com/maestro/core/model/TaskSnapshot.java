package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a task for status queries. The result is a truncated preview.
 */
public record TaskSnapshot(
    String id,
    String name,
    String description,
    String assignee,
    int priority,
    @JsonProperty("depends_on") List<String> dependsOn,
    TaskStatus status,
    String result,
    String error,
    int retries,
    @JsonProperty("max_retries") int maxRetries,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    Map<String, Object> metadata
) implements Serializable {

    public static TaskSnapshot of(WorkflowTask task, int previewLength) {
        return new TaskSnapshot(
                task.getId(), task.getName(), task.getDescription(), task.getAssignee(),
                task.getPriority(), task.getDependsOn().stream().sorted().toList(),
                task.getStatus(), truncate(task.getResult(), previewLength), task.getError(),
                task.getRetries(), task.getMaxRetries(), task.getStartedAt(), task.getCompletedAt(),
                Map.copyOf(task.getMetadata()));
    }

    private static String truncate(String text, int length) {
        if (text == null || text.length() <= length) return text;
        return text.substring(0, length);
    }
}
