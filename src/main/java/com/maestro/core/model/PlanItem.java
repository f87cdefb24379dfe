package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of a planner's output, before it is turned into a {@link WorkflowTask}.
 *
 * @param task       the task text handed to the executor
 * @param assignee   requested agent name (nullable, resolved against the registry)
 * @param priority   1 is most urgent (nullable, configured default applies)
 * @param dependsOn  1-based plan positions or task ids this entry waits for
 * @param maxRetries failed attempts before the task is FAILED (nullable)
 * @param name       display name (nullable, derived from the task text)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanItem(
    @JsonProperty("task") String task,
    @JsonProperty("assignee") String assignee,
    @JsonProperty("priority") Integer priority,
    @JsonProperty("depends_on") List<Object> dependsOn,
    @JsonProperty("max_retries") Integer maxRetries,
    @JsonProperty("name") String name
) {

    public static PlanItem of(String task, String assignee, Integer priority, List<Object> dependsOn) {
        return new PlanItem(task, assignee, priority, dependsOn, null, null);
    }

    public List<Object> dependsOn() {
        return dependsOn == null ? List.of() : dependsOn;
    }
}
