package com.maestro.core.plan;

import java.util.List;

/**
 * Thrown when a plan's dependency graph is inconsistent: it references unknown
 * tasks or contains a cycle. No task of a rejected plan is added to the workflow.
 */
public class InvalidPlanException extends RuntimeException {

    private final PlanErrorKind kind;
    private final List<String> taskIds;

    public InvalidPlanException(PlanErrorKind kind, List<String> taskIds, String message) {
        super(message);
        this.kind = kind;
        this.taskIds = List.copyOf(taskIds);
    }

    public PlanErrorKind getKind() {
        return kind;
    }

    /**
     * Ids of the tasks involved: the referencing tasks for unknown or self
     * dependencies, the members of the cycle for cycles.
     */
    public List<String> getTaskIds() {
        return taskIds;
    }
}
