package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Aggregate lifecycle status of a workflow.
 */
public enum WorkflowStatus {
    CREATED,
    RUNNING,
    PAUSED,     // advisory label, the engine keeps dispatching
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
