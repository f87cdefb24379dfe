package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of an individual task within a workflow.
 */
public enum TaskStatus {
    PENDING,
    READY,      // all dependencies completed, computed by the scheduler only
    RUNNING,
    COMPLETED,
    FAILED,     // retries exhausted
    SKIPPED,    // a dependency failed
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * A terminal state other than COMPLETED; dependents of such a task can never run.
     */
    public boolean isUnsuccessful() {
        return this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * Lowercase name used for lifecycle event names and serialized snapshots.
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
