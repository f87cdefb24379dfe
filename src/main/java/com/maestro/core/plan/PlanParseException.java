package com.maestro.core.plan;

/**
 * Thrown when planner output or a plan file cannot be parsed into plan items.
 */
public class PlanParseException extends RuntimeException {
    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
