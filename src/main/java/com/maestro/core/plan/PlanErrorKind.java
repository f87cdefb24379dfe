package com.maestro.core.plan;

/**
 * Reasons a plan is rejected as an invalid plan.
 */
public enum PlanErrorKind {
    UNKNOWN_DEPENDENCY,
    SELF_DEPENDENCY,
    CYCLE
}
