package com.maestro.core.agent;

import java.util.Set;

/**
 * Estimates how well a set of capabilities fits a free-text task.
 * Implementations must be pure and return a value in {@code [0, 1]}.
 */
@FunctionalInterface
public interface CapabilityScorer {

    double score(Set<AgentCapability> capabilities, String taskText);
}
