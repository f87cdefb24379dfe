package com.maestro.core.agent;

/**
 * Skills an agent can declare, used for capability-based task routing.
 */
public enum AgentCapability {
    CODE_GENERATION,
    CODE_REVIEW,
    DESIGN,
    TESTING,
    RESEARCH,
    SECURITY,
    DOCUMENTATION,
    OPTIMIZATION,
    WEB_SEARCH,
    FILE_OPERATIONS
}
