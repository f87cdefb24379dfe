package com.maestro.core.agent;

import java.util.EnumSet;
import java.util.Set;

/**
 * Describes one executor: who it is and what it can do.
 *
 * @param name         unique name within the registry (e.g. "Developer")
 * @param role         role identifier (e.g. "developer")
 * @param description  one-line summary of the agent's purpose
 * @param capabilities declared skills used for routing
 */
public record AgentProfile(
    String name,
    String role,
    String description,
    Set<AgentCapability> capabilities
) {

    public AgentProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    public static AgentProfile of(String name, String role, AgentCapability... capabilities) {
        return new AgentProfile(name, role, "", Set.of(capabilities));
    }
}
