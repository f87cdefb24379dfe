package com.maestro.core.agent;

import java.time.Instant;
import java.util.Map;

/**
 * A message passed between agents through the {@link AgentRegistry}.
 */
public record AgentMessage(
    String fromAgent,
    String toAgent,
    String content,
    Type type,
    Map<String, Object> metadata,
    Instant sentAt
) {

    public enum Type { INFO, REQUEST, RESPONSE, ERROR }

    public AgentMessage {
        type = type == null ? Type.INFO : type;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        sentAt = sentAt == null ? Instant.now() : sentAt;
    }

    public AgentMessage(String fromAgent, String toAgent, String content) {
        this(fromAgent, toAgent, content, Type.INFO, Map.of(), null);
    }

    public AgentMessage(String fromAgent, String toAgent, String content, Type type) {
        this(fromAgent, toAgent, content, type, Map.of(), null);
    }
}
