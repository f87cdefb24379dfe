package com.maestro.core.agent;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores capabilities by scanning task text for keyword stems.
 * <p>
 * Each keyword of a declared capability that occurs as a substring of the lowercased
 * text adds {@value #MATCH_INCREMENT}; the total is clamped to 1.0. This is a cheap
 * heuristic, so ties between agents are common.
 */
public class KeywordCapabilityScorer implements CapabilityScorer {

    static final double MATCH_INCREMENT = 0.2;

    private static final Map<AgentCapability, List<String>> KEYWORDS = new EnumMap<>(AgentCapability.class);

    static {
        KEYWORDS.put(AgentCapability.CODE_GENERATION,
                List.of("implement", "create", "build", "code", "develop", "function", "class"));
        KEYWORDS.put(AgentCapability.CODE_REVIEW,
                List.of("review", "check", "analyze", "inspect", "evaluate"));
        KEYWORDS.put(AgentCapability.DESIGN,
                List.of("design", "ui", "ux", "layout", "interface", "style", "css", "visual"));
        KEYWORDS.put(AgentCapability.TESTING,
                List.of("test", "verify", "validate", "qa", "bug", "fix", "debug"));
        KEYWORDS.put(AgentCapability.RESEARCH,
                List.of("research", "find", "search", "look up", "investigate", "explore"));
        KEYWORDS.put(AgentCapability.SECURITY,
                List.of("security", "vulnerability", "secure", "protect", "authentication", "authorization"));
        KEYWORDS.put(AgentCapability.DOCUMENTATION,
                List.of("document", "readme", "docs", "explain", "comment", "describe"));
        KEYWORDS.put(AgentCapability.OPTIMIZATION,
                List.of("optimize", "performance", "speed", "efficiency", "improve", "refactor"));
        KEYWORDS.put(AgentCapability.WEB_SEARCH, List.of());
        KEYWORDS.put(AgentCapability.FILE_OPERATIONS, List.of());
    }

    @Override
    public double score(Set<AgentCapability> capabilities, String taskText) {
        if (taskText == null || taskText.isBlank() || capabilities == null || capabilities.isEmpty()) {
            return 0.0;
        }

        String lowerText = taskText.toLowerCase(Locale.ROOT);
        double score = 0.0;
        for (AgentCapability capability : capabilities) {
            for (String keyword : keywordsFor(capability)) {
                if (lowerText.contains(keyword)) {
                    score += MATCH_INCREMENT;
                }
            }
        }
        return Math.min(score, 1.0);
    }

    /**
     * Keyword stems associated with a capability; empty for capabilities that are
     * never inferred from text.
     */
    public static List<String> keywordsFor(AgentCapability capability) {
        return KEYWORDS.getOrDefault(capability, List.of());
    }
}
