package com.maestro.core.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordCapabilityScorerTest {

    private final KeywordCapabilityScorer scorer = new KeywordCapabilityScorer();

    @Test
    @DisplayName("each matching keyword adds 0.2")
    void keywordIncrements() {
        assertEquals(0.2, scorer.score(Set.of(AgentCapability.TESTING), "please test it"), 1e-9);
        assertEquals(0.4, scorer.score(Set.of(AgentCapability.TESTING), "test and verify"), 1e-9);
    }

    @Test
    @DisplayName("matching is case-insensitive substring matching")
    void caseInsensitiveSubstring() {
        assertEquals(0.2, scorer.score(Set.of(AgentCapability.SECURITY), "Check the SECURITY headers"), 1e-9);
        // "documentation" contains the stem "document"
        assertTrue(scorer.score(Set.of(AgentCapability.DOCUMENTATION), "update documentation") > 0);
    }

    @Test
    @DisplayName("score is clamped to 1.0")
    void clamped() {
        String text = "implement create build code develop function class";
        assertEquals(1.0, scorer.score(EnumSet.of(AgentCapability.CODE_GENERATION), text), 1e-9);
    }

    @Test
    @DisplayName("only declared capabilities count")
    void onlyDeclaredCapabilities() {
        assertEquals(0.0, scorer.score(Set.of(AgentCapability.DESIGN), "research the market"), 1e-9);
    }

    @Test
    @DisplayName("blank text, no capabilities, or keyword-less capabilities score zero")
    void zeroCases() {
        assertEquals(0.0, scorer.score(Set.of(AgentCapability.TESTING), null));
        assertEquals(0.0, scorer.score(Set.of(AgentCapability.TESTING), "  "));
        assertEquals(0.0, scorer.score(Set.of(), "test everything"));
        assertEquals(0.0, scorer.score(Set.of(AgentCapability.WEB_SEARCH, AgentCapability.FILE_OPERATIONS),
                "search the web and write files"));
    }

    @Test
    @DisplayName("default agents score above zero on their kind of work")
    void defaultAgentsMatchTheirWork() {
        assertTrue(scorer.score(DefaultAgentProfiles.DEVELOPER.capabilities(), "implement a REST API endpoint") > 0);
        assertTrue(scorer.score(DefaultAgentProfiles.UI_UX.capabilities(), "design a login page with CSS") > 0);
        assertTrue(scorer.score(DefaultAgentProfiles.QA.capabilities(), "test the registration flow") > 0);
        assertTrue(scorer.score(DefaultAgentProfiles.SECURITY_AUDITOR.capabilities(),
                "check for SQL injection vulnerabilities") > 0);
        assertTrue(scorer.score(DefaultAgentProfiles.RESEARCHER.capabilities(),
                "research best practices for API design") > 0);
    }
}
