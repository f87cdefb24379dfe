package com.maestro.core.agent;

import java.util.List;
import java.util.Set;

import static com.maestro.core.agent.AgentCapability.*;

/**
 * The standard agent team: a planner, specialists and a final refiner.
 */
public final class DefaultAgentProfiles {

    public static final AgentProfile ORCHESTRATOR = new AgentProfile("Orchestrator", "orchestrator",
            "Plans and coordinates work, breaks down objectives into tasks", Set.of(RESEARCH));
    public static final AgentProfile DEVELOPER = new AgentProfile("Developer", "developer",
            "Implements robust and efficient code with clean architecture",
            Set.of(CODE_GENERATION, CODE_REVIEW, OPTIMIZATION));
    public static final AgentProfile UI_UX = new AgentProfile("UI/UX Designer", "ui_ux",
            "Designs user interfaces and experiences", Set.of(DESIGN));
    public static final AgentProfile QA = new AgentProfile("QA Tester", "qa",
            "Tests functionality and reviews quality", Set.of(TESTING, CODE_REVIEW));
    public static final AgentProfile RESEARCHER = new AgentProfile("Research", "research",
            "Researches technologies and best practices", Set.of(RESEARCH, WEB_SEARCH));
    public static final AgentProfile SECURITY_AUDITOR = new AgentProfile("Security", "security",
            "Audits code and designs for vulnerabilities", Set.of(SECURITY, CODE_REVIEW));
    public static final AgentProfile DOCUMENTER = new AgentProfile("Documentation", "documentation",
            "Writes documentation and explanations", Set.of(DOCUMENTATION));
    public static final AgentProfile REFINER = new AgentProfile("Refiner", "refiner",
            "Synthesizes outputs from all agents into polished deliverables", Set.of());

    private DefaultAgentProfiles() {}

    public static List<AgentProfile> all() {
        return List.of(ORCHESTRATOR, DEVELOPER, UI_UX, QA, RESEARCHER, SECURITY_AUDITOR, DOCUMENTER, REFINER);
    }

    public static void registerAll(AgentRegistry registry) {
        all().forEach(registry::register);
    }
}
