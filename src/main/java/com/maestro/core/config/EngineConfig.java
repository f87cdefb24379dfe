package com.maestro.core.config;

import com.maestro.core.agent.AgentRegistry;
import com.maestro.core.agent.CapabilityScorer;
import com.maestro.core.agent.DefaultAgentProfiles;
import com.maestro.core.agent.KeywordCapabilityScorer;
import com.maestro.core.engine.AgentExecutor;
import com.maestro.core.engine.MockAgentExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root for the agent catalog and the default executor.
 * Host applications override either bean by declaring their own.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public CapabilityScorer capabilityScorer() {
        return new KeywordCapabilityScorer();
    }

    @Bean
    public AgentRegistry agentRegistry(CapabilityScorer scorer, EngineProperties properties) {
        var registry = new AgentRegistry(scorer);
        if (properties.isRegisterDefaultAgents()) {
            DefaultAgentProfiles.registerAll(registry);
            log.info("Registered {} default agents", registry.size());
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentExecutor agentExecutor() {
        log.info("No AgentExecutor bean supplied, tasks will run against the mock executor");
        return new MockAgentExecutor();
    }
}
