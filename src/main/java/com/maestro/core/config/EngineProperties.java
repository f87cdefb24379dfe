package com.maestro.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "maestro")
public class EngineProperties {

    private Engine engine = new Engine();
    private WorkflowDefaults workflow = new WorkflowDefaults();
    private Agents agents = new Agents();

    // -- Engine accessors (delegate to nested) --
    public int getMaxParallel() { return engine.maxParallel; }
    public int getDriverThreads() { return engine.driverThreads; }
    public int getResultPreviewLength() { return engine.resultPreviewLength; }

    // -- Workflow accessors (delegate to nested) --
    public int getDefaultPriority() { return workflow.defaultPriority; }
    public int getDefaultMaxRetries() { return workflow.defaultMaxRetries; }
    public String getDefaultAssignee() { return workflow.defaultAssignee; }
    public boolean isValidatePlans() { return workflow.validatePlans; }

    public boolean isRegisterDefaultAgents() { return agents.registerDefaults; }

    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public WorkflowDefaults getWorkflow() { return workflow; }
    public void setWorkflow(WorkflowDefaults workflow) { this.workflow = workflow; }
    public Agents getAgents() { return agents; }
    public void setAgents(Agents agents) { this.agents = agents; }

    public static class Engine {
        private int maxParallel = 4;
        private int driverThreads = 4;
        private int resultPreviewLength = 200;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getDriverThreads() { return driverThreads; }
        public void setDriverThreads(int driverThreads) { this.driverThreads = driverThreads; }
        public int getResultPreviewLength() { return resultPreviewLength; }
        public void setResultPreviewLength(int resultPreviewLength) { this.resultPreviewLength = resultPreviewLength; }
    }

    public static class WorkflowDefaults {
        private int defaultPriority = 3;
        private int defaultMaxRetries = 2;
        private String defaultAssignee = "Developer";
        private boolean validatePlans = true;

        public int getDefaultPriority() { return defaultPriority; }
        public void setDefaultPriority(int defaultPriority) { this.defaultPriority = defaultPriority; }
        public int getDefaultMaxRetries() { return defaultMaxRetries; }
        public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }
        public String getDefaultAssignee() { return defaultAssignee; }
        public void setDefaultAssignee(String defaultAssignee) { this.defaultAssignee = defaultAssignee; }
        public boolean isValidatePlans() { return validatePlans; }
        public void setValidatePlans(boolean validatePlans) { this.validatePlans = validatePlans; }
    }

    public static class Agents {
        private boolean registerDefaults = true;

        public boolean isRegisterDefaults() { return registerDefaults; }
        public void setRegisterDefaults(boolean registerDefaults) { this.registerDefaults = registerDefaults; }
    }
}
