package com.z254.butterfly.scout.agent;

/**
 * The closed set of audit agents, by the name they are registered under in a run.
 */
public enum AuditAgentType {

    REPOSITORY_CLONER("repository_cloner"),
    SECURITY_ANALYST("security_analyst"),
    CODE_REVIEWER("code_reviewer"),
    REPORTER("reporter");

    private final String agentName;

    AuditAgentType(String agentName) {
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
