package com.chimera.orchestrator.model;

/**
 * The four agent roles that back the Chimera phases.
 *
 * The tester role serves two phases (test generation and validation);
 * every other role serves one.
 */
public enum AgentRole {
    E2E_TESTER("e2e-tester-agent"),   // Writes the E2E test, later runs it against staging
    CODER("coder-agent"),             // Implements the feature and opens a PR
    GUARDIAN("guardian-agent"),       // Reviews the PR
    DEPLOYMENT("deployment-agent");   // Deploys the commit to staging

    private final String agentName;

    AgentRole(String agentName) {
        this.agentName = agentName;
    }

    /** Logical name used in configuration and logs, e.g. "coder-agent". */
    public String agentName() {
        return agentName;
    }
}
