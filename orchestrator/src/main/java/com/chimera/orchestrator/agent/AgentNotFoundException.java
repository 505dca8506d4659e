package com.chimera.orchestrator.agent;

import com.chimera.orchestrator.OrchestratorException;
import com.chimera.orchestrator.model.AgentRole;

public class AgentNotFoundException extends OrchestratorException {
    public AgentNotFoundException(AgentRole role, Class<?> capability) {
        super("No agent registered for '" + role.agentName() + "' providing " + capability.getSimpleName());
    }
}
