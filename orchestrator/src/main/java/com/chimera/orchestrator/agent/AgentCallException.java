package com.chimera.orchestrator.agent;

import com.chimera.orchestrator.OrchestratorException;

/**
 * Thrown when a remote agent returns an error status, an unreadable body,
 * or cannot be reached at all.
 */
public class AgentCallException extends OrchestratorException {

    public AgentCallException(String message) {
        super(message);
    }

    public AgentCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
