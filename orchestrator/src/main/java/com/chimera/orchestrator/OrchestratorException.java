package com.chimera.orchestrator;

/**
 * Base type for every failure the orchestrator reports to its callers.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy; everything else propagates to the worker loop or the HTTP layer.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
