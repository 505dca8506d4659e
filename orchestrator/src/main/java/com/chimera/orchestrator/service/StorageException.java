package com.chimera.orchestrator.service;

import com.chimera.orchestrator.OrchestratorException;

/**
 * The task store could not be reached, or kept failing after the bounded
 * retries configured for the "task-store" resilience4j instance.
 */
public class StorageException extends OrchestratorException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
