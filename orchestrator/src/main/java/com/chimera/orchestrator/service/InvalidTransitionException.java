package com.chimera.orchestrator.service;

import com.chimera.orchestrator.OrchestratorException;

/**
 * A requested phase or status change is not allowed from the stored state,
 * e.g. skipping a phase, leaving a terminal phase, or completing a task
 * that is not RUNNING.
 *
 * This is a contract violation, not a transient error: the worker loop
 * logs it and marks the task FAILED instead of retrying.
 */
public class InvalidTransitionException extends OrchestratorException {
    public InvalidTransitionException(String message) {
        super(message);
    }
}
