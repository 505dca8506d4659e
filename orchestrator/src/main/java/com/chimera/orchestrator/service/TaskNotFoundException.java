package com.chimera.orchestrator.service;

import com.chimera.orchestrator.OrchestratorException;

public class TaskNotFoundException extends OrchestratorException {
    public TaskNotFoundException(String taskId) {
        super("No workflow task with id: '" + taskId + "'");
    }
}
