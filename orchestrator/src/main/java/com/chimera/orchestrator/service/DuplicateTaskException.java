package com.chimera.orchestrator.service;

import com.chimera.orchestrator.OrchestratorException;

/** Thrown by enqueue when a task with the same id already exists. */
public class DuplicateTaskException extends OrchestratorException {

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task already exists: '" + taskId + "'");
        this.taskId = taskId;
    }

    public DuplicateTaskException(String taskId, Throwable cause) {
        super("Task already exists: '" + taskId + "'", cause);
        this.taskId = taskId;
    }

    public String getTaskId() { return taskId; }
}
