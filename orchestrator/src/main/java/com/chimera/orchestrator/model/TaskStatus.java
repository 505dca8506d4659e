package com.chimera.orchestrator.model;

/**
 * Lifecycle status of a WorkflowTask row.
 *
 * Transitions:
 *   QUEUED  → RUNNING   (claimed by an executor pool)
 *   RUNNING → COMPLETED (pipeline reached COMPLETE)
 *   RUNNING → FAILED    (pipeline reached FAILED)
 *
 * COMPLETED and FAILED are write-once.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
