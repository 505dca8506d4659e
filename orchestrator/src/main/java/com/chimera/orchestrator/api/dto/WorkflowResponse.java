package com.chimera.orchestrator.api.dto;

import com.chimera.orchestrator.model.WorkflowTask;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for POST /workflows and GET /workflows/{id}.
 * Carries the full per-task failure detail (retryCount, lastError, context).
 */
public record WorkflowResponse(
        String  id,
        String  featureDescription,
        String  targetUrl,
        int     priority,
        String  status,
        String  currentPhase,
        Map<String, Object> workflowContext,
        int     retryCount,
        String  lastError,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt
) {
    public static WorkflowResponse from(WorkflowTask task) {
        return new WorkflowResponse(
                task.getId(),
                task.getFeatureDescription(),
                task.getTargetUrl(),
                task.getPriority(),
                task.getStatus().name(),
                task.getCurrentPhase().name(),
                task.getWorkflowContext(),
                task.getRetryCount(),
                task.getLastError(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                task.getFinishedAt()
        );
    }
}
