package com.chimera.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /workflows.
 *
 * Required: featureDescription, targetUrl
 * Optional: taskId (a UUID is generated when absent), priority (default 0)
 */
public record EnqueueWorkflowRequest(
        @Size(max = 128) String taskId,
        @NotBlank String featureDescription,
        @NotBlank @Size(max = 2048) String targetUrl,
        Integer priority) {

    public int priorityOrDefault() {
        return priority == null ? 0 : priority;
    }
}
