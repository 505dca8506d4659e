package com.chimera.orchestrator.api.dto;

import com.chimera.orchestrator.model.DeadLetterEntry;

import java.time.Instant;
import java.util.Map;

/** Response body for the /dead-letters endpoints. */
public record DeadLetterResponse(
        String  taskId,
        String  featureDescription,
        String  targetUrl,
        String  failureReason,
        int     retryCount,
        String  lastErrorPhase,
        Map<String, Object> workflowState,
        Instant createdAt
) {
    public static DeadLetterResponse from(DeadLetterEntry e) {
        return new DeadLetterResponse(
                e.getTaskId(),
                e.getFeatureDescription(),
                e.getTargetUrl(),
                e.getFailureReason(),
                e.getRetryCount(),
                e.getLastErrorPhase() == null ? null : e.getLastErrorPhase().name(),
                e.getWorkflowState(),
                e.getCreatedAt()
        );
    }
}
