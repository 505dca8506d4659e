package com.chimera.orchestrator.metrics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Point-in-time snapshot of executor pool activity.
 *
 * Serialized in snake_case (pool_size, active_workflows, ...) for scrapers.
 * Percentiles are computed over a sliding window of recent workflows; the
 * average and counters cover the whole lifetime of the pool.
 * queueDepth counts QUEUED tasks in the shared store, not only this pool's.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PoolMetrics(
        int    poolSize,
        int    activeWorkflows,
        int    availableSlots,
        double poolUtilizationPct,
        long   queueDepth,
        long   totalWorkflowsProcessed,
        long   totalWorkflowsSucceeded,
        long   totalWorkflowsFailed,
        double avgWorkflowDurationMs,
        double successRate,
        double p50DurationMs,
        double p95DurationMs,
        double p99DurationMs,
        long   totalRetryAttempts,
        Map<String, Double> failureRateByPhase
) {}
