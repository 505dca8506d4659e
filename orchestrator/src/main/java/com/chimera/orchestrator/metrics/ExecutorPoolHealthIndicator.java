package com.chimera.orchestrator.metrics;

import com.chimera.orchestrator.config.ChimeraProperties;
import com.chimera.orchestrator.service.ExecutorPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actuator health contribution for the executor pool ("executorPool").
 *
 * Each metric is compared against a warning and a critical threshold
 * (chimera.health.*):
 * <ul>
 *   <li>pool utilization and p95 workflow latency;</li>
 *   <li>queue depth;</li>
 *   <li>success rate and per-phase failure rate, once min-samples
 *       workflows have finished.</li>
 * </ul>
 * DOWN when the pool is not running, CRITICAL if any critical alert fired,
 * DEGRADED if only warnings fired, UP otherwise. Alerts are listed in the
 * details, critical first.
 */
@Component
public class ExecutorPoolHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Pool metrics past a warning threshold");
    public static final Status CRITICAL = new Status("CRITICAL", "Pool metrics past a critical threshold");

    static final String WARNING_SEVERITY  = "warning";
    static final String CRITICAL_SEVERITY = "critical";

    private final ExecutorPool             pool;
    private final ChimeraProperties.Health thresholds;

    public ExecutorPoolHealthIndicator(ExecutorPool pool, ChimeraProperties properties) {
        this.pool       = pool;
        this.thresholds = properties.health();
    }

    @Override
    public Health health() {
        PoolMetrics m = pool.getMetrics();
        List<Alert> alerts = assess(m);

        Health.Builder builder;
        if (!pool.isRunning()) {
            builder = Health.down();
        } else if (alerts.stream().anyMatch(Alert::isCritical)) {
            builder = Health.status(CRITICAL);
        } else if (!alerts.isEmpty()) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("poolSize",           m.poolSize())
                .withDetail("activeWorkflows",    m.activeWorkflows())
                .withDetail("poolUtilizationPct", m.poolUtilizationPct())
                .withDetail("queueDepth",         m.queueDepth())
                .withDetail("processed",          m.totalWorkflowsProcessed())
                .withDetail("successRate",        m.successRate())
                .withDetail("p95DurationMs",      m.p95DurationMs())
                .withDetail("alerts",             alerts.stream().map(Alert::toDetail).toList())
                .build();
    }

    // ------------------------------------------------------------------
    // Threshold checks
    // ------------------------------------------------------------------

    List<Alert> assess(PoolMetrics m) {
        List<Alert> alerts = new ArrayList<>();

        above(alerts, "pool_utilization", m.poolUtilizationPct(),
                thresholds.poolUtilizationWarningPct(), thresholds.poolUtilizationCriticalPct());
        above(alerts, "p95_latency_ms", m.p95DurationMs(),
                thresholds.p95LatencyWarning().toMillis(), thresholds.p95LatencyCritical().toMillis());
        above(alerts, "queue_depth", m.queueDepth(),
                thresholds.queueDepthWarning(), thresholds.queueDepthCritical());

        if (m.totalWorkflowsProcessed() >= thresholds.minSamples()) {
            double rate = m.successRate();
            if (rate <= thresholds.successRateCritical()) {
                alerts.add(new Alert(CRITICAL_SEVERITY, "success_rate", rate, thresholds.successRateCritical()));
            } else if (rate <= thresholds.successRateWarning()) {
                alerts.add(new Alert(WARNING_SEVERITY, "success_rate", rate, thresholds.successRateWarning()));
            }
            m.failureRateByPhase().forEach((phase, failureRate) ->
                    above(alerts, "failure_rate_" + phase, failureRate,
                            thresholds.phaseFailureRateWarning(), thresholds.phaseFailureRateCritical()));
        }

        alerts.sort((a, b) -> Boolean.compare(b.isCritical(), a.isCritical()));
        return alerts;
    }

    private static void above(List<Alert> alerts, String metric, double value, double warning, double critical) {
        if (value >= critical) {
            alerts.add(new Alert(CRITICAL_SEVERITY, metric, value, critical));
        } else if (value >= warning) {
            alerts.add(new Alert(WARNING_SEVERITY, metric, value, warning));
        }
    }

    record Alert(String severity, String metric, double value, double threshold) {

        boolean isCritical() {
            return CRITICAL_SEVERITY.equals(severity);
        }

        Map<String, Object> toDetail() {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("severity",  severity);
            detail.put("metric",    metric);
            detail.put("value",     value);
            detail.put("threshold", threshold);
            return detail;
        }
    }
}
