package com.chimera.orchestrator.config;

import com.chimera.orchestrator.model.ChimeraPhase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

/**
 * Typed view of the {@code chimera.*} configuration tree.
 *
 * Every scheduling and retry constant lives in application.yml rather than
 * in code; see the defaults shipped there.
 */
@Validated
@ConfigurationProperties(prefix = "chimera")
public record ChimeraProperties(
        @Valid @NotNull Pool pool,
        @Valid @NotNull Retry retry,
        @Valid @NotNull Phases phases,
        @Valid @NotNull Agents agents,
        @Valid @NotNull Health health) {

    /**
     * @param maxConcurrent     global ceiling on RUNNING tasks owned by this pool
     * @param pollInterval      delay between admission ticks
     * @param heartbeatInterval how often owned RUNNING rows are touched
     * @param staleAfter        a RUNNING row whose heartbeat is older than this is re-admitted;
     *                          must comfortably exceed heartbeatInterval
     * @param shutdownTimeout   how long stop() waits for in-flight phase steps
     * @param autoStart         start polling with the application context
     */
    public record Pool(
            @Min(1) int maxConcurrent,
            @NotNull Duration pollInterval,
            @NotNull Duration heartbeatInterval,
            @NotNull Duration staleAfter,
            @NotNull Duration shutdownTimeout,
            boolean autoStart) {}

    /**
     * Per-phase retry policy for recoverable agent failures.
     *
     * @param maxRetries     retries of one phase before the task is marked FAILED
     * @param initialBackoff wait before the first retry
     * @param multiplier     exponential growth factor between retries
     * @param maxBackoff     upper bound on any single wait
     * @param jitter         randomisation factor in [0, 1)
     */
    public record Retry(
            @Min(0) int maxRetries,
            @NotNull Duration initialBackoff,
            @DecimalMin("1.0") double multiplier,
            @NotNull Duration maxBackoff,
            @DecimalMin("0.0") @DecimalMax("0.99") double jitter) {}

    /**
     * @param defaultTimeout bound on a single agent call
     * @param timeouts       optional per-phase overrides
     */
    public record Phases(
            @NotNull Duration defaultTimeout,
            Map<ChimeraPhase, Duration> timeouts) {

        public Duration timeoutFor(ChimeraPhase phase) {
            if (timeouts != null && timeouts.containsKey(phase)) {
                return timeouts.get(phase);
            }
            return defaultTimeout;
        }
    }

    /**
     * @param remoteEnabled  create the HTTP agent adapters
     * @param requestTimeout HTTP request timeout for agent calls
     * @param baseUrls       agent name (e.g. "coder-agent") → base URL
     */
    public record Agents(
            boolean remoteEnabled,
            Duration requestTimeout,
            Map<String, String> baseUrls) {}

    /**
     * Warning / critical thresholds for the pool health indicator.
     *
     * A warning reports DEGRADED, a critical breach reports CRITICAL. Rates
     * are fractions in [0, 1]; utilization is a percentage of the pool size.
     *
     * @param minSamples  processed workflows required before success and
     *                    per-phase failure rates are judged
     */
    public record Health(
            @Min(1) int minSamples,
            @DecimalMin("0.0") @DecimalMax("1.0") double successRateWarning,
            @DecimalMin("0.0") @DecimalMax("1.0") double successRateCritical,
            @DecimalMin("0.0") @DecimalMax("100.0") double poolUtilizationWarningPct,
            @DecimalMin("0.0") @DecimalMax("100.0") double poolUtilizationCriticalPct,
            @NotNull Duration p95LatencyWarning,
            @NotNull Duration p95LatencyCritical,
            @Min(0) long queueDepthWarning,
            @Min(0) long queueDepthCritical,
            @DecimalMin("0.0") @DecimalMax("1.0") double phaseFailureRateWarning,
            @DecimalMin("0.0") @DecimalMax("1.0") double phaseFailureRateCritical) {

        public Health {
            if (successRateWarning <= successRateCritical) {
                throw new IllegalArgumentException("success-rate-warning (" + successRateWarning
                        + ") must be above success-rate-critical (" + successRateCritical + ")");
            }
            requireBelow("pool-utilization-warning-pct", poolUtilizationWarningPct, poolUtilizationCriticalPct);
            if (p95LatencyWarning != null && p95LatencyCritical != null
                    && p95LatencyWarning.compareTo(p95LatencyCritical) >= 0) {
                throw new IllegalArgumentException("p95-latency-warning must be below p95-latency-critical");
            }
            requireBelow("queue-depth-warning", queueDepthWarning, queueDepthCritical);
            requireBelow("phase-failure-rate-warning", phaseFailureRateWarning, phaseFailureRateCritical);
        }

        private static void requireBelow(String name, double warning, double critical) {
            if (warning >= critical) {
                throw new IllegalArgumentException(name + " (" + warning + ") must be below its critical value ("
                        + critical + ")");
            }
        }
    }
}
