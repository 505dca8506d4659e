package com.chimera.orchestrator.workflow;

import com.chimera.orchestrator.model.ChimeraPhase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of running one phase step.
 *
 * <ul>
 *   <li>ADVANCED: the agent succeeded; move to {@code next} and merge {@code contextPatch}.</li>
 *   <li>REJECTED: a business failure (review rejected, validation failed,
 *       missing input). Never retried.</li>
 *   <li>ERROR: a recoverable failure (exception, timeout, failure status,
 *       open circuit, missing agent). Retried up to the configured limit.</li>
 * </ul>
 */
public record PhaseOutcome(Kind kind, ChimeraPhase next, Map<String, Object> contextPatch, String reason) {

    public enum Kind { ADVANCED, REJECTED, ERROR }

    public PhaseOutcome {
        contextPatch = contextPatch == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contextPatch));
    }

    public static PhaseOutcome advanced(ChimeraPhase next, Map<String, Object> contextPatch) {
        return new PhaseOutcome(Kind.ADVANCED, next, contextPatch, null);
    }

    public static PhaseOutcome rejected(String reason) {
        return new PhaseOutcome(Kind.REJECTED, ChimeraPhase.FAILED, Map.of(), reason);
    }

    public static PhaseOutcome error(String reason) {
        return new PhaseOutcome(Kind.ERROR, null, Map.of(), reason);
    }

    public boolean isAdvanced() { return kind == Kind.ADVANCED; }
    public boolean isRejected() { return kind == Kind.REJECTED; }
    public boolean isError()    { return kind == Kind.ERROR; }
}
