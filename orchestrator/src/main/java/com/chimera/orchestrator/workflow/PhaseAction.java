package com.chimera.orchestrator.workflow;

import java.time.Duration;
import java.util.Map;

/** The agent call a task's current phase will make next. */
public record PhaseAction(String agent, String action, Map<String, Object> params, Duration timeout) {
}
