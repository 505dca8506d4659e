package com.chimera.orchestrator.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured output of one agent call.
 *
 * Always carries a {@code status}; the remaining keys depend on the action
 * (test_path, pr_id, commit_sha, decision, staging_url, tests_passed, ...).
 */
public record AgentResult(Map<String, Object> fields) {

    public static final String STATUS = "status";

    public AgentResult {
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static AgentResult of(Map<String, ?> fields) {
        return new AgentResult(fields == null ? null : new LinkedHashMap<>(fields));
    }

    public String status() {
        return string(STATUS);
    }

    /** True for the statuses agents use to report a finished action. */
    public boolean isSuccess() {
        String s = status();
        return "success".equalsIgnoreCase(s) || "passed".equalsIgnoreCase(s);
    }

    /** String value of {@code key}, or null when absent. */
    public String string(String key) {
        Object v = fields.get(key);
        return v == null ? null : v.toString();
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean has(String key) {
        return fields.get(key) != null;
    }
}
