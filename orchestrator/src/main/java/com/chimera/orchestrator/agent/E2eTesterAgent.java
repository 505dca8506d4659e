package com.chimera.orchestrator.agent;

import java.util.concurrent.CompletableFuture;

/** Writes an end-to-end test for a feature, and later runs it against staging. */
public interface E2eTesterAgent {

    /** Result carries {@code test_path} and usually {@code test_name}. */
    CompletableFuture<AgentResult> generateTest(String featureDescription, String targetUrl);

    /** Result status is "passed" or "failed"; also {@code tests_passed}. */
    CompletableFuture<AgentResult> executeTest(String testPath, String targetUrl);
}
