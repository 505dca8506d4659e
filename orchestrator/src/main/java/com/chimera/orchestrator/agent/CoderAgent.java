package com.chimera.orchestrator.agent;

import java.util.concurrent.CompletableFuture;

/** Implements a feature so that the given test passes, and opens a PR. */
public interface CoderAgent {

    /** Result carries {@code pr_id} and {@code commit_sha}. */
    CompletableFuture<AgentResult> implementFeature(String testPath, String featureDescription);
}
