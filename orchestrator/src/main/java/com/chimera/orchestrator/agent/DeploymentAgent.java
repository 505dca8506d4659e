package com.chimera.orchestrator.agent;

import java.util.concurrent.CompletableFuture;

public interface DeploymentAgent {

    /** Result carries {@code staging_url}. */
    CompletableFuture<AgentResult> deployToStaging(String commitSha);
}
