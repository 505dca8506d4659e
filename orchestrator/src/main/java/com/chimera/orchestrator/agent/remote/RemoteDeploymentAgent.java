package com.chimera.orchestrator.agent.remote;

import com.chimera.orchestrator.agent.AgentResult;
import com.chimera.orchestrator.agent.DeploymentAgent;
import com.chimera.orchestrator.model.AgentRole;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class RemoteDeploymentAgent implements DeploymentAgent {

    private final RemoteAgentClient client;

    public RemoteDeploymentAgent(RemoteAgentClient client) {
        this.client = client;
    }

    @Override
    @CircuitBreaker(name = "deployment-agent")
    public CompletableFuture<AgentResult> deployToStaging(String commitSha) {
        return client.call(AgentRole.DEPLOYMENT, "deploy_to_staging", Map.of("commit_sha", commitSha));
    }
}
