package com.chimera.orchestrator.agent.remote;

import com.chimera.orchestrator.agent.AgentResult;
import com.chimera.orchestrator.agent.CoderAgent;
import com.chimera.orchestrator.model.AgentRole;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class RemoteCoderAgent implements CoderAgent {

    private final RemoteAgentClient client;

    public RemoteCoderAgent(RemoteAgentClient client) {
        this.client = client;
    }

    @Override
    @CircuitBreaker(name = "coder-agent")
    public CompletableFuture<AgentResult> implementFeature(String testPath, String featureDescription) {
        return client.call(AgentRole.CODER, "implement_feature",
                Map.of("test_path", testPath, "feature", featureDescription));
    }
}
