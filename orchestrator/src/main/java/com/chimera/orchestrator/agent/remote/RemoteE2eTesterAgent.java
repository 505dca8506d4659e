package com.chimera.orchestrator.agent.remote;

import com.chimera.orchestrator.agent.AgentResult;
import com.chimera.orchestrator.agent.E2eTesterAgent;
import com.chimera.orchestrator.model.AgentRole;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class RemoteE2eTesterAgent implements E2eTesterAgent {

    private final RemoteAgentClient client;

    public RemoteE2eTesterAgent(RemoteAgentClient client) {
        this.client = client;
    }

    @Override
    @CircuitBreaker(name = "e2e-tester-agent")
    public CompletableFuture<AgentResult> generateTest(String featureDescription, String targetUrl) {
        return client.call(AgentRole.E2E_TESTER, "generate_test",
                Map.of("feature", featureDescription, "url", targetUrl));
    }

    @Override
    @CircuitBreaker(name = "e2e-tester-agent")
    public CompletableFuture<AgentResult> executeTest(String testPath, String targetUrl) {
        return client.call(AgentRole.E2E_TESTER, "execute_test",
                Map.of("test_path", testPath, "url", targetUrl));
    }
}
