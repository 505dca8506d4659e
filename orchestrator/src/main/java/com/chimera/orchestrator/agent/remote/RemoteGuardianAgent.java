package com.chimera.orchestrator.agent.remote;

import com.chimera.orchestrator.agent.AgentResult;
import com.chimera.orchestrator.agent.GuardianAgent;
import com.chimera.orchestrator.model.AgentRole;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class RemoteGuardianAgent implements GuardianAgent {

    private final RemoteAgentClient client;

    public RemoteGuardianAgent(RemoteAgentClient client) {
        this.client = client;
    }

    @Override
    @CircuitBreaker(name = "guardian-agent")
    public CompletableFuture<AgentResult> reviewPr(String prId) {
        return client.call(AgentRole.GUARDIAN, "review_pr", Map.of("pr_id", prId));
    }
}
