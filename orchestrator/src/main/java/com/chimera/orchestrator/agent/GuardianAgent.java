package com.chimera.orchestrator.agent;

import java.util.concurrent.CompletableFuture;

public interface GuardianAgent {

    /** Result carries {@code decision}: "approved", "rejected" or "changes_requested". */
    CompletableFuture<AgentResult> reviewPr(String prId);
}
