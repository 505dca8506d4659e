package com.chimera.orchestrator.agent.remote;

import com.chimera.orchestrator.agent.AgentCallException;
import com.chimera.orchestrator.agent.AgentResult;
import com.chimera.orchestrator.model.AgentRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the HTTP binding against an in-process JDK HttpServer.
 */
class RemoteAgentClientTest {

    HttpServer server;
    RemoteAgentClient client;
    final AtomicReference<String> lastPath = new AtomicReference<>();
    final AtomicReference<String> lastBody = new AtomicReference<>();
    final ObjectMapper json = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/actions/review_pr", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, """
                    {"status":"success","decision":"approved","score":8.5}
                    """);
        });
        server.createContext("/actions/deploy_to_staging", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 503, "staging cluster unavailable");
        });
        server.createContext("/actions/generate_test", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 200, "not json");
        });
        server.start();

        String base = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new RemoteAgentClient(Map.of(
                "guardian-agent",   base,
                "deployment-agent", base + "/",
                "e2e-tester-agent", base),
                Duration.ofSeconds(5), json);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void call_postsParamsAndParsesResult() throws Exception {
        AgentResult result = client.call(AgentRole.GUARDIAN, "review_pr", Map.of("pr_id", "PR-42"))
                .get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.string("decision")).isEqualTo("approved");
        assertThat(lastPath.get()).isEqualTo("/actions/review_pr");
        assertThat(json.readTree(lastBody.get()).path("params").path("pr_id").asText()).isEqualTo("PR-42");
    }

    @Test
    void call_non2xx_failsWithAgentCallException() {
        assertThatThrownBy(() -> client.call(AgentRole.DEPLOYMENT, "deploy_to_staging",
                        Map.of("commit_sha", "abc")).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AgentCallException.class)
                .hasMessageContaining("HTTP 503");
    }

    @Test
    void call_unparseableBody_failsWithAgentCallException() {
        assertThatThrownBy(() -> client.call(AgentRole.E2E_TESTER, "generate_test",
                        Map.of("feature", "f", "url", "u")).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AgentCallException.class);
    }

    @Test
    void call_unconfiguredAgent_failsWithoutNetwork() {
        assertThat(client.call(AgentRole.CODER, "implement_feature", Map.of()))
                .isCompletedExceptionally();
    }

    @Test
    void remoteGuardian_delegatesToClient() throws Exception {
        AgentResult result = new RemoteGuardianAgent(client).reviewPr("PR-7").get(5, TimeUnit.SECONDS);

        assertThat(result.string("decision")).isEqualTo("approved");
        assertThat(lastBody.get()).contains("PR-7");
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
