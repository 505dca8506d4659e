package com.chimera.orchestrator.agent.remote;

import com.chimera.orchestrator.agent.AgentCallException;
import com.chimera.orchestrator.agent.AgentResult;
import com.chimera.orchestrator.model.AgentRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client for agent services.
 *
 * Every action is a POST of {@code {"params": {...}}} to
 * {@code <base-url>/actions/<action>}; the response body is the JSON result
 * object. Uses java.net.http.HttpClient so we have explicit control over
 * every header and byte on the wire.
 */
public class RemoteAgentClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteAgentClient.class);

    private static final TypeReference<LinkedHashMap<String, Object>> RESULT_TYPE = new TypeReference<>() {};

    private final HttpClient          http;
    private final ObjectMapper        json;
    private final Map<String, String> baseUrls;
    private final Duration            requestTimeout;

    public RemoteAgentClient(Map<String, String> baseUrls, Duration requestTimeout, ObjectMapper objectMapper) {
        this.baseUrls       = Map.copyOf(baseUrls);
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Invoke {@code action} on the agent serving {@code role}.
     *
     * The future fails with {@link AgentCallException} on a non-2xx status,
     * an unreadable body, or a transport error.
     */
    public CompletableFuture<AgentResult> call(AgentRole role, String action, Map<String, ?> params) {
        String opName = role.agentName() + "." + action;
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrlFor(role) + "/actions/" + action))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(Map.of("params", params))))
                    .build();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    e instanceof AgentCallException ? e : new AgentCallException(opName + " failed", e));
        }

        log.debug("Calling {}", opName);
        return http.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, error) -> {
                    if (error != null) {
                        throw new AgentCallException(opName + " failed", error);
                    }
                    if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                        throw new AgentCallException(
                                opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
                    }
                    return parse(resp.body(), opName);
                });
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String baseUrlFor(AgentRole role) {
        String url = baseUrls.get(role.agentName());
        if (url == null || url.isBlank()) {
            throw new AgentCallException("No base URL configured for " + role.agentName());
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private AgentResult parse(String body, String opName) {
        try {
            Map<String, Object> fields = json.readValue(body, RESULT_TYPE);
            if (fields == null) {
                throw new AgentCallException(opName + " returned an empty body");
            }
            return AgentResult.of(fields);
        } catch (JsonProcessingException e) {
            throw new AgentCallException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AgentCallException("JSON serialization failed", e);
        }
    }
}
