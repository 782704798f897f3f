package com.agentcrew.orchestrator.runtime;

import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.runtime.dto.ProcessListResponse;
import com.agentcrew.orchestrator.runtime.dto.SpawnRequest;
import com.agentcrew.orchestrator.runtime.dto.SpawnedProcess;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the process runtime service.
 *
 * <pre>
 *   POST   /processes                 spawn
 *   POST   /processes/{id}/messages   resume
 *   POST   /processes/{id}/stop       stop (body: {"force": bool})
 *   GET    /processes/{id}            find (404 → empty)
 *   GET    /processes                 list
 * </pre>
 *
 * Mutating calls happen on the command-processor thread, so blocking I/O is acceptable.
 */
@Component
public class HttpProcessRuntime implements ProcessRuntime {

    private static final Logger log = LoggerFactory.getLogger(HttpProcessRuntime.class);

    // Spawning includes the agent's first turn, which can take a while.
    private static final Duration SPAWN_TIMEOUT   = Duration.ofSeconds(120);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpProcessRuntime(
            @Value("${agentcrew.runtime.base-url:http://localhost:8090}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public SpawnedProcess spawn(SpawnRequest request) {
        log.info("Spawning worker process (agentType={})", request.agentType());
        String body = send("POST", "/processes", toJson(request), "spawn", SPAWN_TIMEOUT).body();
        SpawnedProcess spawned = parse(body, SpawnedProcess.class, "spawn");
        log.info("Spawned process '{}' (session={})", spawned.processId(), spawned.sessionId());
        return spawned;
    }

    @Override
    public void resume(String processId, String message) {
        log.debug("Resuming process '{}' ({} chars)", processId, message.length());
        send("POST", "/processes/" + encode(processId) + "/messages",
                toJson(Map.of("message", message)), "resume " + processId, DEFAULT_TIMEOUT);
    }

    @Override
    public void stop(String processId, boolean force) {
        log.info("Stopping process '{}' (force={})", processId, force);
        send("POST", "/processes/" + encode(processId) + "/stop",
                toJson(Map.of("force", force)), "stop " + processId, DEFAULT_TIMEOUT);
    }

    @Override
    public Optional<ProcessInfo> find(String processId) {
        HttpResponse<String> resp = exchange("GET", "/processes/" + encode(processId), null,
                "find " + processId, DEFAULT_TIMEOUT);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(resp, "find " + processId);
        return Optional.of(parse(resp.body(), ProcessInfo.class, "find " + processId));
    }

    @Override
    public List<ProcessInfo> list() {
        String body = send("GET", "/processes", null, "list", DEFAULT_TIMEOUT).body();
        return parse(body, ProcessListResponse.class, "list").processes();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> send(String method, String path, String jsonBody,
                                      String opName, Duration timeout) {
        HttpResponse<String> resp = exchange(method, path, jsonBody, opName, timeout);
        requireSuccess(resp, opName);
        return resp;
    }

    private HttpResponse<String> exchange(String method, String path, String jsonBody,
                                          String opName, Duration timeout) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Accept", "application/json");
            if (jsonBody != null) {
                req.header("Content-Type", "application/json")
                   .method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
            } else {
                req.method(method, HttpRequest.BodyPublishers.noBody());
            }
            return http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessRuntimeException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ProcessRuntimeException(opName + " failed", e);
        }
    }

    private static void requireSuccess(HttpResponse<String> resp, String opName) {
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ProcessRuntimeException(
                    opName + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ProcessRuntimeException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ProcessRuntimeException("JSON serialization failed", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
