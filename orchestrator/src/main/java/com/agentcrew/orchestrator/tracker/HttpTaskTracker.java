package com.agentcrew.orchestrator.tracker;

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
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the issue tracker service.
 *
 * Task IDs reach this class only after format validation, but they are still
 * URL-encoded before being placed in a path.
 */
@Component
public class HttpTaskTracker implements TaskTracker {

    private static final Logger log = LoggerFactory.getLogger(HttpTaskTracker.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpTaskTracker(
            @Value("${agentcrew.tracker.base-url:http://localhost:8091}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public Optional<TrackerIssue> showIssue(String taskId) {
        HttpResponse<String> resp = exchange("GET", issuePath(taskId), null, "showIssue " + taskId);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(resp, "showIssue " + taskId);
        try {
            return Optional.of(json.readValue(resp.body(), TrackerIssue.class));
        } catch (JsonProcessingException e) {
            throw new TaskTrackerException("Failed to parse issue " + taskId, e);
        }
    }

    @Override
    public void markInProgress(String taskId) {
        log.info("Marking {} in progress in tracker", taskId);
        requireSuccess(exchange("POST", issuePath(taskId) + "/status",
                toJson(Map.of("status", "in_progress")), "markInProgress " + taskId),
                "markInProgress " + taskId);
    }

    @Override
    public void addComment(String taskId, String author, String text) {
        log.info("Commenting on {} as {}", taskId, author);
        requireSuccess(exchange("POST", issuePath(taskId) + "/comments",
                toJson(Map.of("author", author, "text", text)), "addComment " + taskId),
                "addComment " + taskId);
    }

    @Override
    public void markComplete(String taskId) {
        log.info("Marking {} complete in tracker", taskId);
        requireSuccess(exchange("POST", issuePath(taskId) + "/close",
                toJson(Map.of("status", "closed")), "markComplete " + taskId),
                "markComplete " + taskId);
    }

    @Override
    public void markFailed(String taskId, String reason) {
        log.info("Marking {} failed in tracker", taskId);
        requireSuccess(exchange("POST", issuePath(taskId) + "/fail",
                toJson(Map.of("reason", reason)), "markFailed " + taskId),
                "markFailed " + taskId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String issuePath(String taskId) {
        return "/issues/" + URLEncoder.encode(taskId, StandardCharsets.UTF_8);
    }

    private HttpResponse<String> exchange(String method, String path, String jsonBody, String opName) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(30))
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
            throw new TaskTrackerException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new TaskTrackerException(opName + " failed", e);
        }
    }

    private static void requireSuccess(HttpResponse<String> resp, String opName) {
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new TaskTrackerException(
                    opName + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new TaskTrackerException("JSON serialization failed", e);
        }
    }
}
