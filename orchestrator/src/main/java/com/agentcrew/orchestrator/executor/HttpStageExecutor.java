package com.agentcrew.orchestrator.executor;

import com.agentcrew.orchestrator.executor.dto.ExecuteStageRequest;
import com.agentcrew.orchestrator.executor.dto.ExecuteStageResponse;
import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.pipeline.StageExecutor;
import com.agentcrew.orchestrator.pipeline.StageResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the code-generation engine.
 *
 * One blocking POST per stage; called from the pipeline worker pool.
 * A stage the engine reports as failed comes back as a failed {@link StageResult};
 * anything that prevents getting an answer is an {@link ExecutorException}.
 */
@Component
public class HttpStageExecutor implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpStageExecutor.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final long         stageTimeoutSec;

    public HttpStageExecutor(
            @Value("${agentcrew.executor.base-url}") String baseUrl,
            @Value("${agentcrew.executor.stage-timeout-seconds:900}") long stageTimeoutSec,
            ObjectMapper objectMapper) {
        this.baseUrl         = baseUrl;
        this.stageTimeoutSec = stageTimeoutSec;
        this.json            = objectMapper;
        this.http            = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public StageResult execute(WorkUnit unit, AgentRole agentType, String instructions, Map<String, String> context) {
        RepositoryRef repo = unit.repository();
        log.info("Executing {} stage for unit {}", agentType.label(), unit.getId());
        String body = toJson(unit, agentType, new ExecuteStageRequest(
                unit.getId(),
                repo == null ? null : repo.fullName(),
                agentType.label(),
                unit.getTitle(),
                instructions,
                context,
                stageTimeoutSec));

        // Allow a bit more wall-clock time than the engine's own deadline.
        String respBody = post(unit, agentType, body, Duration.ofSeconds(stageTimeoutSec + 30));
        try {
            ExecuteStageResponse resp = json.readValue(respBody, ExecuteStageResponse.class);
            return resp.success()
                    ? StageResult.success(resp.output(), resp.files_changed())
                    : new StageResult(false, resp.output(), resp.files_changed(), resp.error());
        } catch (JsonProcessingException e) {
            throw new ExecutorException(unit.getId(), agentType, "failed to parse execute response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(WorkUnit unit, AgentRole agentType, String jsonBody, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/execute"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(unit.getId(), agentType, resp.statusCode(), resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(unit.getId(), agentType, "interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(unit.getId(), agentType, "engine unreachable: " + e.getMessage(), e);
        }
    }

    private String toJson(WorkUnit unit, AgentRole agentType, Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException(unit.getId(), agentType, "JSON serialization failed", e);
        }
    }
}
