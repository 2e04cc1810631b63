package com.agentcrew.orchestrator.sourcehost;

import com.agentcrew.orchestrator.model.RepositoryRef;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
 * {@link SourceHost} backed by the GitHub REST API.
 *
 * Branches are cut from the configured default branch; pull requests target it.
 */
@Component
public class GitHubSourceHost implements SourceHost {

    private static final Logger log = LoggerFactory.getLogger(GitHubSourceHost.class);

    private static final String API_VERSION = "2022-11-28";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitRef(GitObject object) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record GitObject(String sha) {}
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final String       defaultBranch;

    public GitHubSourceHost(@Value("${agentcrew.source-host.base-url:https://api.github.com}") String baseUrl,
                            @Value("${agentcrew.source-host.token:}") String token,
                            @Value("${agentcrew.source-host.default-branch:main}") String defaultBranch,
                            ObjectMapper objectMapper) {
        this.baseUrl       = baseUrl;
        this.token         = token;
        this.defaultBranch = defaultBranch;
        this.json          = objectMapper;
        this.http          = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void createBranch(RepositoryRef repo, String branchName) {
        String base = send("GET", "/repos/" + repo.fullName() + "/git/ref/heads/" + defaultBranch, null);
        try {
            String sha = json.readValue(base, GitRef.class).object().sha();
            send("POST", "/repos/" + repo.fullName() + "/git/refs",
                    json.writeValueAsString(Map.of("ref", "refs/heads/" + branchName, "sha", sha)));
            log.info("Created branch {} on {} from {}@{}", branchName, repo, defaultBranch, sha);
        } catch (SourceHostException e) {
            throw e;
        } catch (Exception e) {
            throw new SourceHostException("createBranch " + branchName + " on " + repo + " failed", e);
        }
    }

    @Override
    public PullRequestRef createPullRequest(RepositoryRef repo, String branchName, String title, String body) {
        try {
            String resp = send("POST", "/repos/" + repo.fullName() + "/pulls",
                    json.writeValueAsString(Map.of(
                            "title", title,
                            "body",  body,
                            "head",  branchName,
                            "base",  defaultBranch)));
            PullRequestRef pr = json.readValue(resp, PullRequestRef.class);
            log.info("Opened pull request #{} for {} on {}", pr.number(), branchName, repo);
            return pr;
        } catch (SourceHostException e) {
            throw e;
        } catch (Exception e) {
            throw new SourceHostException("createPullRequest for " + branchName + " on " + repo + " failed", e);
        }
    }

    private String send(String method, String path, String body) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(30))
                    .header("Accept",               "application/vnd.github+json")
                    .header("X-GitHub-Api-Version", API_VERSION)
                    .method(method, body == null
                            ? HttpRequest.BodyPublishers.noBody()
                            : HttpRequest.BodyPublishers.ofString(body));
            if (body != null) {
                req.header("Content-Type", "application/json");
            }
            if (!token.isBlank()) {
                req.header("Authorization", "Bearer " + token);
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new SourceHostException(resp.statusCode(), method + " " + path + ": " + resp.body());
            }
            return resp.body();
        } catch (SourceHostException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceHostException(method + " " + path + " interrupted", e);
        } catch (Exception e) {
            throw new SourceHostException(method + " " + path + " failed", e);
        }
    }
}
