package com.example.cronscheduler.client;

import com.example.cronscheduler.client.ClientModels.CommentResponse;
import com.example.cronscheduler.client.ClientModels.CreateCommentRequest;
import com.example.cronscheduler.client.ClientModels.CreateIssueRequest;
import com.example.cronscheduler.client.ClientModels.IssueResponse;
import com.example.cronscheduler.config.GitHubProperties;
import com.example.cronscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the GitHub Issues REST API.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker so a dead upstream is not hammered
 * - WebClient with bearer auth and the GitHub media type (see WebClientConfig)
 * <p>
 * Retries are applied by the caller's {@code RetryPolicy}, not here.
 */
@Slf4j
@Component
public class GitHubIssueClient implements IssueTrackerClient {

    static final String SERVICE_NAME = "GitHub";

    private final WebClient webClient;
    private final GitHubProperties properties;

    public GitHubIssueClient(@Qualifier("gitHubWebClient") WebClient webClient, GitHubProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured()
                && properties.getOwner() != null && !properties.getOwner().isBlank()
                && properties.getRepo() != null && !properties.getRepo().isBlank();
    }

    @Override
    @CircuitBreaker(name = "github", fallbackMethod = "createIssueFallback")
    public IssueResponse createIssue(CreateIssueRequest request) {
        log.info("Calling GitHub to create issue in {}/{}: {}", properties.getOwner(), properties.getRepo(), request.getTitle());

        try {
            return webClient.post()
                    .uri("/repos/{owner}/{repo}/issues", properties.getOwner(), properties.getRepo())
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(IssueResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to create GitHub issue '{}': {}", request.getTitle(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    @Override
    @CircuitBreaker(name = "github", fallbackMethod = "addCommentFallback")
    public CommentResponse addComment(int issueNumber, CreateCommentRequest request) {
        log.info("Calling GitHub to comment on issue #{} in {}/{}", issueNumber, properties.getOwner(), properties.getRepo());

        try {
            return webClient.post()
                    .uri("/repos/{owner}/{repo}/issues/{number}/comments",
                            properties.getOwner(), properties.getRepo(), issueNumber)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(CommentResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to comment on GitHub issue #{}: {}", issueNumber, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback when the circuit breaker is open. Other failures propagate unchanged.
     */
    @SuppressWarnings("unused")
    private IssueResponse createIssueFallback(CreateIssueRequest request, CallNotPermittedException e) {
        log.warn("Circuit breaker open for GitHub, issue '{}' not created", request.getTitle());
        throw ExternalServiceException.unavailable(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)");
    }

    @SuppressWarnings("unused")
    private CommentResponse addCommentFallback(int issueNumber, CreateCommentRequest request, CallNotPermittedException e) {
        log.warn("Circuit breaker open for GitHub, comment on issue #{} not added", issueNumber);
        throw ExternalServiceException.unavailable(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)");
    }
}
