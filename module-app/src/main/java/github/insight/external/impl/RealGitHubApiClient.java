package github.insight.external.impl;

import com.fasterxml.jackson.databind.JsonNode;
import github.insight.config.GitHubApiProperties;
import github.insight.error.exception.ExternalServiceException;
import github.insight.error.exception.GitHubResourceNotFoundException;
import github.insight.error.exception.base.BaseException;
import github.insight.external.GitHubApiClient;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.infrastructure.executor.TaskContext;
import github.insight.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * WebClient 기반 GitHub API 호출
 *
 * <p>서블릿 스레드에서 호출되므로 응답을 {@code block()}으로 기다리며, 대기 시간은 {@code github.api.response-timeout}으로
 * 제한합니다. 재시도와 서킷 브레이커는 {@link ResilientGitHubApiClient}가 담당합니다.
 */
@Slf4j
@Component("realGitHubApiClient")
@RequiredArgsConstructor
public class RealGitHubApiClient implements GitHubApiClient {

  static final String SERVICE_NAME = "GitHub API";

  private static final ExceptionTranslator UPSTREAM_TRANSLATOR =
      ExceptionTranslator.withErrorGuardAndUnwrap(
          (unwrapped, context) -> new ExternalServiceException(SERVICE_NAME, unwrapped));

  private final WebClient gitHubWebClient;
  private final GitHubApiProperties properties;
  private final LogicExecutor executor;

  @Override
  public JsonNode fetch(String path, Map<String, ?> queryParams) {
    return executor.executeWithTranslation(
        () -> request(path, queryParams),
        UPSTREAM_TRANSLATOR,
        TaskContext.of("GitHubApi", "fetch", path));
  }

  private JsonNode request(String path, Map<String, ?> queryParams) {
    JsonNode body =
        gitHubWebClient
            .get()
            .uri(
                builder -> {
                  Map<String, Object> values = new HashMap<>();
                  builder.path(path);
                  queryParams.forEach(
                      (name, value) -> {
                        builder.queryParam(name, "{" + name + "}");
                        values.put(name, value);
                      });
                  return builder.build(values);
                })
            .retrieve()
            .bodyToMono(JsonNode.class)
            .onErrorResume(
                WebClientResponseException.class, e -> Mono.error(toDomainException(path, e)))
            .timeout(properties.getResponseTimeout())
            .block();

    if (body == null) {
      throw new ExternalServiceException(SERVICE_NAME);
    }
    return body;
  }

  private BaseException toDomainException(String path, WebClientResponseException e) {
    if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
      log.debug("[GitHubApi] Resource not found: {}", path);
      return new GitHubResourceNotFoundException(path);
    }
    log.warn("[GitHubApi] Upstream responded {} for {}", e.getStatusCode().value(), path);
    return new ExternalServiceException(SERVICE_NAME, e);
  }
}
