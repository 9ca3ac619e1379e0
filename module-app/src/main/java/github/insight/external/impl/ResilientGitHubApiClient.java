package github.insight.external.impl;

import com.fasterxml.jackson.databind.JsonNode;
import github.insight.error.exception.ExternalServiceException;
import github.insight.error.exception.base.BaseException;
import github.insight.external.GitHubApiClient;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Resilience4j 데코레이터
 *
 * <p>인스턴스 {@code githubApi}의 Retry가 CircuitBreaker를 감쌉니다. 404는 두 정책 모두 무시하도록 설정되어 재시도 없이
 * 그대로 전파됩니다.
 */
@Slf4j
@Primary
@Component
public class ResilientGitHubApiClient implements GitHubApiClient {

  private static final String GITHUB_API = "githubApi";

  private final GitHubApiClient delegate;

  public ResilientGitHubApiClient(@Qualifier("realGitHubApiClient") GitHubApiClient delegate) {
    this.delegate = delegate;
  }

  @Override
  @CircuitBreaker(name = GITHUB_API)
  @Retry(name = GITHUB_API, fallbackMethod = "fetchFallback")
  public JsonNode fetch(String path, Map<String, ?> queryParams) {
    return delegate.fetch(path, queryParams);
  }

  /** 이미 규격화된 예외는 유지하고, 서킷 오픈 등 나머지는 외부 서비스 장애로 감쌉니다. */
  public JsonNode fetchFallback(String path, Map<String, ?> queryParams, Throwable t) {
    if (t instanceof BaseException be) {
      throw be;
    }
    if (t instanceof CallNotPermittedException) {
      log.warn("[Resilience] Circuit open, rejecting GitHub call: {}", path);
    } else {
      log.error("[Resilience] GitHub call failed after retries: {}", path, t);
    }
    throw new ExternalServiceException(RealGitHubApiClient.SERVICE_NAME, t);
  }
}
