package github.insight.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import github.insight.external.GitHubApiClient;
import github.insight.infrastructure.cache.CacheStore;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 캐시를 경유하는 GitHub 조회
 *
 * <p>키는 네임스페이스, 경로, 쿼리 파라미터로 도출되므로 파라미터 순서가 달라도 같은 항목을 가리킵니다. 업스트림 예외는 캐시에 기록되지 않고
 * 그대로 전파됩니다.
 */
@Component
@RequiredArgsConstructor
public class GitHubCachedFetcher {

  private final CacheStore cacheStore;
  private final GitHubApiClient gitHubApiClient;

  public JsonNode fetch(CacheNamespace namespace, String path) {
    return fetch(namespace, path, Map.of());
  }

  public JsonNode fetch(CacheNamespace namespace, String path, Map<String, ?> queryParams) {
    String key = cacheStore.deriveKey(namespace.getKey(), List.of(path), queryParams);
    return cacheStore.getOrCompute(
        key,
        JsonNode.class,
        () -> gitHubApiClient.fetch(path, queryParams),
        namespace.getTtl());
  }
}
