package github.insight.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import github.insight.controller.dto.CacheClearResponse;
import github.insight.controller.dto.HealthResponse;
import github.insight.error.exception.ExternalServiceException;
import github.insight.external.GitHubApiClient;
import github.insight.infrastructure.cache.CacheStore;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.support.GitHubFixtures;
import github.insight.support.TestLogicExecutors;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SystemStatusServiceTest {

  private GitHubApiClient client;
  private CacheStore cacheStore;
  private SystemStatusService service;

  @BeforeEach
  void setUp() {
    client = mock(GitHubApiClient.class);
    LogicExecutor executor = TestLogicExecutors.real();
    cacheStore = GitHubFixtures.localOnlyCacheStore(executor);
    service = new SystemStatusService(cacheStore, client, executor, "9.9.9");
  }

  @Test
  @DisplayName("GitHub 연결이 정상이면 connected와 캐시 통계를 보고한다")
  void healthy() {
    given(client.fetch("/rate_limit")).willReturn(JsonNodeFactory.instance.objectNode());
    cacheStore.set("k", "v", Duration.ofMinutes(1));

    HealthResponse health = service.health();

    assertThat(health.status()).isEqualTo(HealthResponse.HEALTHY);
    assertThat(health.version()).isEqualTo("9.9.9");
    assertThat(health.githubApi()).isEqualTo("connected");
    assertThat(health.cache().localSize()).isEqualTo(1);
    assertThat(health.cache().remoteEnabled()).isFalse();
    assertThat(health.uptime()).isNotNull();
    assertThat(health.memory()).containsKeys("heap_used", "heap_total", "heap_max");
  }

  @Test
  @DisplayName("GitHub 호출이 실패해도 healthy이고 github_api에 요약된 오류를 담는다")
  void githubUnreachable() {
    given(client.fetch("/rate_limit")).willThrow(new ExternalServiceException("GitHub API"));

    HealthResponse health = service.health();

    assertThat(health.status()).isEqualTo(HealthResponse.HEALTHY);
    assertThat(health.githubApi()).startsWith("error: ").contains("GitHub API");
    assertThat(health.githubApi().length()).isLessThanOrEqualTo("error: ".length() + 50);
  }

  @Test
  @DisplayName("캐시 비우기 결과를 success 플래그로 돌려준다")
  void clearCache() {
    cacheStore.set("k", "v", Duration.ofMinutes(1));

    CacheClearResponse response = service.clearCache();

    assertThat(response.success()).isTrue();
    assertThat(service.cacheStats().localSize()).isZero();
  }
}
