package github.insight.infrastructure.config;

import static org.assertj.core.api.Assertions.assertThat;

import github.insight.infrastructure.cache.CacheStats;
import github.insight.infrastructure.cache.CacheStore;
import github.insight.support.TestLogicExecutors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CacheStoreConfigTest {

  private final AtomicInteger connectCalls = new AtomicInteger();

  private CacheStore build(boolean remoteEnabled) {
    CacheProperties properties = new CacheProperties();
    properties.getRemote().setEnabled(remoteEnabled);
    return new CacheStoreConfig()
        .buildCacheStore(
            properties,
            TestLogicExecutors.real(),
            new SimpleMeterRegistry(),
            remote -> {
              connectCalls.incrementAndGet();
              throw new IllegalStateException("connection refused");
            });
  }

  @Test
  @DisplayName("Redis 클라이언트 생성이 실패해도 기동하며 원격 활성/미연결로 보고한다")
  void client_creation_failure_falls_back_to_local() {
    CacheStore store = build(true);

    CacheStats stats = store.stats();
    assertThat(connectCalls).hasValue(1);
    assertThat(stats.remoteEnabled()).isTrue();
    assertThat(stats.remoteConnected()).isFalse();
    assertThat(store.isRemoteActive()).isFalse();

    assertThat(store.set("k", "v", null)).isTrue();
    assertThat(store.get("k", String.class)).contains("v");
  }

  @Test
  @DisplayName("원격 계층이 비활성이면 클라이언트를 만들지 않는다")
  void disabled_remote_never_connects() {
    CacheStore store = build(false);

    assertThat(connectCalls).hasValue(0);
    assertThat(store.stats().remoteEnabled()).isFalse();
    assertThat(store.isRemoteActive()).isFalse();
  }
}
