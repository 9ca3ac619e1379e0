package github.insight.infrastructure.config;

import github.insight.infrastructure.cache.CacheKeyGenerator;
import github.insight.infrastructure.cache.CacheStore;
import github.insight.infrastructure.cache.CacheValueSerializer;
import github.insight.infrastructure.cache.LocalCacheTier;
import github.insight.infrastructure.cache.remote.RedissonRemoteCacheTier;
import github.insight.infrastructure.cache.remote.RemoteCacheTier;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.infrastructure.executor.TaskContext;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CacheStore 조립
 *
 * <p>원격 계층은 {@code cache.remote.enabled=true}일 때만 생성을 시도한다. 클라이언트 생성 자체가 실패해도 애플리케이션 기동은
 * 막지 않고 로컬 전용으로 동작한다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheStoreConfig {

  @Bean(destroyMethod = "close")
  public CacheStore cacheStore(
      CacheProperties properties, LogicExecutor executor, MeterRegistry meterRegistry) {
    return buildCacheStore(properties, executor, meterRegistry, RedissonRemoteCacheTier::connect);
  }

  CacheStore buildCacheStore(
      CacheProperties properties,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Function<CacheProperties.Remote, RemoteCacheTier> connector) {
    CacheProperties.Remote remote = properties.getRemote();
    return new CacheStore(
        new LocalCacheTier(properties.getLocalCapacity()),
        connectRemote(remote, executor, connector),
        remote.isEnabled(),
        new CacheValueSerializer(CacheValueSerializer.defaultObjectMapper(), executor),
        new CacheKeyGenerator(),
        executor,
        meterRegistry,
        properties.getDefaultTtl());
  }

  private RemoteCacheTier connectRemote(
      CacheProperties.Remote remote,
      LogicExecutor executor,
      Function<CacheProperties.Remote, RemoteCacheTier> connector) {
    if (!remote.isEnabled()) {
      log.info("[CacheStore] Remote tier disabled, running local-only");
      return null;
    }
    return executor.executeOrCatch(
        () -> connector.apply(remote),
        e -> {
          log.warn(
              "[CacheStore] Redis client creation failed, running local-only: {}:{}",
              remote.getHost(),
              remote.getPort());
          return null;
        },
        TaskContext.of("CacheStore", "connect", remote.getHost() + ":" + remote.getPort()));
  }
}
