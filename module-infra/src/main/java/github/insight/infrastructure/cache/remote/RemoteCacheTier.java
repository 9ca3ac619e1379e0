package github.insight.infrastructure.cache.remote;

import java.time.Duration;
import java.util.Optional;

/**
 * 원격 캐시 계층 (직렬화된 문자열 값 저장소)
 *
 * <p>구현체는 장애를 예외로 알린다. 장애를 "값 없음"으로 바꾸는 일은 {@code CacheStore}가 맡는다.
 */
public interface RemoteCacheTier {

  Optional<String> get(String key);

  void set(String key, String payload, Duration ttl);

  boolean delete(String key);

  /** 현재 데이터베이스 전체를 비운다. */
  void clear();

  boolean ping();

  RemoteCacheInfo info();

  void shutdown();
}
