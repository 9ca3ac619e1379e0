package github.insight.infrastructure.cache.remote;

import github.insight.infrastructure.config.CacheProperties;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.redisson.Redisson;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisMaster;
import org.redisson.api.redisnode.RedisNode;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.util.StringUtils;

/**
 * Redisson 기반 원격 캐시 계층 (단일 서버)
 *
 * <p>값은 {@link StringCodec}으로 저장한다. Redis에서 그대로 읽을 수 있는 JSON 텍스트다.
 */
@RequiredArgsConstructor
public class RedissonRemoteCacheTier implements RemoteCacheTier {

  private static final String REDISSON_HOST_PREFIX = "redis://";

  private final RedissonClient redissonClient;

  /**
   * 설정으로 클라이언트를 생성한다.
   *
   * <p>Redis에 연결할 수 없으면 Redisson이 예외를 던진다. 호출자가 로컬 전용 모드로 전환할지 결정한다.
   */
  public static RedissonRemoteCacheTier connect(CacheProperties.Remote remote) {
    return new RedissonRemoteCacheTier(Redisson.create(toConfig(remote)));
  }

  static Config toConfig(CacheProperties.Remote remote) {
    Config config = new Config();
    configureServer(config.useSingleServer(), remote);
    return config;
  }

  static SingleServerConfig configureServer(
      SingleServerConfig server, CacheProperties.Remote remote) {
    server
        .setAddress(REDISSON_HOST_PREFIX + remote.getHost() + ":" + remote.getPort())
        .setDatabase(remote.getDatabase())
        .setConnectTimeout(Math.toIntExact(remote.getConnectTimeout().toMillis()))
        .setTimeout(Math.toIntExact(remote.getReadTimeout().toMillis()))
        .setRetryAttempts(remote.getRetryAttempts())
        .setConnectionMinimumIdleSize(1)
        .setConnectionPoolSize(16);
    if (StringUtils.hasText(remote.getPassword())) {
      server.setPassword(remote.getPassword());
    }
    return server;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(bucket(key).get());
  }

  @Override
  public void set(String key, String payload, Duration ttl) {
    bucket(key).set(payload, ttl);
  }

  @Override
  public boolean delete(String key) {
    return bucket(key).delete();
  }

  @Override
  public void clear() {
    redissonClient.getKeys().flushdb();
  }

  @Override
  public boolean ping() {
    return redissonClient.getRedisNodes(RedisNodes.SINGLE).pingAll();
  }

  @Override
  public RemoteCacheInfo info() {
    RedisMaster master = redissonClient.getRedisNodes(RedisNodes.SINGLE).getInstance();
    Map<String, String> memory = master.info(RedisNode.InfoSection.MEMORY);
    Map<String, String> stats = master.info(RedisNode.InfoSection.STATS);
    return new RemoteCacheInfo(
        true,
        memory.get("used_memory_human"),
        parseLong(stats.get("keyspace_hits")),
        parseLong(stats.get("keyspace_misses")));
  }

  @Override
  public void shutdown() {
    if (!redissonClient.isShutdown()) {
      redissonClient.shutdown();
    }
  }

  private RBucket<String> bucket(String key) {
    return redissonClient.getBucket(key, StringCodec.INSTANCE);
  }

  private static Long parseLong(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    return Long.valueOf(value.trim());
  }
}
