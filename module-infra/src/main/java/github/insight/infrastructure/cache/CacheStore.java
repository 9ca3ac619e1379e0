package github.insight.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import github.insight.infrastructure.cache.remote.RemoteCacheInfo;
import github.insight.infrastructure.cache.remote.RemoteCacheTier;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.infrastructure.executor.TaskContext;
import github.insight.infrastructure.util.ExceptionUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 2계층 캐시 저장소 (로컬: Caffeine, 원격: Redis)
 *
 * <h4>읽기/쓰기 경로</h4>
 *
 * <ul>
 *   <li>get: 원격 → 로컬 순서. 원격 미스나 장애면 로컬을 본다.
 *   <li>set: 원격에 JSON으로 기록. 직렬화/연결/타임아웃 등 어떤 실패든 로컬에만 기록한다. 로컬 계층도 JSON 트리 사본을
 *       보관하므로 저장 후 원본 객체를 바꿔도 캐시 값은 그대로다.
 *   <li>delete: 두 계층 모두에서 제거.
 *   <li>clear: 두 계층 모두 비운다 (원격은 FLUSHDB).
 * </ul>
 *
 * <h4>장애 격리</h4>
 *
 * <ul>
 *   <li>원격 계층 예외는 호출자에게 전파되지 않는다. "값 없음" 또는 "로컬에만 기록"으로 강등된다.
 *   <li>생성 시점에 원격 계층이 응답하지 않으면 수명 내내 로컬 전용으로 동작한다. 재연결은 시도하지 않는다.
 *   <li>{@link #getOrCompute}의 producer 예외는 그대로 전파된다.
 * </ul>
 *
 * <p>읽기-미스-계산-쓰기 구간에 락을 잡지 않는다. 동시 미스에서 producer 중복 호출을 허용한다.
 */
@Slf4j
public class CacheStore implements AutoCloseable {

  private static final String COMPONENT = "CacheStore";

  private final LocalCacheTier localTier;
  private final RemoteCacheTier remoteTier; // null이면 로컬 전용
  private final boolean remoteEnabled;
  private final CacheValueSerializer serializer;
  private final CacheKeyGenerator keyGenerator;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final Duration defaultTtl;

  private final Counter localHitCounter;
  private final Counter remoteHitCounter;
  private final Counter missCounter;

  /**
   * @param remoteTier 연결된 원격 계층. 설정상 사용하지만 클라이언트 생성에 실패했으면 {@code null}
   * @param remoteEnabled 설정상 원격 계층 사용 여부. 통계의 {@code remoteEnabled}로 그대로 보고한다.
   */
  public CacheStore(
      LocalCacheTier localTier,
      RemoteCacheTier remoteTier,
      boolean remoteEnabled,
      CacheValueSerializer serializer,
      CacheKeyGenerator keyGenerator,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Duration defaultTtl) {
    this.localTier = Objects.requireNonNull(localTier, "localTier");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.defaultTtl = requirePositive(defaultTtl);
    this.remoteEnabled = remoteEnabled;
    this.remoteTier = remoteTier != null && probe(remoteTier) ? remoteTier : null;

    this.localHitCounter =
        Counter.builder("cache.hit").tag("layer", "local").register(meterRegistry);
    this.remoteHitCounter =
        Counter.builder("cache.hit").tag("layer", "remote").register(meterRegistry);
    this.missCounter = Counter.builder("cache.miss").register(meterRegistry);
  }

  /** 원격 계층을 쓰고 있는지 여부. 생성 시 연결에 실패했으면 false. */
  public boolean isRemoteActive() {
    return remoteTier != null;
  }

  public Duration getDefaultTtl() {
    return defaultTtl;
  }

  // ==================== 조회 ====================

  public <T> Optional<T> get(String key, Class<T> type) {
    return lookup(key, serializer.typeOf(type));
  }

  public <T> Optional<T> get(String key, TypeReference<T> type) {
    return lookup(key, serializer.typeOf(type));
  }

  private <T> Optional<T> lookup(String key, JavaType type) {
    Objects.requireNonNull(key, "key");

    Optional<T> remote = readRemote(key, type);
    if (remote.isPresent()) {
      remoteHitCounter.increment();
      return remote;
    }

    Optional<T> local = readLocal(key, type);
    if (local.isPresent()) {
      localHitCounter.increment();
      return local;
    }

    missCounter.increment();
    return Optional.empty();
  }

  private <T> Optional<T> readRemote(String key, JavaType type) {
    if (remoteTier == null) {
      return Optional.empty();
    }
    return executor.executeOrCatch(
        () -> remoteTier.get(key).map(payload -> serializer.<T>deserialize(key, payload, type)),
        e -> degrade("get", key, e, Optional.<T>empty()),
        TaskContext.of(COMPONENT, "getRemote", key));
  }

  private <T> Optional<T> readLocal(String key, JavaType type) {
    Optional<Object> stored = localTier.get(key);
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    return executor.executeOrCatch(
        () -> Optional.ofNullable(serializer.<T>convert(key, stored.get(), type)),
        e -> discardLocal(key, e),
        TaskContext.of(COMPONENT, "getLocal", key));
  }

  // 요청 타입으로 변환할 수 없는 로컬 값은 미스로 취급한다.
  private <T> Optional<T> discardLocal(String key, Throwable cause) {
    log.warn(
        "[CacheStore] Local value not convertible, treating as miss: key={}, cause={}",
        key,
        ExceptionUtils.describe(cause));
    return Optional.empty();
  }

  // ==================== 저장/삭제 ====================

  /** 기본 TTL로 저장 */
  public boolean set(String key, Object value) {
    return set(key, value, defaultTtl);
  }

  /**
   * 값 저장
   *
   * @param ttl {@code null}이면 기본 TTL
   * @return 어느 한 계층에라도 저장했으면 true. {@code null} 값이나 0 이하 TTL은 저장하지 않고 false.
   */
  public boolean set(String key, Object value, Duration ttl) {
    Objects.requireNonNull(key, "key");
    Duration effectiveTtl = ttl == null ? defaultTtl : ttl;
    if (value == null) {
      return false;
    }
    if (effectiveTtl.isZero() || effectiveTtl.isNegative()) {
      log.warn(
          "[CacheStore] Non-positive ttl, value not stored: key={}, ttl={}", key, effectiveTtl);
      return false;
    }

    if (remoteTier != null && writeRemote(key, value, effectiveTtl)) {
      return true;
    }
    localTier.put(key, localCopy(key, value), effectiveTtl);
    return true;
  }

  // 트리로 만들 수 없는 값은 원본 그대로 로컬에 둔다.
  private Object localCopy(String key, Object value) {
    return executor.executeOrCatch(
        () -> serializer.snapshot(key, value),
        e -> {
          log.warn(
              "[CacheStore] Snapshot failed, keeping caller instance locally: key={}, cause={}",
              key,
              ExceptionUtils.describe(e));
          return value;
        },
        TaskContext.of(COMPONENT, "snapshotLocal", key));
  }

  private boolean writeRemote(String key, Object value, Duration ttl) {
    return executor.executeOrCatch(
        () -> {
          remoteTier.set(key, serializer.serialize(key, value), ttl);
          return true;
        },
        e -> degrade("set", key, e, false),
        TaskContext.of(COMPONENT, "setRemote", key));
  }

  /** @return 어느 한 계층에서라도 제거했으면 true */
  public boolean delete(String key) {
    Objects.requireNonNull(key, "key");

    boolean remoteRemoved =
        remoteTier != null
            && executor.executeOrCatch(
                () -> remoteTier.delete(key),
                e -> degrade("delete", key, e, false),
                TaskContext.of(COMPONENT, "deleteRemote", key));
    boolean localRemoved = localTier.remove(key);
    return remoteRemoved || localRemoved;
  }

  /**
   * 두 계층을 모두 비운다.
   *
   * <p>로컬은 항상 비워지며, 원격 비우기에 실패한 경우에만 false.
   */
  public boolean clear() {
    localTier.clear();
    if (remoteTier == null) {
      return true;
    }
    return executor.executeOrCatch(
        () -> {
          remoteTier.clear();
          return true;
        },
        e -> degrade("clear", "*", e, false),
        TaskContext.of(COMPONENT, "clearRemote"));
  }

  // ==================== 조회 또는 계산 ====================

  /**
   * 캐시에 없으면 producer로 계산해 저장 후 반환
   *
   * <p>producer는 미스일 때 정확히 1회 호출된다. producer 예외는 가공 없이 전파되며, {@code null} 결과는 반환만 하고 저장하지
   * 않는다.
   */
  public <T> T getOrCompute(String key, Class<T> type, Supplier<T> producer, Duration ttl) {
    return getOrCompute(key, serializer.typeOf(type), producer, ttl);
  }

  public <T> T getOrCompute(
      String key, TypeReference<T> type, Supplier<T> producer, Duration ttl) {
    return getOrCompute(key, serializer.typeOf(type), producer, ttl);
  }

  private <T> T getOrCompute(String key, JavaType type, Supplier<T> producer, Duration ttl) {
    Objects.requireNonNull(producer, "producer");

    Optional<T> cached = lookup(key, type);
    if (cached.isPresent()) {
      return cached.get();
    }

    T value = producer.get();
    if (value != null) {
      set(key, value, ttl);
    }
    return value;
  }

  // ==================== 키/통계 ====================

  public String deriveKey(String namespace, List<?> positional, Map<String, ?> named) {
    return keyGenerator.derive(namespace, positional, named);
  }

  public String deriveKey(String namespace, Object... positional) {
    return keyGenerator.derive(namespace, positional);
  }

  /** 통계 스냅샷. 실패하지 않으며 원격 정보를 못 가져오면 미연결로 표시한다. */
  public CacheStats stats() {
    RemoteCacheInfo info =
        remoteTier == null
            ? RemoteCacheInfo.unavailable()
            : executor.executeOrCatch(
                remoteTier::info,
                e -> degrade("stats", "-", e, RemoteCacheInfo.unavailable()),
                TaskContext.of(COMPONENT, "statsRemote"));

    return new CacheStats(
        localTier.size(),
        localTier.capacity(),
        localTier.hitCount(),
        localTier.missCount(),
        remoteEnabled,
        info.connected(),
        info.usedMemory(),
        info.keyspaceHits(),
        info.keyspaceMisses());
  }

  /** 원격 클라이언트를 정리한다. 실패는 로그와 메트릭으로만 남는다. */
  @Override
  public void close() {
    if (remoteTier != null) {
      shutdown(remoteTier);
    }
  }

  // ==================== 내부 ====================

  private boolean probe(RemoteCacheTier candidate) {
    boolean reachable =
        executor.executeOrCatch(
            candidate::ping,
            e -> degrade("ping", "-", e, false),
            TaskContext.of(COMPONENT, "probe"));
    if (reachable) {
      log.info("[CacheStore] Remote tier connected, running in two-tier mode");
      return true;
    }

    log.warn("[CacheStore] Remote tier unreachable at startup, running local-only");
    shutdown(candidate);
    return false;
  }

  private boolean shutdown(RemoteCacheTier tier) {
    boolean closed =
        executor.executeOrCatch(
            () -> {
              tier.shutdown();
              return true;
            },
            e -> degrade("shutdown", "-", e, false),
            TaskContext.of(COMPONENT, "shutdown"));
    log.info("[CacheStore] Remote client shutdown, success={}", closed);
    return closed;
  }

  private <R> R degrade(String operation, String key, Throwable cause, R fallback) {
    meterRegistry.counter("cache.remote.failure", "operation", operation).increment();
    log.warn(
        "[CacheStore] Remote {} failed, degrading: key={}, cause={}",
        operation,
        key,
        ExceptionUtils.describe(cause));
    return fallback;
  }

  // 기본 TTL은 설정값이므로 잘못되면 기동을 막는다.
  private static Duration requirePositive(Duration ttl) {
    Objects.requireNonNull(ttl, "defaultTtl");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("defaultTtl must be positive: " + ttl);
    }
    return ttl;
  }
}
