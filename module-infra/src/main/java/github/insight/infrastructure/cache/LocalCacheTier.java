package github.insight.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.time.Duration;
import java.util.Optional;

/**
 * 프로세스 내 로컬 캐시 계층 (Caffeine)
 *
 * <ul>
 *   <li>최대 항목 수 제한. 초과 시 W-TinyLFU 정책으로 축출하며 쓰기는 실패하지 않는다.
 *   <li>항목별 TTL. 만료된 항목은 조회 시점에 보이지 않는다.
 *   <li>유지보수 작업은 호출 스레드에서 수행한다. 축출 결과가 즉시 반영된다.
 * </ul>
 */
public class LocalCacheTier {

  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private final Cache<String, Entry> cache;
  private final int capacity;

  public LocalCacheTier(int capacity) {
    this(capacity, Ticker.systemTicker());
  }

  /** @param ticker 만료 판정용 시계 (테스트에서 시간을 제어할 때 주입) */
  public LocalCacheTier(int capacity, Ticker ticker) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(capacity)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .executor(Runnable::run)
            .recordStats()
            .build();
  }

  public Optional<Object> get(String key) {
    Entry entry = cache.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value());
  }

  public void put(String key, Object value, Duration ttl) {
    cache.put(key, new Entry(value, saturatedNanos(ttl)));
  }

  public boolean remove(String key) {
    return cache.asMap().remove(key) != null;
  }

  public void clear() {
    cache.invalidateAll();
    cache.cleanUp();
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  public int capacity() {
    return capacity;
  }

  public long hitCount() {
    return stats().hitCount();
  }

  public long missCount() {
    return stats().missCount();
  }

  private CacheStats stats() {
    return cache.stats();
  }

  // Duration.toNanos()는 약 292년을 넘으면 ArithmeticException
  static long saturatedNanos(Duration ttl) {
    return ttl.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : ttl.toNanos();
  }

  private record Entry(Object value, long ttlNanos) {}

  /** 쓰기마다 해당 항목의 TTL로 만료 시각을 다시 잡고, 읽기는 만료 시각을 바꾸지 않는다. */
  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry entry, long currentTime, long currentDuration) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
