package github.insight.global.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import github.insight.config.RateLimitProperties;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.infrastructure.executor.TaskContext;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * 클라이언트 키별 Bucket4j 토큰 버킷
 *
 * <p>분당 {@code requestsPerMinute}개 토큰을 greedy 방식으로 채웁니다. 버킷은 마지막 접근 후 2분이 지나면 제거되며, 제거된
 * 클라이언트는 가득 찬 버킷으로 다시 시작합니다.
 */
@Slf4j
public class ClientRateLimiter {

  private static final Duration REFILL_PERIOD = Duration.ofMinutes(1);
  private static final Duration IDLE_EVICTION = Duration.ofMinutes(2);

  private final RateLimitProperties properties;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final Cache<String, Bucket> buckets;

  public ClientRateLimiter(
      RateLimitProperties properties, LogicExecutor executor, MeterRegistry meterRegistry) {
    this.properties = properties;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.buckets =
        Caffeine.newBuilder()
            .maximumSize(properties.getMaxClients())
            .expireAfterAccess(IDLE_EVICTION)
            .build();
  }

  /** 토큰 1개 소비. 내부 오류가 나면 요청을 허용합니다 (Fail-Open). */
  public ConsumeResult tryConsume(String clientKey) {
    return executor.executeOrCatch(
        () -> doTryConsume(clientKey),
        e -> failOpen(clientKey),
        TaskContext.of("RateLimit", "Consume", maskKey(clientKey)));
  }

  private ConsumeResult doTryConsume(String clientKey) {
    ConsumptionProbe probe =
        buckets.get(clientKey, key -> newBucket()).tryConsumeAndReturnRemaining(1);

    recordMetrics(probe.isConsumed());

    if (probe.isConsumed()) {
      return ConsumeResult.allowed(probe.getRemainingTokens());
    }
    long retryAfterSeconds = TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill());
    return ConsumeResult.denied(probe.getRemainingTokens(), Math.max(retryAfterSeconds, 1));
  }

  private Bucket newBucket() {
    int limit = properties.getRequestsPerMinute();
    Bandwidth bandwidth =
        Bandwidth.builder().capacity(limit).refillGreedy(limit, REFILL_PERIOD).build();
    return Bucket.builder().addLimit(bandwidth).build();
  }

  private ConsumeResult failOpen(String clientKey) {
    log.warn("[RateLimit-FailOpen] Limiter failure, allowing request: key={}", maskKey(clientKey));
    meterRegistry.counter("ratelimit.failopen").increment();
    return ConsumeResult.failOpen();
  }

  private void recordMetrics(boolean consumed) {
    meterRegistry.counter("ratelimit.consume", "result", consumed ? "allowed" : "denied").increment();
  }

  static String maskKey(String key) {
    if (key == null || key.length() <= 4) {
      return "****";
    }
    return "****" + key.substring(key.length() - 4);
  }
}
