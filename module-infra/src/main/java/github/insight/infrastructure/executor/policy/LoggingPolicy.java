package github.insight.infrastructure.executor.policy;

import github.insight.error.exception.base.ClientBaseException;
import github.insight.infrastructure.executor.TaskContext;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * 작업 실행 결과별 로깅 정책 (Stateless)
 *
 * <ul>
 *   <li>성공: [Task:SUCCESS] → DEBUG, 임계치 이상이면 [Task:SLOW] → INFO
 *   <li>전파되는 실패: [Task:FAILURE] → ERROR (stacktrace). 클라이언트 예외(4xx)는 WARN
 *   <li>복구된 실패: [Task:RECOVERED] → DEBUG. 복구 측이 필요한 수준으로 직접 기록한다.
 * </ul>
 */
@Slf4j
public class LoggingPolicy {

  private static final long MAX_SLOW_MS = 60_000L;

  private final boolean slowEnabled;
  private final long slowThresholdMs;
  private final long slowThresholdNanos;

  /** @param slowMs slow 판정 임계치(ms). 0 이하면 SLOW 로그 비활성 */
  public LoggingPolicy(long slowMs) {
    long clamped = Math.max(0L, Math.min(slowMs, MAX_SLOW_MS));

    this.slowThresholdMs = clamped;
    this.slowEnabled = clamped > 0;
    this.slowThresholdNanos = slowEnabled ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;
  }

  public void onSuccess(long elapsedNanos, TaskContext context) {
    if (slowEnabled && elapsedNanos >= slowThresholdNanos) {
      log.info(
          "[Task:SLOW] {}, elapsed={}, threshold={}ms",
          context.toTaskName(),
          formatDuration(elapsedNanos),
          slowThresholdMs);
      return;
    }
    if (!log.isDebugEnabled()) return;
    log.debug("[Task:SUCCESS] {}, elapsed={}", context.toTaskName(), formatDuration(elapsedNanos));
  }

  public void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    String taskName = context.toTaskName();
    String elapsed = formatDuration(elapsedNanos);

    if (error instanceof ClientBaseException) {
      log.warn("[Task:FAILURE] {}, elapsed={}, reason={}", taskName, elapsed, error.getMessage());
      return;
    }
    log.error(
        "[Task:FAILURE] {}, elapsed={}, errorType={}",
        taskName,
        elapsed,
        error.getClass().getSimpleName(),
        error);
  }

  public void onRecovered(Throwable error, long elapsedNanos, TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug(
        "[Task:RECOVERED] {}, elapsed={}, errorType={}",
        context.toTaskName(),
        formatDuration(elapsedNanos),
        error.getClass().getSimpleName());
  }

  private static String formatDuration(long elapsedNanos) {
    double millis = elapsedNanos / 1_000_000d;
    return String.format(Locale.ROOT, "%.3fms", millis);
  }
}
