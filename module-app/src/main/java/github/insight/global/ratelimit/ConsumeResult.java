package github.insight.global.ratelimit;

/**
 * Rate Limit 토큰 소비 결과
 *
 * @param allowed 요청 허용 여부
 * @param remainingTokens 남은 토큰 수. -1이면 장애로 인한 Fail-Open
 * @param retryAfterSeconds 429 응답 시 Retry-After 헤더 값 (초)
 */
public record ConsumeResult(boolean allowed, long remainingTokens, long retryAfterSeconds) {

  public static ConsumeResult allowed(long remainingTokens) {
    return new ConsumeResult(true, remainingTokens, 0L);
  }

  public static ConsumeResult denied(long remainingTokens, long retryAfterSeconds) {
    return new ConsumeResult(false, remainingTokens, retryAfterSeconds);
  }

  public static ConsumeResult failOpen() {
    return new ConsumeResult(true, -1L, 0L);
  }

  public boolean isFailOpen() {
    return allowed && remainingTokens < 0;
  }
}
