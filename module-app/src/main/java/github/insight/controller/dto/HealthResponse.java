package github.insight.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.insight.infrastructure.cache.CacheStats;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * GET /health
 *
 * <p>상태 점검 자체가 실패하면 status/message/version/timestamp만 채워집니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthResponse(
    String status,
    String message,
    String version,
    LocalDateTime timestamp,
    CacheStats cache,
    Double uptime,
    Map<String, String> memory,
    String githubApi) {

  public static final String HEALTHY = "healthy";
  public static final String UNHEALTHY = "unhealthy";

  public static HealthResponse unhealthy(String message, String version) {
    return new HealthResponse(
        UNHEALTHY, message, version, LocalDateTime.now(), null, null, null, null);
  }
}
