package github.insight.service;

import github.insight.controller.dto.CacheClearResponse;
import github.insight.controller.dto.HealthResponse;
import github.insight.external.GitHubApiClient;
import github.insight.external.GitHubPaths;
import github.insight.infrastructure.cache.CacheStats;
import github.insight.infrastructure.cache.CacheStore;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.infrastructure.executor.TaskContext;
import github.insight.infrastructure.util.ExceptionUtils;
import java.lang.management.ManagementFactory;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** 헬스 체크와 캐시 관리 */
@Slf4j
@Service
public class SystemStatusService {

  static final String GITHUB_CONNECTED = "connected";
  private static final int ERROR_SUMMARY_LENGTH = 50;
  private static final double BYTES_PER_MB = 1024d * 1024d;

  private final CacheStore cacheStore;
  private final GitHubApiClient gitHubApiClient;
  private final LogicExecutor executor;
  private final String version;

  public SystemStatusService(
      CacheStore cacheStore,
      GitHubApiClient gitHubApiClient,
      LogicExecutor executor,
      @Value("${info.app.version:1.0.0}") String version) {
    this.cacheStore = cacheStore;
    this.gitHubApiClient = gitHubApiClient;
    this.executor = executor;
    this.version = version;
  }

  /** 점검 중 예기치 못한 실패는 500 대신 {@code unhealthy} 응답으로 보고합니다. */
  public HealthResponse health() {
    return executor.executeOrCatch(
        this::collectHealth,
        e -> {
          log.error("[Health] Health check failed", e);
          return HealthResponse.unhealthy(
              "상태 점검 실패: " + ExceptionUtils.describe(e), version);
        },
        TaskContext.of("Health", "collect"));
  }

  private HealthResponse collectHealth() {
    String githubStatus = checkGitHub();
    double uptimeSeconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000d;
    log.info("[Health] uptime={}s, github={}", uptimeSeconds, githubStatus);

    return new HealthResponse(
        HealthResponse.HEALTHY,
        "GitHub Insight API가 정상 동작 중입니다.",
        version,
        LocalDateTime.now(),
        cacheStore.stats(),
        Math.round(uptimeSeconds * 100) / 100d,
        memoryUsage(),
        githubStatus);
  }

  private String checkGitHub() {
    return executor.executeOrCatch(
        () -> {
          gitHubApiClient.fetch(GitHubPaths.RATE_LIMIT);
          return GITHUB_CONNECTED;
        },
        e -> {
          log.warn("[Health] GitHub API unreachable: {}", e.getMessage());
          return "error: " + abbreviate(String.valueOf(e.getMessage()));
        },
        TaskContext.of("Health", "pingGitHub"));
  }

  private Map<String, String> memoryUsage() {
    Runtime runtime = Runtime.getRuntime();
    Map<String, String> memory = new LinkedHashMap<>();
    memory.put("heap_used", megabytes(runtime.totalMemory() - runtime.freeMemory()));
    memory.put("heap_total", megabytes(runtime.totalMemory()));
    memory.put("heap_max", megabytes(runtime.maxMemory()));
    return memory;
  }

  public CacheStats cacheStats() {
    return cacheStore.stats();
  }

  public CacheClearResponse clearCache() {
    boolean cleared = cacheStore.clear();
    log.info("[CacheStore] Clear requested, success={}", cleared);
    return CacheClearResponse.of(cleared);
  }

  private static String megabytes(long bytes) {
    return String.format(Locale.ROOT, "%.1f MB", bytes / BYTES_PER_MB);
  }

  private static String abbreviate(String text) {
    return text.length() <= ERROR_SUMMARY_LENGTH ? text : text.substring(0, ERROR_SUMMARY_LENGTH);
  }
}
