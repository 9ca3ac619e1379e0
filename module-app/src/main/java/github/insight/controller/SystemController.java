package github.insight.controller;

import github.insight.controller.dto.CacheClearResponse;
import github.insight.controller.dto.HealthResponse;
import github.insight.infrastructure.cache.CacheStats;
import github.insight.service.SystemStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SystemController {

  private final SystemStatusService systemStatusService;

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(systemStatusService.health());
  }

  @GetMapping("/cache/stats")
  public ResponseEntity<CacheStats> cacheStats() {
    return ResponseEntity.ok(systemStatusService.cacheStats());
  }

  /** 로컬과 원격 캐시를 모두 비웁니다. 원격 실패 시 success=false. */
  @DeleteMapping("/cache/clear")
  public ResponseEntity<CacheClearResponse> clearCache() {
    return ResponseEntity.ok(systemStatusService.clearCache());
  }
}
