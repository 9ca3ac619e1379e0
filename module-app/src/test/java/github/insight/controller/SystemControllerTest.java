package github.insight.controller;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import github.insight.controller.dto.CacheClearResponse;
import github.insight.controller.dto.HealthResponse;
import github.insight.global.error.GlobalExceptionHandler;
import github.insight.infrastructure.cache.CacheStats;
import github.insight.service.SystemStatusService;
import java.time.LocalDateTime;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("SystemController 단위 테스트")
class SystemControllerTest {

  private static final CacheStats LOCAL_ONLY =
      new CacheStats(3, 1000, 5, 2, false, false, null, null, null);

  @Mock private SystemStatusService systemStatusService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SystemController(systemStatusService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  @DisplayName("health: 캐시 통계와 GitHub 연결 상태를 담는다")
  void health() throws Exception {
    given(systemStatusService.health())
        .willReturn(
            new HealthResponse(
                HealthResponse.HEALTHY,
                "ok",
                "1.0.0",
                LocalDateTime.now(),
                LOCAL_ONLY,
                12.5,
                Map.of("heap_used", "10.0 MB"),
                "connected"));

    mockMvc
        .perform(get("/api/v1/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.github_api").value("connected"))
        .andExpect(jsonPath("$.cache.local_size").value(3))
        .andExpect(jsonPath("$.cache.remote_enabled").value(false));
  }

  @Test
  @DisplayName("점검 실패 시에도 200 + unhealthy, 부가 필드는 생략")
  void unhealthy() throws Exception {
    given(systemStatusService.health())
        .willReturn(HealthResponse.unhealthy("상태 점검 실패", "1.0.0"));

    mockMvc
        .perform(get("/api/v1/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("unhealthy"))
        .andExpect(jsonPath("$.cache").doesNotExist());
  }

  @Test
  @DisplayName("cache/stats")
  void cacheStats() throws Exception {
    given(systemStatusService.cacheStats()).willReturn(LOCAL_ONLY);

    mockMvc
        .perform(get("/api/v1/cache/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.local_hit_count").value(5))
        .andExpect(jsonPath("$.remote_used_memory").isEmpty());
  }

  @Test
  @DisplayName("cache/clear: 원격 실패는 success=false로 보고")
  void clearFailure() throws Exception {
    given(systemStatusService.clearCache()).willReturn(CacheClearResponse.of(false));

    mockMvc
        .perform(delete("/api/v1/cache/clear"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(false));
  }
}
